package com.tencent.hpcflow.infrastructure.persistence.pipeline.entity;

import com.baomidou.mybatisplus.annotation.FieldStrategy;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.annotation.Version;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * PipelineDO - 流水线数据对象
 *
 * 注意：id 字段仅用于基础设施层的数据库操作，不应暴露到领域层
 * 领域层使用 name 作为业务标识
 *
 * @author hpcflow
 */
@Data
@TableName(value = "pipeline", autoResultMap = true)
public class PipelineDO {

    /**
     * 主键ID（仅用于基础设施层，不暴露到领域层）
     */
    @TableId(type = IdType.AUTO)
    private Long id;

    /**
     * 流水线名称
     */
    private String name;

    @TableField(updateStrategy = FieldStrategy.ALWAYS)
    private String description;

    /**
     * 流水线状态
     */
    private String status;

    /**
     * 关联的环境快照（JSON）
     */
    @TableField(typeHandler = JacksonTypeHandler.class, updateStrategy = FieldStrategy.ALWAYS)
    private Map<String, Object> environment;

    /**
     * 执行方式配置（JSON）
     */
    @TableField(typeHandler = JacksonTypeHandler.class, updateStrategy = FieldStrategy.ALWAYS)
    private Map<String, Object> executionMethod;

    private Instant createdAt;

    private Instant updatedAt;

    /**
     * 乐观锁版本号
     */
    @Version
    private Integer revision;
}
