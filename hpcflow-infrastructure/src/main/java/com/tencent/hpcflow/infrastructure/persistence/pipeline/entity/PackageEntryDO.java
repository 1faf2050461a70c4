package com.tencent.hpcflow.infrastructure.persistence.pipeline.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import lombok.Data;

import java.util.Map;

/**
 * PackageEntryDO - 流水线包数据对象
 *
 * @author hpcflow
 */
@Data
@TableName(value = "pipeline_package", autoResultMap = true)
public class PackageEntryDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    /**
     * 所属流水线ID（外键）
     */
    private Long pipelineId;

    /**
     * 包名
     */
    private String name;

    /**
     * 包类型
     */
    private String type;

    /**
     * 包配置（JSON）
     */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private Map<String, Object> config;

    /**
     * 在流水线中的位置
     */
    private Integer position;
}
