package com.tencent.hpcflow.infrastructure.persistence.environment.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * EnvironmentDO - 命名环境数据对象
 *
 * @author hpcflow
 */
@Data
@TableName(value = "environment", autoResultMap = true)
public class EnvironmentDO {

    @TableId(type = IdType.AUTO)
    private Long id;

    /**
     * 环境名称
     */
    private String name;

    /**
     * 环境变量（JSON）
     */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private Map<String, String> variables;

    /**
     * 模块列表（JSON）
     */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private List<String> modules;

    /**
     * 编译优化参数（JSON）
     */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private List<String> optimizationFlags;

    private String optimizationLevel;
}
