package com.tencent.hpcflow.domain.pkg;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ParameterDefinition - 包参数声明（值对象）
 * <p>
 * 声明参数名、类型、默认值与约束。包配置在 addPackage/configure 时
 * 依据这份声明校验，而不是依赖运行时反射。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParameterDefinition {

    /**
     * 参数名，在同一个包内唯一
     */
    private String name;

    /**
     * 参数类型
     */
    private ParameterType type;

    /**
     * 是否必需
     */
    @Builder.Default
    private boolean required = false;

    /**
     * 参数描述
     */
    private String description;

    /**
     * 默认值（非必需参数缺省时填入）
     */
    private Object defaultValue;

    /**
     * 约束
     */
    private ParameterConstraint constraint;
}
