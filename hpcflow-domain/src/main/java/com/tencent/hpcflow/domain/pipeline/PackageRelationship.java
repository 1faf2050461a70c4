package com.tencent.hpcflow.domain.pipeline;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * PackageRelationship - 包目录声明的包间关系
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PackageRelationship {

    public enum Kind {
        DEPENDS_ON,
        CONFLICTS_WITH,
        COMPLEMENTS
    }

    private String from;

    private String to;

    private Kind kind;

    /**
     * 关系的另一端是否已在流水线中
     */
    private boolean satisfiedInPipeline;
}
