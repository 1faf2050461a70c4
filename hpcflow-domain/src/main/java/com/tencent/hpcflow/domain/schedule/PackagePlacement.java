package com.tencent.hpcflow.domain.schedule;

import com.tencent.hpcflow.domain.pkg.PackageType;
import com.tencent.hpcflow.domain.resource.ResourceDemand;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * PackagePlacement - 一个包在某节点上的放置与预留
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PackagePlacement {

    private String packageName;

    private PackageType type;

    /**
     * 包在流水线中的位置
     */
    private int order;

    private ResourceDemand reservation;
}
