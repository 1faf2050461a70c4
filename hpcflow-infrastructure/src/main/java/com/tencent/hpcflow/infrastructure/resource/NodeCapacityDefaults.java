package com.tencent.hpcflow.infrastructure.resource;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * NodeCapacityDefaults - 无法从硬件代理获取时使用的节点容量
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeCapacityDefaults {

    @Builder.Default
    private int cores = 8;

    @Builder.Default
    private long memoryMb = 16384;

    @Builder.Default
    private long storageGb = 100;

    @Builder.Default
    private double storageBandwidthMbps = 500;

    @Builder.Default
    private double networkBandwidthMbps = 1000;
}
