package com.tencent.hpcflow.infrastructure.resource;

import lombok.Data;

/**
 * HardwareReport - 硬件代理 /api/hardware 的响应
 */
@Data
public class HardwareReport {
    private Integer cores;
    private Long memoryMb;
    private Long storageGb;
    private Double storageBandwidthMbps;
    private Double networkBandwidthMbps;
}
