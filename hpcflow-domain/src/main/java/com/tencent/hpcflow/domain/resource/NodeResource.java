package com.tencent.hpcflow.domain.resource;

import lombok.Builder;
import lombok.Value;

/**
 * NodeResource - 集群节点的容量描述
 */
@Value
@Builder(toBuilder = true)
public class NodeResource {

    /**
     * 数字编号，与 hostfile 中的行序一致，调度平局时取较小者
     */
    int id;

    /**
     * 主机名或地址
     */
    String host;

    int cores;

    long memoryMb;

    long storageGb;

    /**
     * 存储带宽 (MB/s)
     */
    double storageBandwidthMbps;

    /**
     * 网络带宽 (MB/s)
     */
    double networkBandwidthMbps;

    public ResourceDemand capacity() {
        return ResourceDemand.of(cores, memoryMb, storageGb);
    }
}
