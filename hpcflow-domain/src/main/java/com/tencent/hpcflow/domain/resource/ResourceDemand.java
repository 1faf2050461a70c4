package com.tencent.hpcflow.domain.resource;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * ResourceDemand - 资源需求（值对象）
 * <p>
 * 同时用于包的资源需求、节点上的预留量以及节点容量。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ResourceDemand {

    public static final String CORES_KEY = "cores";

    public static final String MEMORY_KEY = "memory_mb";

    public static final String STORAGE_KEY = "storage_gb";

    public static final ResourceDemand NONE = new ResourceDemand(0, 0L, 0L);

    int cores;

    long memoryMb;

    long storageGb;

    public static ResourceDemand of(int cores, long memoryMb, long storageGb) {
        return new ResourceDemand(cores, memoryMb, storageGb);
    }

    public ResourceDemand plus(ResourceDemand other) {
        return new ResourceDemand(cores + other.cores, memoryMb + other.memoryMb, storageGb + other.storageGb);
    }

    public ResourceDemand minus(ResourceDemand other) {
        return new ResourceDemand(cores - other.cores, memoryMb - other.memoryMb, storageGb - other.storageGb);
    }

    /**
     * 每一维都不超过给定容量
     */
    public boolean fitsWithin(ResourceDemand capacity) {
        return cores <= capacity.cores && memoryMb <= capacity.memoryMb && storageGb <= capacity.storageGb;
    }

    /**
     * 用配置中的显式键覆盖对应维度
     */
    public ResourceDemand overriddenBy(Map<String, Object> config) {
        if (config == null || config.isEmpty()) {
            return this;
        }
        return new ResourceDemand(
                config.get(CORES_KEY) instanceof Number ? ((Number) config.get(CORES_KEY)).intValue() : cores,
                config.get(MEMORY_KEY) instanceof Number ? ((Number) config.get(MEMORY_KEY)).longValue() : memoryMb,
                config.get(STORAGE_KEY) instanceof Number ? ((Number) config.get(STORAGE_KEY)).longValue() : storageGb);
    }

    /**
     * 描述相对于可用量的缺口，如 "needs 8 cores but at most 4 are free"
     */
    public String describeShortfall(ResourceDemand available) {
        List<String> parts = new ArrayList<>();
        if (cores > available.cores) {
            parts.add("needs " + cores + " cores but at most " + available.cores + " are free");
        }
        if (memoryMb > available.memoryMb) {
            parts.add("needs " + memoryMb + " MB memory but at most " + available.memoryMb + " MB are free");
        }
        if (storageGb > available.storageGb) {
            parts.add("needs " + storageGb + " GB storage but at most " + available.storageGb + " GB are free");
        }
        return parts.isEmpty() ? "no eligible node" : String.join(", ", parts);
    }

    /**
     * 按维度取较大值，用于汇总各节点的最大剩余量
     */
    public ResourceDemand max(ResourceDemand other) {
        return new ResourceDemand(Math.max(cores, other.cores),
                Math.max(memoryMb, other.memoryMb), Math.max(storageGb, other.storageGb));
    }

    /**
     * 负载率：各维度占用比例中的最大值
     */
    public double loadRatio(ResourceDemand capacity) {
        return Math.max(ratio(cores, capacity.cores),
                Math.max(ratio(memoryMb, capacity.memoryMb), ratio(storageGb, capacity.storageGb)));
    }

    private static double ratio(long used, long total) {
        if (total <= 0) {
            return used > 0 ? Double.MAX_VALUE : 0.0;
        }
        return (double) used / total;
    }
}
