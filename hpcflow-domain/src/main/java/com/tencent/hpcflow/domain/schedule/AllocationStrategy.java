package com.tencent.hpcflow.domain.schedule;

import com.tencent.hpcflow.domain.exception.ValidationException;

import java.util.Locale;

/**
 * AllocationStrategy - 调度策略
 */
public enum AllocationStrategy {

    /**
     * 按声明顺序放置
     */
    BALANCED,

    /**
     * CPU 需求大的包优先
     */
    COMPUTE_INTENSIVE,

    /**
     * 存储服务优先并放在存储带宽最高的节点，其余按存储需求排序
     */
    IO_INTENSIVE,

    /**
     * 内存需求大的包优先
     */
    MEMORY_INTENSIVE;

    public static AllocationStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return BALANCED;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("strategy", "Unknown allocation strategy: " + value, e);
        }
    }
}
