package com.tencent.hpcflow.domain.monitor;

/**
 * Trend - 指标走势
 */
public enum Trend {
    RISING,
    FALLING,
    STABLE
}
