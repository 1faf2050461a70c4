package com.tencent.hpcflow.domain.environment;

import com.tencent.hpcflow.domain.exception.ValidationException;

import java.util.List;
import java.util.Locale;

/**
 * OptimizationLevel - 编译优化级别
 */
public enum OptimizationLevel {

    FAST(List.of("-O2", "-march=native")),

    BALANCED(List.of("-O2", "-march=native", "-funroll-loops")),

    AGGRESSIVE(List.of("-O3", "-march=native", "-funroll-loops", "-flto"));

    private final List<String> flags;

    OptimizationLevel(List<String> flags) {
        this.flags = flags;
    }

    public List<String> getFlags() {
        return flags;
    }

    public static OptimizationLevel fromValue(String value) {
        if (value == null || value.isBlank()) {
            return BALANCED;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("optimization-level", "Unknown optimization level: " + value, e);
        }
    }
}
