package com.tencent.hpcflow.domain.execution;

import com.tencent.hpcflow.domain.exception.ValidationException;

import java.util.Locale;

/**
 * CleanLevel - 清理力度
 */
public enum CleanLevel {

    /**
     * 清理节点工作目录，保留执行记录
     */
    LIGHT,

    /**
     * 另外删除除最近一次之外的终态执行记录
     */
    STANDARD,

    /**
     * 删除全部终态执行记录及其检查点
     */
    DEEP;

    public static CleanLevel fromValue(String value) {
        if (value == null || value.isBlank()) {
            return STANDARD;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("clean-level", "Unknown clean level: " + value, e);
        }
    }
}
