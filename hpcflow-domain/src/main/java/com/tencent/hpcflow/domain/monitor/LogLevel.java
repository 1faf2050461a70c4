package com.tencent.hpcflow.domain.monitor;

import com.tencent.hpcflow.domain.exception.ValidationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * LogLevel - 日志行级别
 * <p>
 * 节点输出是原始文本，级别按行内关键字推断，没有关键字的行视为 INFO。
 * </p>
 */
public enum LogLevel {

    DEBUG("debug", Pattern.compile("\\b(DEBUG|TRACE)\\b")),
    INFO("info", Pattern.compile("\\bINFO\\b")),
    WARNING("warning", Pattern.compile("\\bWARN(ING)?\\b")),
    ERROR("error", Pattern.compile("\\b(ERROR|EXCEPTION)\\b|\\bSEGMENTATION FAULT\\b")),
    CRITICAL("critical", Pattern.compile("\\b(CRITICAL|FATAL|PANIC)\\b"));

    private final String value;

    private final Pattern marker;

    LogLevel(String value, Pattern marker) {
        this.value = value;
        this.marker = marker;
    }

    public String getValue() {
        return value;
    }

    public boolean isAtLeast(LogLevel other) {
        return ordinal() >= other.ordinal();
    }

    /**
     * 从最严重的级别开始匹配
     */
    public static LogLevel detect(String line) {
        if (line == null) {
            return INFO;
        }
        String upper = line.toUpperCase(Locale.ROOT);
        LogLevel[] levels = values();
        for (int i = levels.length - 1; i >= 0; i--) {
            if (levels[i].marker.matcher(upper).find()) {
                return levels[i];
            }
        }
        return INFO;
    }

    public static LogLevel fromValue(String value) {
        if (value == null || value.isBlank()) {
            return DEBUG;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("warn".equals(normalized)) {
            return WARNING;
        }
        for (LogLevel level : values()) {
            if (level.value.equals(normalized)) {
                return level;
            }
        }
        throw new ValidationException("log-level", "Unknown log level: " + value);
    }
}
