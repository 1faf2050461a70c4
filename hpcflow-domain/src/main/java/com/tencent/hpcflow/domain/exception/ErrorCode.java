package com.tencent.hpcflow.domain.exception;

/**
 * ErrorCode - 错误码
 * <p>
 * 每个错误码同时声明是否允许在本地自动重试。
 * 校验、资源与完整性错误永远不自动重试。
 * </p>
 */
public enum ErrorCode {

    VALIDATION_ERROR(false),
    PARSE_ERROR(false),
    INVALID_CONFIG(false),
    UNKNOWN_PACKAGE(false),
    ORDER_CONSTRAINT(false),
    NOT_FOUND(false),
    CONFLICT(false),
    INSUFFICIENT_RESOURCES(false),
    RESOURCE_PLAN_STALE(false),
    LAUNCH_TIMEOUT(true),
    NODE_UNRESPONSIVE(true),
    INTEGRITY_ERROR(false);

    private final boolean transientError;

    ErrorCode(boolean transientError) {
        this.transientError = transientError;
    }

    public boolean isTransient() {
        return transientError;
    }
}
