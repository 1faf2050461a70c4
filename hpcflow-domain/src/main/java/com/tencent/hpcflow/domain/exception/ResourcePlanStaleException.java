package com.tencent.hpcflow.domain.exception;

/**
 * ResourcePlanStaleException - 资源快照过期，或重新规划无法满足原有放置约束
 */
public class ResourcePlanStaleException extends HpcflowException {

    public ResourcePlanStaleException(String entity, String message) {
        super(ErrorCode.RESOURCE_PLAN_STALE, entity, message);
    }

    public ResourcePlanStaleException(String entity, String message, Throwable cause) {
        super(ErrorCode.RESOURCE_PLAN_STALE, entity, message, cause);
    }
}
