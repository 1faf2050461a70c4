package com.tencent.hpcflow.domain.exception;

/**
 * LaunchTimeoutException - 节点在超时时间内未确认就绪（瞬时错误）
 */
public class LaunchTimeoutException extends HpcflowException {

    public LaunchTimeoutException(String entity, String message) {
        super(ErrorCode.LAUNCH_TIMEOUT, entity, message);
    }

    public LaunchTimeoutException(String entity, String message, Throwable cause) {
        super(ErrorCode.LAUNCH_TIMEOUT, entity, message, cause);
    }
}
