package com.tencent.hpcflow.domain.exception;

/**
 * IntegrityException - 检查点完整性校验失败，绝不用于恢复
 */
public class IntegrityException extends HpcflowException {

    public IntegrityException(String entity, String message) {
        super(ErrorCode.INTEGRITY_ERROR, entity, message);
    }

    public IntegrityException(String entity, String message, Throwable cause) {
        super(ErrorCode.INTEGRITY_ERROR, entity, message, cause);
    }
}
