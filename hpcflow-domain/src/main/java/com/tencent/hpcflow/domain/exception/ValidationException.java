package com.tencent.hpcflow.domain.exception;

/**
 * ValidationException - 输入形状或语义错误，立即返回，不重试
 */
public class ValidationException extends HpcflowException {

    public ValidationException(String entity, String message) {
        super(ErrorCode.VALIDATION_ERROR, entity, message);
    }

    public ValidationException(String entity, String message, Throwable cause) {
        super(ErrorCode.VALIDATION_ERROR, entity, message, cause);
    }

    protected ValidationException(ErrorCode errorCode, String entity, String message) {
        super(errorCode, entity, message);
    }

    protected ValidationException(ErrorCode errorCode, String entity, String message, Throwable cause) {
        super(errorCode, entity, message, cause);
    }
}
