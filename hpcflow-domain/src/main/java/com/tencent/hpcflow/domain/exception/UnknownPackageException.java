package com.tencent.hpcflow.domain.exception;

/**
 * UnknownPackageException - 包目录中不存在的包
 */
public class UnknownPackageException extends ValidationException {

    public UnknownPackageException(String entity, String message) {
        super(ErrorCode.UNKNOWN_PACKAGE, entity, message);
    }

    public UnknownPackageException(String entity, String message, Throwable cause) {
        super(ErrorCode.UNKNOWN_PACKAGE, entity, message, cause);
    }
}
