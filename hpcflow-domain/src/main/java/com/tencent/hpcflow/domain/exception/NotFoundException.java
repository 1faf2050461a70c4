package com.tencent.hpcflow.domain.exception;

/**
 * NotFoundException - 流水线、包、执行或检查点不存在
 */
public class NotFoundException extends HpcflowException {

    public NotFoundException(String entity, String message) {
        super(ErrorCode.NOT_FOUND, entity, message);
    }

    public NotFoundException(String entity, String message, Throwable cause) {
        super(ErrorCode.NOT_FOUND, entity, message, cause);
    }
}
