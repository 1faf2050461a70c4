package com.tencent.hpcflow.domain.exception;

/**
 * ConflictException - 名称重复、并发修改或同一流水线的第二个活动执行
 */
public class ConflictException extends HpcflowException {

    public ConflictException(String entity, String message) {
        super(ErrorCode.CONFLICT, entity, message);
    }

    public ConflictException(String entity, String message, Throwable cause) {
        super(ErrorCode.CONFLICT, entity, message, cause);
    }
}
