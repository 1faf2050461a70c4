package com.tencent.hpcflow.domain.exception;

/**
 * OrderConstraintException - 重排违反拦截器优先级或依赖顺序
 */
public class OrderConstraintException extends ValidationException {

    public OrderConstraintException(String entity, String message) {
        super(ErrorCode.ORDER_CONSTRAINT, entity, message);
    }

    public OrderConstraintException(String entity, String message, Throwable cause) {
        super(ErrorCode.ORDER_CONSTRAINT, entity, message, cause);
    }
}
