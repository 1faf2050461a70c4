package com.tencent.hpcflow.domain.exception;

/**
 * InvalidConfigException - 包配置不符合声明的参数 Schema
 */
public class InvalidConfigException extends ValidationException {

    public InvalidConfigException(String entity, String message) {
        super(ErrorCode.INVALID_CONFIG, entity, message);
    }

    public InvalidConfigException(String entity, String message, Throwable cause) {
        super(ErrorCode.INVALID_CONFIG, entity, message, cause);
    }
}
