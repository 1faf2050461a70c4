package com.tencent.hpcflow.domain.exception;

import lombok.Getter;

/**
 * HpcflowException - 编排引擎异常基类
 * <p>
 * 携带错误码与出错实体，调用方无需查看内部日志即可定位问题。
 * </p>
 */
@Getter
public class HpcflowException extends RuntimeException {

    private final ErrorCode errorCode;

    /**
     * 出错实体，如 "pipeline:io_test"、"package:ior"、"node:2"
     */
    private final String entity;

    public HpcflowException(ErrorCode errorCode, String entity, String message) {
        super(message);
        this.errorCode = errorCode;
        this.entity = entity;
    }

    public HpcflowException(ErrorCode errorCode, String entity, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.entity = entity;
    }

    public boolean isTransient() {
        return errorCode.isTransient();
    }
}
