package com.tencent.hpcflow.domain.exception;

/**
 * ParseException - 描述文件无法解析
 */
public class ParseException extends ValidationException {

    public ParseException(String entity, String message) {
        super(ErrorCode.PARSE_ERROR, entity, message);
    }

    public ParseException(String entity, String message, Throwable cause) {
        super(ErrorCode.PARSE_ERROR, entity, message, cause);
    }
}
