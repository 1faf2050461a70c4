package com.tencent.hpcflow.domain.pkg;

import java.util.List;
import java.util.Map;

/**
 * ParameterType - 包参数类型
 */
public enum ParameterType {

    STRING,

    INTEGER,

    NUMBER,

    BOOLEAN,

    ARRAY,

    OBJECT;

    /**
     * 判断值是否属于该类型
     */
    public boolean accepts(Object value) {
        switch (this) {
            case STRING:
                return value instanceof String;
            case INTEGER:
                return value instanceof Integer || value instanceof Long || value instanceof Short;
            case NUMBER:
                return value instanceof Number;
            case BOOLEAN:
                return value instanceof Boolean;
            case ARRAY:
                return value instanceof List;
            case OBJECT:
                return value instanceof Map;
            default:
                return false;
        }
    }
}
