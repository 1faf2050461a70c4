package com.tencent.hpcflow.domain.pkg;

import com.tencent.hpcflow.domain.exception.ValidationException;

import java.util.Locale;

/**
 * PackageType - 包类型枚举
 */
public enum PackageType {

    /**
     * 长期运行的服务，如存储系统 (orangefs, hermes)
     */
    SERVICE("service"),

    /**
     * 运行至结束的应用，如基准测试 (ior, incompact3d)
     */
    APPLICATION("application"),

    /**
     * 包裹其他包执行过程的拦截器，如 darshan
     * 相对顺序即 LD_PRELOAD 链顺序
     */
    INTERCEPTOR("interceptor");

    private final String value;

    PackageType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static PackageType fromValue(String value) {
        if (value == null) {
            throw new ValidationException("package-type", "Package type cannot be empty");
        }
        for (PackageType type : values()) {
            if (type.value.equals(value.trim().toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        throw new ValidationException("package-type", "Unknown package type: " + value);
    }
}
