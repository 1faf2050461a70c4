package com.tencent.hpcflow.domain.execution;

import com.tencent.hpcflow.domain.exception.ValidationException;

import java.util.Locale;

/**
 * ExecutionMethod - 执行方式
 */
public enum ExecutionMethod {

    /**
     * 本机单进程
     */
    LOCAL("local"),

    /**
     * 逐个节点 SSH
     */
    SSH("ssh"),

    /**
     * 并行 SSH 扇出
     */
    PARALLEL_SSH("parallel-ssh"),

    /**
     * MPI 集合启动
     */
    MPI("mpi");

    private final String value;

    ExecutionMethod(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ExecutionMethod fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (ExecutionMethod method : values()) {
                if (method.value.equals(normalized)) {
                    return method;
                }
            }
        }
        throw new ValidationException("execution-method", "Unknown execution method: " + value);
    }
}
