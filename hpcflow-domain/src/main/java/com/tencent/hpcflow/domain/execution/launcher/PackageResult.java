package com.tencent.hpcflow.domain.execution.launcher;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * PackageResult - 单个包在节点上的运行结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PackageResult {

    private boolean success;

    private String message;

    /**
     * 包声明的可恢复状态
     */
    private Map<String, Object> state = new LinkedHashMap<>();

    public static PackageResult success() {
        return new PackageResult(true, null, new LinkedHashMap<>());
    }

    public static PackageResult success(Map<String, Object> state) {
        return new PackageResult(true, null, new LinkedHashMap<>(state));
    }

    public static PackageResult failure(String message) {
        return new PackageResult(false, message, new LinkedHashMap<>());
    }
}
