package com.tencent.hpcflow.domain.environment;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Environment - 流水线运行环境
 * <p>
 * 环境变量、模块列表与编译优化参数的组合。复制得到的是独立快照，
 * 修改副本不会影响原环境。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Environment {

    private String name;

    @Builder.Default
    private Map<String, String> variables = new LinkedHashMap<>();

    /**
     * 需要加载的环境模块，如 "openmpi/4.1"
     */
    @Builder.Default
    private List<String> modules = new ArrayList<>();

    @Builder.Default
    private List<String> optimizationFlags = new ArrayList<>();

    @Builder.Default
    private OptimizationLevel optimizationLevel = OptimizationLevel.BALANCED;

    public Environment copy(String newName) {
        return new Environment(newName,
                new LinkedHashMap<>(variables),
                new ArrayList<>(modules),
                new ArrayList<>(optimizationFlags),
                optimizationLevel);
    }
}
