package com.tencent.hpcflow.domain.pkg;

import com.tencent.hpcflow.domain.exception.InvalidConfigException;
import com.tencent.hpcflow.domain.resource.ResourceDemand;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * PackageDefinition - 包目录中的包声明
 * <p>
 * 由外部包目录提供，编排核心只关心其输入输出契约：
 * 参数 Schema、默认资源需求、所需模块以及与其他包的关系。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PackageDefinition {

    /**
     * 配置中可覆盖默认资源需求的保留键
     */
    public static final Set<String> RESOURCE_KEYS = Set.of(
            ResourceDemand.CORES_KEY, ResourceDemand.MEMORY_KEY, ResourceDemand.STORAGE_KEY);

    private String name;

    private PackageType type;

    private String description;

    @Builder.Default
    private List<ParameterDefinition> parameters = new ArrayList<>();

    /**
     * 包声明的默认资源需求
     */
    @Builder.Default
    private ResourceDemand defaultDemand = ResourceDemand.NONE;

    /**
     * 是否为存储服务（io_intensive 策略下优先放置在高带宽存储节点）
     */
    private boolean storageService;

    /**
     * 是否支持断点续跑（检查点会保存其可恢复状态）
     */
    private boolean resumable;

    /**
     * 拦截器在预加载链中的优先级，数值小的在前
     */
    private Integer preloadPriority;

    /**
     * 运行所需的环境模块，如 "openmpi/4.1"
     */
    @Builder.Default
    private List<String> requiredModules = new ArrayList<>();

    /**
     * 在节点上运行包的命令模板，${参数名} 替换为配置值；为空时包只做环境准备
     */
    private String command;

    /**
     * 必须排在本包之前的包
     */
    @Builder.Default
    private List<String> dependencies = new ArrayList<>();

    /**
     * 不能出现在同一流水线中的包
     */
    @Builder.Default
    private List<String> conflicts = new ArrayList<>();

    /**
     * 搭配使用效果更好的包
     */
    @Builder.Default
    private List<String> complements = new ArrayList<>();

    public Optional<ParameterDefinition> findParameter(String parameterName) {
        return parameters.stream().filter(p -> p.getName().equals(parameterName)).findFirst();
    }

    /**
     * 按参数 Schema 校验配置，并填入默认值
     *
     * @param config 用户提供的配置，可为空
     * @return 解析后的完整配置
     * @throws InvalidConfigException 存在未知参数、类型不符、缺少必需参数或违反约束
     */
    public Map<String, Object> resolveConfig(Map<String, Object> config) {
        Map<String, Object> supplied = config == null ? Map.of() : config;
        List<String> problems = new ArrayList<>();

        for (String key : supplied.keySet()) {
            if (!RESOURCE_KEYS.contains(key) && findParameter(key).isEmpty()) {
                problems.add("unknown parameter '" + key + "'");
            }
        }

        Map<String, Object> resolved = new LinkedHashMap<>();
        for (ParameterDefinition parameter : parameters) {
            Object value = supplied.get(parameter.getName());
            if (value == null) {
                if (parameter.isRequired()) {
                    problems.add("missing required parameter '" + parameter.getName() + "'");
                } else if (parameter.getDefaultValue() != null) {
                    resolved.put(parameter.getName(), parameter.getDefaultValue());
                }
                continue;
            }
            if (!parameter.getType().accepts(value)) {
                problems.add("parameter '" + parameter.getName() + "' expects " + parameter.getType()
                        + " but got " + value.getClass().getSimpleName());
                continue;
            }
            if (parameter.getConstraint() != null) {
                parameter.getConstraint().check(value, parameter.getType())
                        .ifPresent(reason -> problems.add("parameter '" + parameter.getName() + "': " + reason));
            }
            resolved.put(parameter.getName(), value);
        }

        for (String key : RESOURCE_KEYS) {
            Object value = supplied.get(key);
            if (value == null) {
                continue;
            }
            if (!ParameterType.INTEGER.accepts(value) || ((Number) value).longValue() < 0) {
                problems.add("resource override '" + key + "' must be a non-negative integer");
            } else {
                resolved.put(key, value);
            }
        }

        if (!problems.isEmpty()) {
            throw new InvalidConfigException("package:" + name,
                    "Invalid configuration for package '" + name + "': " + String.join("; ", problems));
        }
        return resolved;
    }

    /**
     * 计算包的资源需求：配置中的显式覆盖优先于包声明的默认值
     */
    public ResourceDemand demandFor(Map<String, Object> config) {
        return defaultDemand.overriddenBy(config);
    }
}
