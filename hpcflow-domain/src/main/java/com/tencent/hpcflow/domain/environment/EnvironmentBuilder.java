package com.tencent.hpcflow.domain.environment;

import com.tencent.hpcflow.domain.exception.InvalidConfigException;
import com.tencent.hpcflow.domain.pipeline.PackageEntry;
import com.tencent.hpcflow.domain.pipeline.Pipeline;
import com.tencent.hpcflow.domain.pkg.PackageCatalog;
import com.tencent.hpcflow.domain.pkg.PackageDefinition;
import com.tencent.hpcflow.domain.resource.NodeResource;
import com.tencent.hpcflow.domain.resource.ResourceGraph;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * EnvironmentBuilder - 环境构建领域服务
 * <p>
 * 根据流水线中包的模块需求、集群容量和优化级别生成 {@link Environment}。
 * 同名模块出现不同版本时构建失败。
 * </p>
 *
 * @author hpcflow
 */
@Slf4j
public class EnvironmentBuilder {

    static final List<String> BASE_MODULES = List.of("gcc", "openmpi", "cmake");

    static final List<String> DEV_TOOL_MODULES = List.of("gdb", "valgrind", "perf");

    public static final String VAR_PIPELINE = "HPCFLOW_PIPELINE";

    public static final String VAR_ENV = "HPCFLOW_ENV";

    public static final String VAR_THREADS = "OMP_NUM_THREADS";

    private final PackageCatalog packageCatalog;

    public EnvironmentBuilder(PackageCatalog packageCatalog) {
        this.packageCatalog = packageCatalog;
    }

    /**
     * 为流水线构建新环境
     *
     * @param name 环境名称
     * @param pipeline 目标流水线
     * @param graph 当前资源快照，决定 OMP_NUM_THREADS
     * @param level 优化级别
     * @param devTools 是否加载调试工具
     */
    public Environment build(String name, Pipeline pipeline, ResourceGraph graph,
                             OptimizationLevel level, boolean devTools) {
        Environment env = Environment.builder()
                .name(name)
                .optimizationLevel(level)
                .optimizationFlags(new ArrayList<>(level.getFlags()))
                .build();

        Map<String, String> modules = new LinkedHashMap<>();
        BASE_MODULES.forEach(m -> mergeModule(modules, m, name));
        if (devTools) {
            DEV_TOOL_MODULES.forEach(m -> mergeModule(modules, m, name));
            env.getVariables().put("DEBUG", "1");
        }
        requiredModules(pipeline).forEach(m -> mergeModule(modules, m, name));
        env.setModules(toModuleList(modules));

        String flags = String.join(" ", env.getOptimizationFlags());
        env.getVariables().put("CFLAGS", flags);
        env.getVariables().put("CXXFLAGS", flags);
        env.getVariables().put(VAR_THREADS, String.valueOf(minCores(graph)));
        env.getVariables().put(VAR_PIPELINE, pipeline.getName());
        env.getVariables().put(VAR_ENV, name);

        log.info("Built environment [{}] for pipeline [{}] with {} modules", name, pipeline.getName(),
                env.getModules().size());
        return env;
    }

    /**
     * 执行前准备环境：以流水线关联的快照为基础补齐包所需模块，
     * 未关联环境时按 BALANCED 构建
     */
    public Environment prepare(Pipeline pipeline, ResourceGraph graph) {
        Environment linked = pipeline.getEnvironment();
        if (linked == null) {
            return build(pipeline.getName() + "-env", pipeline, graph, OptimizationLevel.BALANCED, false);
        }
        Environment env = linked.copy(linked.getName());
        Map<String, String> modules = new LinkedHashMap<>();
        env.getModules().forEach(m -> mergeModule(modules, m, env.getName()));
        requiredModules(pipeline).forEach(m -> mergeModule(modules, m, env.getName()));
        env.setModules(toModuleList(modules));
        env.getVariables().put(VAR_PIPELINE, pipeline.getName());
        env.getVariables().putIfAbsent(VAR_ENV, env.getName());
        env.getVariables().putIfAbsent(VAR_THREADS, String.valueOf(minCores(graph)));
        return env;
    }

    /**
     * 更新变量，返回新快照
     */
    public Environment configure(Environment source, Map<String, String> variables, List<String> extraModules) {
        Environment env = source.copy(source.getName());
        if (variables != null) {
            env.getVariables().putAll(variables);
        }
        if (extraModules != null && !extraModules.isEmpty()) {
            Map<String, String> modules = new LinkedHashMap<>();
            env.getModules().forEach(m -> mergeModule(modules, m, env.getName()));
            extraModules.forEach(m -> mergeModule(modules, m, env.getName()));
            env.setModules(toModuleList(modules));
        }
        return env;
    }

    private List<String> requiredModules(Pipeline pipeline) {
        List<String> result = new ArrayList<>();
        for (PackageEntry entry : pipeline.getEntries()) {
            packageCatalog.find(entry.getName())
                    .map(PackageDefinition::getRequiredModules)
                    .ifPresent(result::addAll);
        }
        return result;
    }

    /**
     * 模块键为 "/" 之前的名称，值为完整写法
     */
    private void mergeModule(Map<String, String> modules, String module, String envName) {
        String key = moduleName(module);
        String existing = modules.get(key);
        if (existing == null) {
            modules.put(key, module);
            return;
        }
        if (existing.equals(module) || !module.contains("/")) {
            return;
        }
        if (!existing.contains("/")) {
            modules.put(key, module);
            return;
        }
        throw new InvalidConfigException("environment:" + envName,
                "Module conflict in environment '" + envName + "': " + existing + " vs " + module);
    }

    private static String moduleName(String module) {
        int slash = module.indexOf('/');
        return slash < 0 ? module : module.substring(0, slash);
    }

    private static List<String> toModuleList(Map<String, String> modules) {
        return new ArrayList<>(modules.values());
    }

    private static int minCores(ResourceGraph graph) {
        return graph.getNodes().stream().mapToInt(NodeResource::getCores).filter(c -> c > 0).min().orElse(1);
    }
}
