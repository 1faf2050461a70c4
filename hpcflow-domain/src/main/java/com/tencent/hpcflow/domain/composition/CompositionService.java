package com.tencent.hpcflow.domain.composition;

import com.tencent.hpcflow.domain.environment.Environment;
import com.tencent.hpcflow.domain.exception.ConflictException;
import com.tencent.hpcflow.domain.exception.HpcflowException;
import com.tencent.hpcflow.domain.exception.InvalidConfigException;
import com.tencent.hpcflow.domain.exception.NotFoundException;
import com.tencent.hpcflow.domain.exception.OrderConstraintException;
import com.tencent.hpcflow.domain.exception.UnknownPackageException;
import com.tencent.hpcflow.domain.exception.ValidationException;
import com.tencent.hpcflow.domain.execution.ExecutionMethodConfig;
import com.tencent.hpcflow.domain.pipeline.InterceptorSlot;
import com.tencent.hpcflow.domain.pipeline.PackageEntry;
import com.tencent.hpcflow.domain.pipeline.PackageRelationship;
import com.tencent.hpcflow.domain.pipeline.Pipeline;
import com.tencent.hpcflow.domain.pipeline.PipelineStatus;
import com.tencent.hpcflow.domain.pipeline.ValidationReport;
import com.tencent.hpcflow.domain.pkg.PackageCatalog;
import com.tencent.hpcflow.domain.pkg.PackageDefinition;
import com.tencent.hpcflow.domain.pkg.PackageType;
import com.tencent.hpcflow.domain.repository.PipelineRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * CompositionService - 流水线组合领域服务
 * <p>
 * 负责流水线的创建、增删包、重排与配置。所有修改立即写入
 * {@link PipelineRepository}，不做缓冲。
 * </p>
 *
 * @author hpcflow
 */
@Slf4j
public class CompositionService {

    private static final int STATUS_UPDATE_ATTEMPTS = 3;

    private final PipelineRepository pipelineRepository;

    private final PackageCatalog packageCatalog;

    private final OrderRules orderRules;

    private final Clock clock;

    public CompositionService(PipelineRepository pipelineRepository, PackageCatalog packageCatalog, Clock clock) {
        this.pipelineRepository = pipelineRepository;
        this.packageCatalog = packageCatalog;
        this.orderRules = new OrderRules(packageCatalog);
        this.clock = clock;
    }

    /**
     * 创建空流水线
     *
     * @throws ConflictException 名称已存在
     */
    public Pipeline create(String name, String description) {
        requireName(name);
        if (pipelineRepository.exists(name)) {
            throw new ConflictException("pipeline:" + name, "Pipeline already exists: " + name);
        }
        Pipeline pipeline = Pipeline.builder()
                .name(name)
                .description(description)
                .status(PipelineStatus.CREATED)
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
        pipelineRepository.insert(pipeline);
        log.info("Created pipeline [{}]", name);
        return pipeline;
    }

    public Pipeline load(String name) {
        return pipelineRepository.findByName(name)
                .orElseThrow(() -> new NotFoundException("pipeline:" + name, "Pipeline not found: " + name));
    }

    public List<Pipeline> list() {
        return pipelineRepository.findAll();
    }

    /**
     * 删除流水线；是否允许删除由调用方结合会话与执行状态判断
     */
    public void delete(String name) {
        if (!pipelineRepository.delete(name)) {
            throw new NotFoundException("pipeline:" + name, "Pipeline not found: " + name);
        }
        log.info("Deleted pipeline [{}]", name);
    }

    /**
     * 向流水线添加包
     *
     * @param pipelineName 流水线名称
     * @param packageName 包名
     * @param type 期望的包类型，为空时采用包目录中的类型
     * @param config 包配置
     * @param position 插入位置，为空时追加到末尾
     * @return 新加入的包
     */
    public PackageEntry addPackage(String pipelineName, String packageName, PackageType type,
                                   Map<String, Object> config, Integer position) {
        Pipeline pipeline = load(pipelineName);
        PackageEntry entry = resolveEntry(pipeline, packageName, type, config);

        List<PackageEntry> entries = pipeline.getEntries();
        int at = position == null ? entries.size() : position;
        if (at < 0 || at > entries.size()) {
            throw new ValidationException("package:" + packageName,
                    "Position " + at + " is out of range 0.." + entries.size());
        }
        entries.add(at, entry);
        pipeline.resequence();
        requireOrder(pipeline);

        touch(pipeline, PipelineStatus.CONFIGURED);
        pipelineRepository.update(pipeline);
        log.info("Added package [{}] to pipeline [{}] at position {}", packageName, pipelineName, at);
        return entry;
    }

    /**
     * 移除包并重新编号
     */
    public Pipeline removePackage(String pipelineName, String packageName) {
        Pipeline pipeline = load(pipelineName);
        PackageEntry entry = pipeline.entry(packageName);
        pipeline.getEntries().remove(entry);
        pipeline.resequence();
        touch(pipeline, pipeline.getEntries().isEmpty() ? PipelineStatus.CREATED : PipelineStatus.CONFIGURED);
        pipelineRepository.update(pipeline);
        log.info("Removed package [{}] from pipeline [{}]", packageName, pipelineName);
        return pipeline;
    }

    /**
     * 按给定名称序列重排
     *
     * @param newOrder 必须是当前包名的一个排列
     * @throws OrderConstraintException 不是排列，或违反依赖与预加载优先级约束
     */
    public Pipeline reorder(String pipelineName, List<String> newOrder) {
        Pipeline pipeline = load(pipelineName);
        List<String> current = pipeline.entryNames();
        if (newOrder == null || newOrder.size() != current.size()
                || !new HashSet<>(newOrder).equals(new HashSet<>(current))
                || new HashSet<>(newOrder).size() != newOrder.size()) {
            throw new OrderConstraintException("pipeline:" + pipelineName,
                    "New order " + newOrder + " is not a permutation of " + current);
        }
        List<PackageEntry> reordered = new ArrayList<>();
        for (String name : newOrder) {
            reordered.add(pipeline.entry(name));
        }
        pipeline.setEntries(reordered);
        pipeline.resequence();
        requireOrder(pipeline);
        touch(pipeline, pipeline.getStatus());
        pipelineRepository.update(pipeline);
        log.info("Reordered pipeline [{}] to {}", pipelineName, newOrder);
        return pipeline;
    }

    /**
     * 合并并重新校验包配置
     */
    public PackageEntry configurePackage(String pipelineName, String packageName, Map<String, Object> config) {
        Pipeline pipeline = load(pipelineName);
        PackageEntry entry = pipeline.entry(packageName);
        PackageDefinition definition = definition(packageName);
        Map<String, Object> merged = new LinkedHashMap<>(entry.getConfig());
        if (config != null) {
            merged.putAll(config);
        }
        entry.setConfig(definition.resolveConfig(merged));
        touch(pipeline, PipelineStatus.CONFIGURED);
        pipelineRepository.update(pipeline);
        log.info("Configured package [{}] in pipeline [{}]", packageName, pipelineName);
        return entry;
    }

    /**
     * 以给定内容整体导入流水线，所有包按添加时的规则校验
     *
     * @param replace 同名流水线已存在时是否覆盖
     */
    public Pipeline importPipeline(String name, String description, Environment environment,
                                   List<PackageEntry> entries, boolean replace) {
        requireName(name);
        Pipeline pipeline = Pipeline.builder()
                .name(name)
                .description(description)
                .environment(environment)
                .createdAt(clock.instant())
                .build();
        for (PackageEntry candidate : entries) {
            pipeline.getEntries().add(resolveEntry(pipeline, candidate.getName(), candidate.getType(),
                    candidate.getConfig()));
        }
        pipeline.resequence();
        requireOrder(pipeline);
        pipeline.setStatus(pipeline.getEntries().isEmpty() ? PipelineStatus.CREATED : PipelineStatus.CONFIGURED);
        pipeline.setUpdatedAt(clock.instant());

        Pipeline existing = pipelineRepository.findByName(name).orElse(null);
        if (existing == null) {
            pipelineRepository.insert(pipeline);
        } else if (replace) {
            pipeline.setCreatedAt(existing.getCreatedAt());
            pipeline.setExecutionMethod(existing.getExecutionMethod());
            pipeline.setRevision(existing.getRevision());
            pipelineRepository.update(pipeline);
        } else {
            throw new ConflictException("pipeline:" + name, "Pipeline already exists: " + name);
        }
        log.info("Imported pipeline [{}] with {} packages", name, pipeline.getEntries().size());
        return pipeline;
    }

    /**
     * 关联环境快照
     */
    public Pipeline linkEnvironment(String pipelineName, Environment environment) {
        return modify(pipelineName, p -> p.setEnvironment(environment.copy(environment.getName())));
    }

    public Pipeline configureExecutionMethod(String pipelineName, ExecutionMethodConfig methodConfig) {
        if (methodConfig.getNodeCount() < 0 || methodConfig.getProcessesPerNode() < 1) {
            throw new ValidationException("pipeline:" + pipelineName,
                    "Node count must be >= 0 and processes per node >= 1");
        }
        return modify(pipelineName, p -> p.setExecutionMethod(methodConfig.copy()));
    }

    /**
     * 同步执行状态到流水线，遇到并发修改时重新读取后重试
     */
    public void updateStatus(String pipelineName, PipelineStatus status) {
        for (int attempt = 1; ; attempt++) {
            try {
                modify(pipelineName, p -> p.setStatus(status));
                return;
            } catch (ConflictException e) {
                if (attempt >= STATUS_UPDATE_ATTEMPTS) {
                    throw e;
                }
                log.debug("Retrying status update of pipeline [{}] after conflict", pipelineName);
            }
        }
    }

    /**
     * 逐包校验，返回全部问题而不是遇到第一个就失败
     */
    public ValidationReport validate(String pipelineName) {
        return validate(load(pipelineName));
    }

    public ValidationReport validate(Pipeline pipeline) {
        ValidationReport report = ValidationReport.builder().pipelineName(pipeline.getName()).build();
        if (pipeline.getEntries().isEmpty()) {
            report.addIssue(null, "pipeline has no packages");
        }
        Set<String> present = new HashSet<>(pipeline.entryNames());
        for (PackageEntry entry : pipeline.getEntries()) {
            PackageDefinition definition = packageCatalog.find(entry.getName()).orElse(null);
            if (definition == null) {
                report.addIssue(entry.getName(), "unknown package");
                continue;
            }
            if (entry.getType() != definition.getType()) {
                report.addIssue(entry.getName(), "declared as " + entry.getType() + " but catalog type is "
                        + definition.getType());
            }
            try {
                definition.resolveConfig(entry.getConfig());
            } catch (InvalidConfigException e) {
                report.addIssue(entry.getName(), e.getMessage());
            }
            for (String dependency : definition.getDependencies()) {
                if (!present.contains(dependency)) {
                    report.addIssue(entry.getName(), "depends on '" + dependency + "' which is not in the pipeline");
                }
            }
            for (String conflict : definition.getConflicts()) {
                if (present.contains(conflict)) {
                    report.addIssue(entry.getName(), "conflicts with '" + conflict + "'");
                }
            }
        }
        orderRules.violations(pipeline.getEntries()).forEach(v -> report.addIssue(null, v));
        return report;
    }

    /**
     * 列出包目录中声明的依赖、冲突与互补关系
     */
    public List<PackageRelationship> analyzeRelationships(String pipelineName) {
        Pipeline pipeline = load(pipelineName);
        Set<String> present = new HashSet<>(pipeline.entryNames());
        List<PackageRelationship> relationships = new ArrayList<>();
        for (PackageEntry entry : pipeline.getEntries()) {
            packageCatalog.find(entry.getName()).ifPresent(definition -> {
                definition.getDependencies().forEach(d -> relationships.add(new PackageRelationship(
                        entry.getName(), d, PackageRelationship.Kind.DEPENDS_ON, present.contains(d))));
                definition.getConflicts().forEach(c -> relationships.add(new PackageRelationship(
                        entry.getName(), c, PackageRelationship.Kind.CONFLICTS_WITH, present.contains(c))));
                definition.getComplements().forEach(c -> relationships.add(new PackageRelationship(
                        entry.getName(), c, PackageRelationship.Kind.COMPLEMENTS, present.contains(c))));
            });
        }
        return relationships;
    }

    /**
     * 按链中顺序列出拦截器及其包裹的应用
     */
    public List<InterceptorSlot> interceptors(String pipelineName) {
        Pipeline pipeline = load(pipelineName);
        List<String> applications = pipeline.entriesOfType(PackageType.APPLICATION).stream()
                .map(PackageEntry::getName)
                .collect(Collectors.toList());
        List<InterceptorSlot> slots = new ArrayList<>();
        for (PackageEntry entry : pipeline.entriesOfType(PackageType.INTERCEPTOR)) {
            slots.add(InterceptorSlot.builder()
                    .name(entry.getName())
                    .preloadOrder(slots.size() + 1)
                    .preloadPriority(priorityOf(entry))
                    .config(new LinkedHashMap<>(entry.getConfig()))
                    .targetPackages(new ArrayList<>(applications))
                    .build());
        }
        return slots;
    }

    /**
     * 按 preloadPriority 重排拦截器，未声明优先级的排在最后；其他包的位置不变
     *
     * @throws OrderConstraintException 重排后违反依赖约束
     */
    public Pipeline sortInterceptors(String pipelineName) {
        Pipeline pipeline = load(pipelineName);
        List<PackageEntry> sorted = pipeline.entriesOfType(PackageType.INTERCEPTOR);
        sorted.sort(Comparator.comparing(this::priorityOf, Comparator.nullsLast(Comparator.<Integer>naturalOrder())));
        Iterator<PackageEntry> next = sorted.iterator();
        List<String> order = new ArrayList<>();
        for (PackageEntry entry : pipeline.getEntries()) {
            order.add(entry.getType() == PackageType.INTERCEPTOR ? next.next().getName() : entry.getName());
        }
        return reorder(pipelineName, order);
    }

    private Integer priorityOf(PackageEntry entry) {
        return packageCatalog.find(entry.getName()).map(PackageDefinition::getPreloadPriority).orElse(null);
    }

    private Pipeline modify(String pipelineName, Consumer<Pipeline> change) {
        Pipeline pipeline = load(pipelineName);
        change.accept(pipeline);
        pipeline.setUpdatedAt(clock.instant());
        pipelineRepository.update(pipeline);
        return pipeline;
    }

    private PackageEntry resolveEntry(Pipeline pipeline, String packageName, PackageType type,
                                      Map<String, Object> config) {
        PackageDefinition definition = definition(packageName);
        if (type != null && type != definition.getType()) {
            throw new InvalidConfigException("package:" + packageName, "Package '" + packageName + "' is a "
                    + definition.getType() + ", not a " + type);
        }
        if (pipeline.contains(packageName)) {
            throw new ConflictException("package:" + packageName,
                    "Package '" + packageName + "' is already in pipeline '" + pipeline.getName() + "'");
        }
        for (PackageEntry existing : pipeline.getEntries()) {
            boolean conflicting = definition.getConflicts().contains(existing.getName())
                    || packageCatalog.find(existing.getName())
                    .map(d -> d.getConflicts().contains(packageName)).orElse(false);
            if (conflicting) {
                throw new ValidationException("package:" + packageName,
                        "Package '" + packageName + "' conflicts with '" + existing.getName() + "'");
            }
        }
        return PackageEntry.builder()
                .name(packageName)
                .type(definition.getType())
                .config(definition.resolveConfig(config))
                .build();
    }

    private PackageDefinition definition(String packageName) {
        return packageCatalog.find(packageName).orElseThrow(() ->
                new UnknownPackageException("package:" + packageName, "Unknown package: " + packageName));
    }

    private void requireOrder(Pipeline pipeline) {
        List<String> violations = orderRules.violations(pipeline.getEntries());
        if (!violations.isEmpty()) {
            throw new OrderConstraintException("pipeline:" + pipeline.getName(), String.join("; ", violations));
        }
    }

    private void touch(Pipeline pipeline, PipelineStatus status) {
        pipeline.setStatus(status);
        pipeline.setUpdatedAt(clock.instant());
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("pipeline", "Pipeline name cannot be empty");
        }
    }

    /**
     * 运行前校验，失败时抛出包含全部问题的异常
     *
     * @throws HpcflowException 校验失败
     */
    public void requireValid(Pipeline pipeline) {
        ValidationReport report = validate(pipeline);
        if (!report.isValid()) {
            StringBuilder message = new StringBuilder("Pipeline '" + pipeline.getName() + "' is invalid:");
            for (ValidationReport.Issue issue : report.getIssues()) {
                message.append(' ');
                if (issue.getPackageName() != null) {
                    message.append('[').append(issue.getPackageName()).append("] ");
                }
                message.append(issue.getMessage()).append(';');
            }
            throw new ValidationException("pipeline:" + pipeline.getName(), message.toString());
        }
    }
}
