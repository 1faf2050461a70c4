package com.tencent.hpcflow.domain.schedule;

import com.tencent.hpcflow.domain.exception.InsufficientResourcesException;
import com.tencent.hpcflow.domain.exception.ResourcePlanStaleException;
import com.tencent.hpcflow.domain.exception.ValidationException;
import com.tencent.hpcflow.domain.execution.ExecutionMethod;
import com.tencent.hpcflow.domain.execution.ExecutionMethodConfig;
import com.tencent.hpcflow.domain.pipeline.PackageEntry;
import com.tencent.hpcflow.domain.pipeline.Pipeline;
import com.tencent.hpcflow.domain.pkg.PackageCatalog;
import com.tencent.hpcflow.domain.pkg.PackageDefinition;
import com.tencent.hpcflow.domain.pkg.PackageType;
import com.tencent.hpcflow.domain.resource.NodeResource;
import com.tencent.hpcflow.domain.resource.ResourceDemand;
import com.tencent.hpcflow.domain.resource.ResourceGraph;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Scheduler - 资源分配器
 * <p>
 * 对只读的 {@link ResourceGraph} 快照做确定性的贪心放置：
 * <ol>
 *     <li>包的资源需求取配置覆盖，否则取包声明的默认值</li>
 *     <li>按策略排序（稳定排序，次序相同时保持流水线顺序）</li>
 *     <li>放到负载最低且仍能容纳的节点，负载相同取编号最小者；钉住的包只能放到指定节点</li>
 *     <li>放不下时报告包名与缺口，不降级</li>
 * </ol>
 * 拦截器复制到每个承载应用的节点上，使预加载链包裹每个应用。
 * </p>
 *
 * @author hpcflow
 */
@Slf4j
public class Scheduler {

    private final PackageCatalog packageCatalog;

    private final SchedulerSettings settings;

    private final Clock clock;

    public Scheduler(PackageCatalog packageCatalog, SchedulerSettings settings, Clock clock) {
        this.packageCatalog = packageCatalog;
        this.settings = settings;
        this.clock = clock;
    }

    public SchedulerSettings getSettings() {
        return settings;
    }

    /**
     * 生成分配计划
     *
     * @param pipeline 已校验的流水线
     * @param graph 资源快照，不会被修改
     * @param strategy 调度策略，为空时使用默认策略
     * @param pins 包名到节点编号的硬性约束，可为空
     * @param methodConfig 执行方式，决定候选节点范围
     * @throws ResourcePlanStaleException 快照超过可接受年龄
     * @throws InsufficientResourcesException 某个包无法放置
     */
    public AllocationPlan plan(Pipeline pipeline, ResourceGraph graph, AllocationStrategy strategy,
                               Map<String, Integer> pins, ExecutionMethodConfig methodConfig) {
        AllocationStrategy effective = strategy == null ? settings.getDefaultStrategy() : strategy;
        ExecutionMethodConfig method = methodConfig == null ? ExecutionMethodConfig.local() : methodConfig;
        Map<String, Integer> hardPins = pins == null ? Map.of() : pins;

        if (graph.isOlderThan(settings.getMaxGraphAge(), clock.instant())) {
            throw new ResourcePlanStaleException("resource-graph:v" + graph.getVersion(),
                    "Resource graph v" + graph.getVersion() + " was refreshed at " + graph.getRefreshedAt()
                            + " and is older than " + settings.getMaxGraphAge());
        }

        List<NodeResource> candidates = method.getMethod() == ExecutionMethod.LOCAL
                ? graph.firstNodes(1)
                : graph.firstNodes(method.getNodeCount());
        for (Map.Entry<String, Integer> pin : hardPins.entrySet()) {
            if (!pipeline.contains(pin.getKey())) {
                throw new ValidationException("pin:" + pin.getKey(),
                        "Pinned package '" + pin.getKey() + "' is not part of pipeline '" + pipeline.getName() + "'");
            }
            if (candidates.stream().noneMatch(n -> n.getId() == pin.getValue())) {
                throw new InsufficientResourcesException(pin.getKey(),
                        "pinned node " + pin.getValue() + " is not available to the " + method.getMethod().getValue()
                                + " execution method");
            }
        }

        Placer placer = new Placer(candidates);
        List<PackageEntry> primary = pipeline.getEntries().stream()
                .filter(e -> e.getType() != PackageType.INTERCEPTOR)
                .sorted(priority(effective))
                .collect(Collectors.toList());
        for (PackageEntry entry : primary) {
            ResourceDemand demand = demandOf(entry);
            Integer pinned = hardPins.get(entry.getName());
            NodeResource node;
            if (pinned != null) {
                node = placer.requireFits(entry, demand, pinned);
            } else if (effective == AllocationStrategy.IO_INTENSIVE && isStorageService(entry)) {
                node = placer.highestStorageBandwidth(entry, demand);
            } else {
                node = placer.leastLoaded(entry, demand);
            }
            placer.place(node, entry, demand);
        }

        List<Integer> applicationNodes = placer.nodesHosting(PackageType.APPLICATION);
        for (PackageEntry interceptor : pipeline.entriesOfType(PackageType.INTERCEPTOR)) {
            ResourceDemand demand = demandOf(interceptor);
            Integer pinned = hardPins.get(interceptor.getName());
            if (pinned != null) {
                placer.place(placer.requireFits(interceptor, demand, pinned), interceptor, demand);
            } else if (applicationNodes.isEmpty()) {
                placer.place(placer.leastLoaded(interceptor, demand), interceptor, demand);
            } else {
                for (Integer nodeId : applicationNodes) {
                    placer.place(placer.requireFits(interceptor, demand, nodeId), interceptor, demand);
                }
            }
        }

        AllocationPlan plan = AllocationPlan.builder()
                .id(UUID.randomUUID().toString())
                .pipelineName(pipeline.getName())
                .graphVersion(graph.getVersion())
                .strategy(effective)
                .methodConfig(method.copy())
                .assignments(placer.assignments())
                .pins(new LinkedHashMap<>(hardPins))
                .createdAt(clock.instant())
                .build();
        log.info("Planned pipeline [{}] on graph v{} with strategy {}: nodes {}", pipeline.getName(),
                graph.getVersion(), effective, plan.nodeIds());
        return plan;
    }

    private Comparator<PackageEntry> priority(AllocationStrategy strategy) {
        Comparator<PackageEntry> byOrder = Comparator.comparingInt(PackageEntry::getOrder);
        switch (strategy) {
            case COMPUTE_INTENSIVE:
                return Comparator.comparingInt((PackageEntry e) -> -demandOf(e).getCores()).thenComparing(byOrder);
            case MEMORY_INTENSIVE:
                return Comparator.comparingLong((PackageEntry e) -> -demandOf(e).getMemoryMb()).thenComparing(byOrder);
            case IO_INTENSIVE:
                return Comparator.comparing((PackageEntry e) -> !isStorageService(e))
                        .thenComparingLong(e -> -demandOf(e).getStorageGb())
                        .thenComparing(byOrder);
            case BALANCED:
            default:
                return byOrder;
        }
    }

    private ResourceDemand demandOf(PackageEntry entry) {
        return packageCatalog.find(entry.getName())
                .map(d -> d.demandFor(entry.getConfig()))
                .orElseGet(() -> ResourceDemand.NONE.overriddenBy(entry.getConfig()));
    }

    private boolean isStorageService(PackageEntry entry) {
        return packageCatalog.find(entry.getName()).map(PackageDefinition::isStorageService).orElse(false);
    }

    /**
     * 单次计划的放置状态
     */
    private static final class Placer {

        private final List<NodeResource> nodes;

        private final Map<Integer, ResourceDemand> used = new HashMap<>();

        private final Map<Integer, NodeAssignment> assignments = new TreeMap<>();

        Placer(List<NodeResource> nodes) {
            this.nodes = nodes;
            nodes.forEach(n -> used.put(n.getId(), ResourceDemand.NONE));
        }

        NodeResource leastLoaded(PackageEntry entry, ResourceDemand demand) {
            return eligible(demand).stream()
                    .min(Comparator.comparingDouble((NodeResource n) -> used.get(n.getId()).loadRatio(n.capacity()))
                            .thenComparingInt(NodeResource::getId))
                    .orElseThrow(() -> shortfall(entry, demand));
        }

        NodeResource highestStorageBandwidth(PackageEntry entry, ResourceDemand demand) {
            return eligible(demand).stream()
                    .min(Comparator.comparingDouble((NodeResource n) -> -n.getStorageBandwidthMbps())
                            .thenComparingInt(NodeResource::getId))
                    .orElseThrow(() -> shortfall(entry, demand));
        }

        NodeResource requireFits(PackageEntry entry, ResourceDemand demand, int nodeId) {
            NodeResource node = nodes.stream().filter(n -> n.getId() == nodeId).findFirst()
                    .orElseThrow(() -> new InsufficientResourcesException(entry.getName(),
                            "node " + nodeId + " is not available"));
            ResourceDemand free = node.capacity().minus(used.get(nodeId));
            if (!demand.fitsWithin(free)) {
                throw new InsufficientResourcesException(entry.getName(),
                        "node " + nodeId + " " + demand.describeShortfall(free));
            }
            return node;
        }

        void place(NodeResource node, PackageEntry entry, ResourceDemand demand) {
            used.merge(node.getId(), demand, ResourceDemand::plus);
            assignments.computeIfAbsent(node.getId(), id -> NodeAssignment.builder()
                    .nodeId(id)
                    .host(node.getHost())
                    .capacity(node.capacity())
                    .build())
                    .getPlacements().add(PackagePlacement.builder()
                            .packageName(entry.getName())
                            .type(entry.getType())
                            .order(entry.getOrder())
                            .reservation(demand)
                            .build());
        }

        List<Integer> nodesHosting(PackageType type) {
            return assignments.values().stream()
                    .filter(a -> a.getPlacements().stream().anyMatch(p -> p.getType() == type))
                    .map(NodeAssignment::getNodeId)
                    .collect(Collectors.toList());
        }

        List<NodeAssignment> assignments() {
            List<NodeAssignment> result = new ArrayList<>(assignments.values());
            result.forEach(NodeAssignment::sortByOrder);
            return result;
        }

        private List<NodeResource> eligible(ResourceDemand demand) {
            return nodes.stream()
                    .filter(n -> used.get(n.getId()).plus(demand).fitsWithin(n.capacity()))
                    .collect(Collectors.toList());
        }

        private InsufficientResourcesException shortfall(PackageEntry entry, ResourceDemand demand) {
            Optional<ResourceDemand> mostFree = nodes.stream()
                    .map(n -> n.capacity().minus(used.get(n.getId())))
                    .reduce(ResourceDemand::max);
            return new InsufficientResourcesException(entry.getName(),
                    mostFree.map(demand::describeShortfall).orElse("no nodes in the resource graph"));
        }
    }
}
