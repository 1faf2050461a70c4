package com.tencent.hpcflow.domain.schedule;

import com.tencent.hpcflow.domain.execution.ExecutionMethodConfig;
import com.tencent.hpcflow.domain.resource.NodeResource;
import com.tencent.hpcflow.domain.resource.ResourceDemand;
import com.tencent.hpcflow.domain.resource.ResourceGraph;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * AllocationPlan - 一次执行尝试的节点分配
 * <p>
 * 只记录生成时所用快照的版本号，快照刷新不影响已生成的计划。
 * 只包含至少放置了一个包的节点。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AllocationPlan {

    private String id;

    private String pipelineName;

    private long graphVersion;

    private AllocationStrategy strategy;

    private ExecutionMethodConfig methodConfig;

    @Builder.Default
    private List<NodeAssignment> assignments = new ArrayList<>();

    /**
     * 生成计划时使用的硬性放置约束
     */
    @Builder.Default
    private Map<String, Integer> pins = new LinkedHashMap<>();

    private Instant createdAt;

    public Optional<NodeAssignment> assignment(int nodeId) {
        return assignments.stream().filter(a -> a.getNodeId() == nodeId).findFirst();
    }

    public ResourceDemand reservedOn(int nodeId) {
        return assignment(nodeId).map(NodeAssignment::reserved).orElse(ResourceDemand.NONE);
    }

    public List<Integer> nodeIds() {
        return assignments.stream().map(NodeAssignment::getNodeId).collect(Collectors.toList());
    }

    /**
     * 包所在的节点编号（拦截器可能在多个节点上）
     */
    public List<Integer> nodesOf(String packageName) {
        return assignments.stream()
                .filter(a -> a.getPlacements().stream().anyMatch(p -> p.getPackageName().equals(packageName)))
                .map(NodeAssignment::getNodeId)
                .collect(Collectors.toList());
    }

    /**
     * 计划在新快照上是否仍然成立：节点仍在、主机不变、容量仍能容纳预留
     */
    public boolean isCompatibleWith(ResourceGraph graph) {
        for (NodeAssignment assignment : assignments) {
            Optional<NodeResource> node = graph.findNode(assignment.getNodeId());
            if (node.isEmpty() || !node.get().getHost().equals(assignment.getHost())
                    || !assignment.reserved().fitsWithin(node.get().capacity())) {
                return false;
            }
        }
        return true;
    }
}
