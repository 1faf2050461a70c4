package com.tencent.hpcflow.domain.resource;

import com.tencent.hpcflow.domain.exception.NotFoundException;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * ResourceGraph - 集群拓扑与容量的不可变快照
 * <p>
 * 发布后不再修改；刷新会生成一个版本号更大的新快照，
 * 已生成的分配计划继续引用自己的快照。
 * </p>
 */
@Getter
@ToString
public final class ResourceGraph {

    private final long version;

    private final List<NodeResource> nodes;

    private final Instant refreshedAt;

    private final Duration refreshInterval;

    public ResourceGraph(long version, List<NodeResource> nodes, Instant refreshedAt, Duration refreshInterval) {
        this.version = version;
        this.nodes = nodes.stream()
                .sorted(Comparator.comparingInt(NodeResource::getId))
                .collect(Collectors.toUnmodifiableList());
        this.refreshedAt = refreshedAt;
        this.refreshInterval = refreshInterval;
    }

    public Optional<NodeResource> findNode(int nodeId) {
        return nodes.stream().filter(n -> n.getId() == nodeId).findFirst();
    }

    public NodeResource node(int nodeId) {
        return findNode(nodeId).orElseThrow(() ->
                new NotFoundException("node:" + nodeId, "Node " + nodeId + " is not in resource graph v" + version));
    }

    /**
     * 快照距今是否超过给定的时长
     */
    public boolean isOlderThan(Duration maxAge, Instant now) {
        return refreshedAt.plus(maxAge).isBefore(now);
    }

    /**
     * 按编号取前 n 个节点，n 不大于 0 时返回全部
     */
    public List<NodeResource> firstNodes(int count) {
        if (count <= 0 || count >= nodes.size()) {
            return nodes;
        }
        return nodes.subList(0, count);
    }
}
