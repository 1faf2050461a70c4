package com.tencent.hpcflow.domain.resource;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ResourceModel - 资源模型
 * <p>
 * 持有当前发布的 {@link ResourceGraph}。刷新时重新探测并整体替换快照，
 * 读取方拿到的快照永远不会被修改。
 * </p>
 */
@Slf4j
public class ResourceModel {

    private final ResourceProbe probe;

    private final Duration refreshInterval;

    private final Clock clock;

    private final AtomicReference<ResourceGraph> current = new AtomicReference<>();

    public ResourceModel(ResourceProbe probe, Duration refreshInterval, Clock clock) {
        this.probe = probe;
        this.refreshInterval = refreshInterval;
        this.clock = clock;
    }

    /**
     * 当前快照；尚未探测过时先探测一次
     */
    public ResourceGraph current() {
        ResourceGraph graph = current.get();
        return graph != null ? graph : refresh();
    }

    /**
     * 重新探测并发布新版本
     */
    public synchronized ResourceGraph refresh() {
        List<NodeResource> nodes = probe.probe();
        ResourceGraph previous = current.get();
        long version = previous == null ? 1 : previous.getVersion() + 1;
        ResourceGraph graph = new ResourceGraph(version, nodes, clock.instant(), refreshInterval);
        current.set(graph);
        log.info("Published resource graph v{} with {} nodes", version, nodes.size());
        return graph;
    }

    /**
     * 返回不早于 maxAge 的快照，过旧时先刷新
     */
    public ResourceGraph freshSnapshot(Duration maxAge) {
        ResourceGraph graph = current();
        if (graph.isOlderThan(maxAge, clock.instant())) {
            log.debug("Resource graph v{} is older than {}, refreshing", graph.getVersion(), maxAge);
            return refresh();
        }
        return graph;
    }

    /**
     * 按刷新间隔周期性刷新
     */
    public ScheduledFuture<?> scheduleRefresh(ScheduledExecutorService scheduler) {
        long millis = refreshInterval.toMillis();
        return scheduler.scheduleWithFixedDelay(() -> {
            try {
                refresh();
            } catch (RuntimeException e) {
                log.warn("Resource refresh failed, keeping graph v{}", current().getVersion(), e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
    }

    public Clock getClock() {
        return clock;
    }
}
