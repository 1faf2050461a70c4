package com.tencent.hpcflow.domain.resource;

import com.tencent.hpcflow.domain.exception.NotFoundException;
import com.tencent.hpcflow.domain.support.MutableClock;
import com.tencent.hpcflow.domain.support.Pipelines;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ResourceModelTest {

    private MutableClock clock;

    private AtomicInteger probes;

    private ResourceModel model;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        probes = new AtomicInteger();
        model = new ResourceModel(() -> {
            probes.incrementAndGet();
            return List.of(Pipelines.node(1, 8, 16384, 500, 1000), Pipelines.node(0, 4, 8192, 100, 2000));
        }, Duration.ofMinutes(1), clock);
    }

    @Test
    void testFirstAccessProbesOnce() {
        ResourceGraph graph = model.current();

        assertEquals(1, graph.getVersion());
        assertSame(graph, model.current());
        assertEquals(1, probes.get());
        assertEquals(List.of(0, 1), graph.getNodes().stream().map(NodeResource::getId).collect(Collectors.toList()));
    }

    @Test
    void testRefreshPublishesNewVersion() {
        ResourceGraph first = model.current();
        ResourceGraph second = model.refresh();

        assertEquals(2, second.getVersion());
        assertEquals(1, first.getVersion());
    }

    @Test
    void testFreshSnapshotRefreshesOnlyWhenStale() {
        model.current();

        clock.advance(Duration.ofMinutes(2));
        assertEquals(1, model.freshSnapshot(Duration.ofMinutes(5)).getVersion());

        clock.advance(Duration.ofMinutes(4));
        assertEquals(2, model.freshSnapshot(Duration.ofMinutes(5)).getVersion());
        assertEquals(2, probes.get());
    }

    @Test
    void testGraphLookups() {
        ResourceGraph graph = model.current();

        assertEquals(4, graph.node(0).getCores());
        assertThrows(NotFoundException.class, () -> graph.node(9));
        assertEquals(1, graph.firstNodes(1).size());
        assertEquals(2, graph.firstNodes(0).size());
        assertEquals(2, graph.firstNodes(10).size());
    }
}
