package com.tencent.hpcflow.domain.monitor;

import com.tencent.hpcflow.domain.event.Event;
import com.tencent.hpcflow.domain.event.ExecutionEvents;
import com.tencent.hpcflow.domain.exception.NotFoundException;
import com.tencent.hpcflow.domain.exception.ValidationException;
import com.tencent.hpcflow.domain.execution.ExecutionState;
import com.tencent.hpcflow.domain.execution.NodeState;
import com.tencent.hpcflow.domain.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MonitoringAggregatorTest {

    private static final String EXECUTION = "exec-1";

    private MutableClock clock;

    private MonitoringAggregator aggregator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"));
        aggregator = new MonitoringAggregator(MonitoringSettings.builder()
                .windowSize(8)
                .logLines(3)
                .heartbeatTimeout(Duration.ofSeconds(15))
                .retainedExecutions(1)
                .build(), clock);
    }

    @Test
    void testSnapshotOfUnknownExecution() {
        assertThrows(NotFoundException.class, () -> aggregator.snapshot("missing"));
    }

    @Test
    void testWindowAveragesAndTrend() {
        state(ExecutionState.RUNNING);
        for (int i = 0; i < 10; i++) {
            heartbeat(0, 10 + i * 10, 50, 5);
        }

        NodeFrame node = aggregator.snapshot(EXECUTION).getNodes().get(0);

        // 窗口只保留最近 8 个采样：30..100
        assertEquals(65.0, node.getAverageCpu(), 0.001);
        assertEquals(100.0, node.getLatest().getCpu(), 0.001);
        assertEquals(Trend.RISING, node.getTrends().get("cpu"));
        assertEquals(Trend.STABLE, node.getTrends().get("memory"));
        assertEquals(NodeHealth.HEALTHY, node.getHealth());
    }

    @Test
    void testLogTailIsBounded() {
        state(ExecutionState.RUNNING);
        for (int i = 1; i <= 5; i++) {
            publish(0, ExecutionEvents.NODE_LOG, Map.of(ExecutionEvents.KEY_LINE, "line " + i));
        }

        assertEquals(List.of("line 3", "line 4", "line 5"),
                aggregator.snapshot(EXECUTION).getNodes().get(0).getRecentLogs());
    }

    @Test
    void testMissingHeartbeatsRaiseAlert() {
        state(ExecutionState.RUNNING);
        heartbeat(0, 20, 20, 1);
        heartbeat(1, 20, 20, 1);

        clock.advance(Duration.ofSeconds(10));
        heartbeat(1, 20, 20, 1);
        clock.advance(Duration.ofSeconds(10));

        MonitoringFrame frame = aggregator.snapshot(EXECUTION);

        assertEquals(NodeHealth.UNRESPONSIVE, frame.getNodes().get(0).getHealth());
        assertEquals(NodeHealth.HEALTHY, frame.getNodes().get(1).getHealth());
        assertEquals(List.of("node 0 is unresponsive"), frame.getAlerts());
    }

    @Test
    void testFinishedNodesAreNotUnresponsive() {
        state(ExecutionState.RUNNING);
        heartbeat(0, 20, 20, 1);
        publish(0, ExecutionEvents.NODE_STATUS, Map.of(ExecutionEvents.KEY_STATUS, NodeState.COMPLETED.name()));
        clock.advance(Duration.ofMinutes(5));

        NodeFrame node = aggregator.snapshot(EXECUTION).getNodes().get(0);

        assertEquals(NodeHealth.FINISHED, node.getHealth());
        assertEquals(NodeState.COMPLETED, node.getState());
    }

    @Test
    void testAlertRules() {
        aggregator.addAlertRule(AlertRule.builder()
                .name("hot-cpu")
                .condition("averageCpu > 90")
                .message("node {node} is running hot")
                .build());
        state(ExecutionState.RUNNING);
        heartbeat(0, 95, 10, 1);
        heartbeat(1, 40, 10, 1);

        assertEquals(List.of("[hot-cpu] node 0 is running hot"), aggregator.snapshot(EXECUTION).getAlerts());
        assertThrows(ValidationException.class, () -> aggregator.addAlertRule(AlertRule.builder()
                .name("broken").condition("averageCpu >").build()));
    }

    @Test
    void testStreamEndsAfterTerminalFrame() throws Exception {
        state(ExecutionState.RUNNING);
        MonitoringStream stream = aggregator.stream(EXECUTION, Duration.ofMillis(20));

        CompletableFuture<List<ExecutionState>> collected = CompletableFuture.supplyAsync(() -> {
            List<ExecutionState> states = new ArrayList<>();
            for (MonitoringFrame frame : stream) {
                states.add(frame.getState());
            }
            return states;
        });
        Thread.sleep(100);
        state(ExecutionState.COMPLETING);
        state(ExecutionState.COMPLETED);

        List<ExecutionState> states = collected.get(5, TimeUnit.SECONDS);
        assertEquals(ExecutionState.RUNNING, states.get(0));
        assertEquals(ExecutionState.COMPLETED, states.get(states.size() - 1));
        assertEquals(1, states.stream().filter(ExecutionState::isTerminal).count());
    }

    @Test
    void testCancelWakesWaitingIterator() throws Exception {
        state(ExecutionState.RUNNING);
        MonitoringStream stream = aggregator.stream(EXECUTION, Duration.ofSeconds(30));
        Iterator<MonitoringFrame> frames = stream.iterator();
        assertTrue(frames.hasNext());
        frames.next();

        CompletableFuture<Boolean> more = CompletableFuture.supplyAsync(frames::hasNext);
        Thread.sleep(50);
        stream.cancel();

        assertFalse(more.get(5, TimeUnit.SECONDS));
    }

    @Test
    void testStreamRejectsNonPositiveInterval() {
        state(ExecutionState.RUNNING);
        assertThrows(ValidationException.class, () -> aggregator.stream(EXECUTION, Duration.ZERO));
    }

    @Test
    void testFinishedExecutionsAreEvictedBeyondRetention() {
        state(ExecutionState.FAILED);
        publish("exec-2", null, ExecutionEvents.STATE_CHANGED, Map.of(ExecutionEvents.KEY_TO, "STOPPED"));

        assertThrows(NotFoundException.class, () -> aggregator.snapshot(EXECUTION));
        assertEquals(ExecutionState.STOPPED, aggregator.snapshot("exec-2").getState());
    }

    private void state(ExecutionState to) {
        publish(null, ExecutionEvents.STATE_CHANGED, Map.of(ExecutionEvents.KEY_TO, to.name()));
    }

    private void heartbeat(int nodeId, double cpu, double memory, double io) {
        publish(nodeId, ExecutionEvents.NODE_HEARTBEAT, Map.of(
                ExecutionEvents.KEY_CPU, cpu,
                ExecutionEvents.KEY_MEMORY, memory,
                ExecutionEvents.KEY_IO, io));
    }

    private void publish(Integer nodeId, String type, Map<String, Object> payload) {
        publish(EXECUTION, nodeId, type, payload);
    }

    private void publish(String executionId, Integer nodeId, String type, Map<String, Object> payload) {
        aggregator.onEvent(Event.builder()
                .type(type)
                .time(clock.instant())
                .pipelineName("io_test")
                .executionId(executionId)
                .nodeId(nodeId)
                .payload(payload)
                .build());
    }
}
