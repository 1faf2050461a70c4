package com.tencent.hpcflow.domain.monitor;

import com.tencent.hpcflow.domain.event.Event;
import com.tencent.hpcflow.domain.event.ExecutionEvents;
import com.tencent.hpcflow.domain.exception.ValidationException;
import com.tencent.hpcflow.domain.execution.ExecutionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionLogCollectorTest {

    private static final String EXECUTION = "exec-1";

    private ExecutionLogCollector collector;

    @BeforeEach
    void setUp() {
        collector = new ExecutionLogCollector(MonitoringSettings.builder()
                .collectedLogLines(4)
                .retainedExecutions(1)
                .build());
    }

    @Test
    void testLevelDetection() {
        assertEquals(LogLevel.INFO, LogLevel.detect("step 3 of 10"));
        assertEquals(LogLevel.DEBUG, LogLevel.detect("[trace] entering solver"));
        assertEquals(LogLevel.WARNING, LogLevel.detect("WARN: mesh quality low"));
        assertEquals(LogLevel.ERROR, LogLevel.detect("Segmentation fault (core dumped)"));
        assertEquals(LogLevel.CRITICAL, LogLevel.detect("FATAL error: out of memory"));
        assertEquals(LogLevel.WARNING, LogLevel.fromValue("warn"));
        assertEquals(LogLevel.DEBUG, LogLevel.fromValue(null));
        assertThrows(ValidationException.class, () -> LogLevel.fromValue("loud"));
    }

    @Test
    void testCollectsNodeLinesAndStateChanges() {
        state(ExecutionState.LAUNCHING, ExecutionState.RUNNING);
        line(0, "running gromacs");
        line(1, "WARNING: slow interconnect");

        ExecutionLogs logs = collector.collect(EXECUTION);

        assertEquals("io_test", logs.getPipelineName());
        assertEquals(3, logs.getTotal());
        assertEquals(List.of("state LAUNCHING -> RUNNING", "running gromacs", "WARNING: slow interconnect"), lines(logs));
        assertNull(logs.getEntries().get(0).getNodeId());
        assertEquals(1, logs.getEntries().get(2).getNodeId());
        assertEquals(2L, logs.getCountsByLevel().get(LogLevel.INFO));
        assertEquals(1L, logs.getCountsByLevel().get(LogLevel.WARNING));
    }

    @Test
    void testSearchByLevelAndPattern() {
        line(0, "step 1 done");
        line(0, "WARN: retrying rank 3");
        line(1, "ERROR: rank 7 lost");
        state(ExecutionState.RUNNING, ExecutionState.FAILING);

        assertEquals(List.of("WARN: retrying rank 3", "ERROR: rank 7 lost", "state RUNNING -> FAILING"),
                lines(collector.search(EXECUTION, LogLevel.WARNING, null)));
        assertEquals(List.of("ERROR: rank 7 lost"),
                lines(collector.search(EXECUTION, LogLevel.ERROR, "rank \\d")));
        // 计数覆盖全部日志，不受检索条件影响
        assertEquals(4, collector.search(EXECUTION, LogLevel.CRITICAL, null).getTotal());
        assertThrows(ValidationException.class, () -> collector.search(EXECUTION, null, "rank ("));
    }

    @Test
    void testOldestLinesAreDropped() {
        for (int i = 1; i <= 6; i++) {
            line(0, "line " + i);
        }

        ExecutionLogs logs = collector.collect(EXECUTION);

        assertEquals(List.of("line 3", "line 4", "line 5", "line 6"), lines(logs));
        assertEquals(2, logs.getDropped());
        assertEquals(6, logs.getEntries().get(3).getSequence());
    }

    @Test
    void testFinishedExecutionsAreEvictedAndDiscarded() {
        line(0, "first");
        state(ExecutionState.RUNNING, ExecutionState.COMPLETED);
        publish("exec-2", 0, ExecutionEvents.NODE_LOG, Map.of(ExecutionEvents.KEY_LINE, "second"));
        publish("exec-2", null, ExecutionEvents.STATE_CHANGED, Map.of(
                ExecutionEvents.KEY_FROM, ExecutionState.RUNNING.name(),
                ExecutionEvents.KEY_TO, ExecutionState.COMPLETED.name()));

        // 只保留最近一个已结束的执行
        assertTrue(collector.collect(EXECUTION).getEntries().isEmpty());
        assertEquals(2, collector.collect("exec-2").getTotal());

        collector.discard("exec-2");
        assertEquals(0, collector.collect("exec-2").getTotal());
    }

    private static List<String> lines(ExecutionLogs logs) {
        return logs.getEntries().stream().map(LogEntry::getLine).collect(Collectors.toList());
    }

    private void state(ExecutionState from, ExecutionState to) {
        publish(EXECUTION, null, ExecutionEvents.STATE_CHANGED, Map.of(
                ExecutionEvents.KEY_FROM, from.name(),
                ExecutionEvents.KEY_TO, to.name()));
    }

    private void line(int nodeId, String line) {
        publish(EXECUTION, nodeId, ExecutionEvents.NODE_LOG, Map.of(ExecutionEvents.KEY_LINE, line));
    }

    private void publish(String executionId, Integer nodeId, String type, Map<String, Object> payload) {
        collector.onEvent(Event.builder()
                .type(type)
                .time(Instant.parse("2026-03-01T08:00:00Z"))
                .pipelineName("io_test")
                .executionId(executionId)
                .nodeId(nodeId)
                .payload(payload)
                .build());
    }
}
