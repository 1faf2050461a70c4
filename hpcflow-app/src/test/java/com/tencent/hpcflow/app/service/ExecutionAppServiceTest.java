package com.tencent.hpcflow.app.service;

import com.tencent.hpcflow.app.support.AppFixture;
import com.tencent.hpcflow.domain.checkpoint.Checkpoint;
import com.tencent.hpcflow.domain.exception.ConflictException;
import com.tencent.hpcflow.domain.exception.NotFoundException;
import com.tencent.hpcflow.domain.exception.ValidationException;
import com.tencent.hpcflow.domain.execution.CleanLevel;
import com.tencent.hpcflow.domain.execution.CleanReport;
import com.tencent.hpcflow.domain.execution.ExecutionRecord;
import com.tencent.hpcflow.domain.execution.ExecutionState;
import com.tencent.hpcflow.domain.execution.RunRequest;
import com.tencent.hpcflow.domain.monitor.ExecutionLogs;
import com.tencent.hpcflow.domain.monitor.LogEntry;
import com.tencent.hpcflow.domain.monitor.LogLevel;
import com.tencent.hpcflow.domain.monitor.MonitoringFrame;
import com.tencent.hpcflow.domain.support.OrchestrationHarness;
import com.tencent.hpcflow.domain.support.Pipelines;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionAppServiceTest {

    private final AppFixture fixture = new AppFixture();

    private final ExecutionAppService service = fixture.executions;

    @BeforeEach
    void setUp() {
        fixture.harness.pipeline("io_test", "storage_service", "benchmark");
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void testRunToCompletionAndMonitor() {
        ExecutionRecord started = service.run(RunRequest.builder().pipelineName("io_test").build(), null);
        ExecutionRecord finished = fixture.harness.awaitEnd(started.getId());

        assertEquals(ExecutionState.COMPLETED, finished.getState());
        MonitoringFrame frame = service.monitor(started.getId());
        assertEquals(ExecutionState.COMPLETED, frame.getState());
        assertFalse(frame.getNodes().isEmpty());
        assertEquals(List.of(started.getId()),
                service.history("io_test").stream().map(ExecutionRecord::getId).collect(Collectors.toList()));
    }

    @Test
    void testRunWithCheckpointInterval() {
        fixture.harness.sshLauncher.defaults().eachPackageTakes(Duration.ofSeconds(10));

        ExecutionRecord started = service.run(RunRequest.builder().pipelineName("io_test").build(),
                Duration.ofMillis(50));
        OrchestrationHarness.eventually(() -> !fixture.checkpointStore.listIds(started.getId()).isEmpty(),
                "no periodic checkpoint for " + started.getId());

        service.stop(started.getId(), true);
        assertTrue(service.checkpoints(started.getId()).size() >= 1);
    }

    @Test
    void testNonPositiveIntervalRejectedBeforeLaunch() {
        assertThrows(ValidationException.class, () -> service.run(
                RunRequest.builder().pipelineName("io_test").build(), Duration.ZERO));
        assertTrue(service.history("io_test").isEmpty());
    }

    @Test
    void testSecondRunConflicts() {
        fixture.harness.sshLauncher.defaults().eachPackageTakes(Duration.ofSeconds(10));
        ExecutionRecord started = service.run(RunRequest.builder().pipelineName("io_test").build(), null);

        assertThrows(ConflictException.class,
                () -> service.run(RunRequest.builder().pipelineName("io_test").build(), null));

        service.stop(started.getId(), true);
    }

    @Test
    void testDeepCleanDiscardsCheckpoints() {
        ExecutionRecord started = service.run(RunRequest.builder().pipelineName("io_test").build(), null);
        fixture.harness.awaitEnd(started.getId());
        Checkpoint checkpoint = service.checkpoint(started.getId());
        assertEquals(List.of(checkpoint.getId()), fixture.checkpointStore.listIds(started.getId()));

        CleanReport report = service.clean("io_test", CleanLevel.DEEP, false, false);

        assertEquals(List.of(started.getId()), report.getRemovedExecutions());
        assertTrue(fixture.checkpointStore.listIds(started.getId()).isEmpty());
        assertThrows(NotFoundException.class, () -> service.status(started.getId()));
    }

    @Test
    void testStandardCleanKeepsLatestExecution() {
        ExecutionRecord first = service.run(RunRequest.builder().pipelineName("io_test").build(), null);
        fixture.harness.awaitEnd(first.getId());
        ExecutionRecord second = service.run(RunRequest.builder().pipelineName("io_test").build(), null);
        fixture.harness.awaitEnd(second.getId());

        CleanReport report = service.clean("io_test", null, true, true);

        assertEquals(CleanLevel.STANDARD, report.getLevel());
        assertEquals(List.of(first.getId()), report.getRemovedExecutions());
        assertEquals(ExecutionState.COMPLETED, service.status(second.getId()).getState());
    }

    @Test
    void testLogsCollectedAcrossExecution() {
        ExecutionRecord started = service.run(RunRequest.builder().pipelineName("io_test").build(), null);
        fixture.harness.awaitEnd(started.getId());
        OrchestrationHarness.eventually(
                () -> !service.logs(started.getId(), null, "-> COMPLETED").getEntries().isEmpty(),
                "no completion line for " + started.getId());

        ExecutionLogs nodeLines = service.logs(started.getId(), LogLevel.INFO, "^running benchmark$");
        assertFalse(nodeLines.getEntries().isEmpty());
        assertTrue(nodeLines.getEntries().stream().map(LogEntry::getNodeId).allMatch(id -> id != null));
        assertTrue(service.logs(started.getId(), LogLevel.ERROR, null).getEntries().isEmpty());
        assertThrows(NotFoundException.class, () -> service.logs("missing", null, null));
        assertThrows(ValidationException.class, () -> service.logs(started.getId(), null, "(["));
    }

    @Test
    void testCleanDiscardsLogsUnlessPreserved() {
        ExecutionRecord first = service.run(RunRequest.builder().pipelineName("io_test").build(), null);
        fixture.harness.awaitEnd(first.getId());
        ExecutionRecord second = service.run(RunRequest.builder().pipelineName("io_test").build(), null);
        fixture.harness.awaitEnd(second.getId());
        OrchestrationHarness.eventually(() -> fixture.logCollector.collect(first.getId()).getTotal() > 0,
                "no logs for " + first.getId());

        service.clean("io_test", CleanLevel.STANDARD, true, true);
        assertTrue(fixture.logCollector.collect(first.getId()).getTotal() > 0);

        ExecutionRecord third = service.run(RunRequest.builder().pipelineName("io_test").build(), null);
        fixture.harness.awaitEnd(third.getId());
        service.clean("io_test", CleanLevel.STANDARD, false, true);
        assertEquals(0, fixture.logCollector.collect(second.getId()).getTotal());
    }

    @Test
    void testDryRunPlansWithoutExecuting() {
        assertNull(service.dryRun(RunRequest.builder().pipelineName("io_test").build()).getPlanError());
        assertTrue(service.history("io_test").isEmpty());
    }

    @Test
    void testResourcesReflectProbe() {
        assertEquals(2, service.resources().getNodes().size());
        fixture.harness.nodes.set(Pipelines.uniformNodes(3));
        assertEquals(3, service.refreshResources().getNodes().size());
    }
}
