package com.tencent.hpcflow.domain.checkpoint;

import com.tencent.hpcflow.domain.exception.IntegrityException;
import com.tencent.hpcflow.domain.exception.NotFoundException;
import com.tencent.hpcflow.domain.exception.ResourcePlanStaleException;
import com.tencent.hpcflow.domain.exception.ValidationException;
import com.tencent.hpcflow.domain.execution.ExecutionMethodConfig;
import com.tencent.hpcflow.domain.execution.ExecutionRecord;
import com.tencent.hpcflow.domain.execution.ExecutionState;
import com.tencent.hpcflow.domain.execution.RunRequest;
import com.tencent.hpcflow.domain.execution.launcher.FakeNodeSession;
import com.tencent.hpcflow.domain.resource.NodeResource;
import com.tencent.hpcflow.domain.support.OrchestrationHarness;
import com.tencent.hpcflow.domain.support.Pipelines;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CheckpointManagerTest {

    private OrchestrationHarness harness;

    private InMemoryCheckpointStore store;

    private CheckpointManager manager;

    @BeforeEach
    void setUp() {
        harness = new OrchestrationHarness();
        store = new InMemoryCheckpointStore();
        manager = new CheckpointManager(store, harness.orchestrator,
                CheckpointSettings.builder().retention(3).build(), harness.timers, harness.clock);
        harness.eventBus.subscribe(manager);

        harness.pipeline("chain", "step0", "step1", "step2", "step3", "step4");
        harness.composition.configureExecutionMethod("chain", ExecutionMethodConfig.local());
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void testRestoreResumesAfterLastCompletedPackage() {
        // 1. 第 4 个包失败，前 3 个已完成
        String failed = failAt("step3");
        Checkpoint checkpoint = manager.list(failed).get(0);
        assertEquals(2, checkpoint.getNodes().get(0).getLastCompletedIndex());
        assertEquals(List.of("step0", "step1", "step2"), checkpoint.getNodes().get(0).getCompletedPackages());

        // 2. 修复后恢复
        harness.localLauncher.script(0).recover();
        ExecutionRecord resumed = manager.restore(failed, null);
        ExecutionRecord finished = harness.awaitEnd(resumed.getId());

        // 3. 只运行剩余的包
        assertEquals(ExecutionState.COMPLETED, finished.getState());
        assertEquals(failed, finished.getResumedFromExecution());
        assertEquals(checkpoint.getId(), finished.getResumedFromCheckpoint());
        assertEquals(List.of("step0", "step1", "step2"), finished.getSkippedPackages());
        FakeNodeSession session = harness.localLauncher.session(resumed.getId(), 0);
        assertEquals(List.of("step3", "step4"), session.ran());
        assertEquals("step2", session.request().getResumableState().get("last"));
        assertEquals(4, finished.node(0).getLastCompletedIndex());
    }

    @Test
    void testExplicitCorruptCheckpointIsRejected() {
        String failed = failAt("step3");
        Checkpoint good = manager.list(failed).get(0);
        Checkpoint later = manager.createCheckpoint(failed);
        store.tamper(failed, later.getId(), "\"lastCompletedIndex\":2", "\"lastCompletedIndex\":4");

        IntegrityException e = assertThrows(IntegrityException.class, () -> manager.restore(failed, later.getId()));
        assertEquals("checkpoint:" + later.getId(), e.getEntity());

        // 未指定时跳过损坏的检查点
        harness.localLauncher.script(0).recover();
        ExecutionRecord resumed = manager.restore(failed, null);
        assertEquals(good.getId(), resumed.getResumedFromCheckpoint());
        assertEquals(ExecutionState.COMPLETED, harness.awaitEnd(resumed.getId()).getState());
    }

    @Test
    void testUnreadableCheckpointsAreSkipped() {
        String failed = failAt("step1");
        Checkpoint later = manager.createCheckpoint(failed);
        store.tamper(failed, later.getId(), "{", "<");

        assertEquals(1, manager.list(failed).size());
        assertThrows(IntegrityException.class, () -> manager.restore(failed, later.getId()));
        assertThrows(NotFoundException.class, () -> manager.restore(failed, "cp-999999"));
    }

    @Test
    void testNoVerifiedCheckpointLeft() {
        String failed = failAt("step1");
        String only = manager.list(failed).get(0).getId();
        store.tamper(failed, only, "\"lastCompletedIndex\":0", "\"lastCompletedIndex\":3");

        assertThrows(IntegrityException.class, () -> manager.restore(failed, null));
    }

    @Test
    void testRetentionKeepsNewest() {
        String failed = failAt("step2");
        for (int i = 0; i < 4; i++) {
            manager.createCheckpoint(failed);
        }

        List<String> ids = manager.list(failed).stream().map(Checkpoint::getId).collect(Collectors.toList());

        assertEquals(List.of("cp-000005", "cp-000004", "cp-000003"), ids);
        assertEquals("cp-000005", harness.orchestrator.status(failed).getLastCheckpointId());
    }

    @Test
    void testCompletedExecutionHasNoCheckpoint() {
        ExecutionRecord record = harness.awaitEnd(
                harness.orchestrator.run(RunRequest.builder().pipelineName("chain").build()).getId());

        assertEquals(ExecutionState.COMPLETED, record.getState());
        assertTrue(manager.list(record.getId()).isEmpty());
        assertThrows(NotFoundException.class, () -> manager.restore(record.getId(), null));
    }

    @Test
    void testScheduledCheckpointsWhileRunning() {
        harness.localLauncher.script(0).eachPackageTakes(Duration.ofMillis(200));
        ExecutionRecord started = harness.orchestrator.run(RunRequest.builder().pipelineName("chain").build());

        assertThrows(ValidationException.class, () -> manager.configure(started.getId(), Duration.ZERO));
        manager.configure(started.getId(), Duration.ofMillis(50));

        OrchestrationHarness.eventually(() -> !store.listIds(started.getId()).isEmpty(),
                "no scheduled checkpoint was written");
        harness.awaitEnd(started.getId());
        assertThrows(ValidationException.class, () -> manager.configure(started.getId(), Duration.ofMillis(50)));
    }

    @Test
    void testScheduledCheckpointsContinueAfterWriteFailure() {
        harness.localLauncher.script(0).eachPackageTakes(Duration.ofMillis(200));
        store.failNextWrites(1);
        ExecutionRecord started = harness.orchestrator.run(RunRequest.builder().pipelineName("chain").build());

        manager.configure(started.getId(), Duration.ofMillis(50));

        OrchestrationHarness.eventually(() -> !store.listIds(started.getId()).isEmpty(),
                "timer stopped after the failed write");
        assertEquals(1, store.failedWrites());
        assertEquals(ExecutionState.COMPLETED, harness.awaitEnd(started.getId()).getState());
    }

    @Test
    void testRestoreReplansWhenHostChanged() {
        String failed = failAt("step3");
        harness.nodes.set(List.of(NodeResource.builder()
                .id(0).host("replacement").cores(8).memoryMb(16384).storageGb(500).build()));
        harness.resourceModel.refresh();
        harness.localLauncher.script(0).recover();

        ExecutionRecord resumed = manager.restore(failed, null);
        ExecutionRecord finished = harness.awaitEnd(resumed.getId());

        assertEquals(ExecutionState.COMPLETED, finished.getState());
        assertEquals("replacement", finished.getPlan().getAssignments().get(0).getHost());
        assertEquals(List.of("step3", "step4"), harness.localLauncher.session(resumed.getId(), 0).ran());
    }

    @Test
    void testRestoreFailsWhenResourcesNoLongerFit() {
        String failed = failAt("step3");
        harness.nodes.set(List.of(Pipelines.node(0, 4, 16384, 500, 1000)));
        harness.resourceModel.refresh();

        assertThrows(ResourcePlanStaleException.class, () -> manager.restore(failed, null));
        assertTrue(harness.orchestrator.history("chain").stream()
                .anyMatch(r -> failed.equals(r.getResumedFromExecution()) && r.getState() == ExecutionState.FAILED));
    }

    @Test
    void testDiscardRemovesCheckpoints() {
        String failed = failAt("step1");

        manager.discard(failed);

        assertTrue(store.listIds(failed).isEmpty());
    }

    /**
     * 运行 chain 并在给定包处失败，等待最终检查点写入
     */
    private String failAt(String packageName) {
        harness.localLauncher.script(0).failOn(packageName);
        ExecutionRecord started = harness.orchestrator.run(RunRequest.builder().pipelineName("chain").build());
        ExecutionRecord record = harness.awaitEnd(started.getId());
        assertEquals(ExecutionState.FAILED, record.getState());
        OrchestrationHarness.eventually(() -> !store.listIds(started.getId()).isEmpty(),
                "final checkpoint was not written");
        return started.getId();
    }
}
