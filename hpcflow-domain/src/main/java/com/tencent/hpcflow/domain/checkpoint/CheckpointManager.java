package com.tencent.hpcflow.domain.checkpoint;

import com.tencent.hpcflow.domain.event.Event;
import com.tencent.hpcflow.domain.event.EventListener;
import com.tencent.hpcflow.domain.event.ExecutionEvents;
import com.tencent.hpcflow.domain.exception.HpcflowException;
import com.tencent.hpcflow.domain.exception.IntegrityException;
import com.tencent.hpcflow.domain.exception.NotFoundException;
import com.tencent.hpcflow.domain.exception.ValidationException;
import com.tencent.hpcflow.domain.execution.ExecutionOrchestrator;
import com.tencent.hpcflow.domain.execution.ExecutionRecord;
import com.tencent.hpcflow.domain.execution.ExecutionState;
import com.tencent.hpcflow.domain.execution.NodeStatus;
import com.tencent.hpcflow.domain.execution.ResumePoint;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * CheckpointManager - 检查点与恢复
 * <p>
 * 定时器只在执行处于 RUNNING 时工作，通过状态事件布设与撤销，不参与编排器的状态迁移。
 * 检查点先完整写入再登记为最新；恢复前校验摘要，校验失败的检查点永远不会被使用。
 * </p>
 *
 * @author hpcflow
 */
@Slf4j
public class CheckpointManager implements EventListener {

    private final CheckpointStore store;

    private final ExecutionOrchestrator orchestrator;

    private final CheckpointSettings settings;

    private final ScheduledExecutorService timers;

    private final Clock clock;

    private final Map<String, Duration> intervals = new ConcurrentHashMap<>();

    private final Map<String, ScheduledFuture<?>> armed = new ConcurrentHashMap<>();

    private final Map<String, Object> writeLocks = new ConcurrentHashMap<>();

    public CheckpointManager(CheckpointStore store, ExecutionOrchestrator orchestrator, CheckpointSettings settings,
                             ScheduledExecutorService timers, Clock clock) {
        this.store = store;
        this.orchestrator = orchestrator;
        this.settings = settings;
        this.timers = timers;
        this.clock = clock;
    }

    /**
     * 为执行设置自动检查点间隔；执行已在 RUNNING 时立即布设
     */
    public void configure(String executionId, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new ValidationException("checkpoint-interval", "Checkpoint interval must be positive");
        }
        ExecutionRecord record = orchestrator.status(executionId);
        if (record.isTerminal()) {
            throw new ValidationException("execution:" + executionId,
                    "Execution " + executionId + " already finished in state " + record.getState());
        }
        intervals.put(executionId, interval);
        disarm(executionId);
        // 重新读取状态，RUNNING 事件可能先于间隔登记到达
        if (orchestrator.status(executionId).getState() == ExecutionState.RUNNING) {
            arm(executionId, interval);
        }
        log.info("Configured checkpoints every {} for execution {}", interval, executionId);
    }

    @Override
    public void onEvent(Event event) {
        if (!ExecutionEvents.STATE_CHANGED.equals(event.getType())) {
            return;
        }
        String executionId = event.getExecutionId();
        ExecutionState to = ExecutionState.valueOf(String.valueOf(event.getPayload().get(ExecutionEvents.KEY_TO)));
        if (to == ExecutionState.RUNNING) {
            Duration interval = intervals.get(executionId);
            if (interval != null) {
                arm(executionId, interval);
            }
        } else if (to == ExecutionState.STOPPING || to == ExecutionState.FAILING || to.isTerminal()) {
            disarm(executionId);
        }
        if (to.isTerminal()) {
            intervals.remove(executionId);
            if (settings.isCheckpointOnTermination() && to != ExecutionState.COMPLETED) {
                checkpointFinalProgress(executionId);
            }
        }
    }

    /**
     * 立即创建检查点，与定时器相位无关
     */
    public Checkpoint createCheckpoint(String executionId) {
        ExecutionRecord record = orchestrator.status(executionId);
        if (record.getPlan() == null) {
            throw new ValidationException("execution:" + executionId,
                    "Execution " + executionId + " has not been planned, nothing to checkpoint");
        }
        synchronized (writeLocks.computeIfAbsent(executionId, id -> new Object())) {
            List<String> ids = store.listIds(executionId);
            long sequence = ids.isEmpty() ? 1 : sequenceOf(ids.get(ids.size() - 1)) + 1;
            Map<Integer, NodeProgress> nodes = new TreeMap<>();
            for (NodeStatus node : record.getNodes().values()) {
                List<String> completed = new ArrayList<>(record.getSkippedPackages());
                node.getCompletedPackages().stream().filter(p -> !completed.contains(p)).forEach(completed::add);
                nodes.put(node.getNodeId(), NodeProgress.builder()
                        .nodeId(node.getNodeId())
                        .host(node.getHost())
                        .lastCompletedIndex(node.getLastCompletedIndex())
                        .completedPackages(completed)
                        .resumableState(node.getResumableState())
                        .build());
            }
            Checkpoint checkpoint = Checkpoint.builder()
                    .id(Checkpoint.idFor(sequence))
                    .executionId(executionId)
                    .pipelineName(record.getPipelineName())
                    .sequence(sequence)
                    .planId(record.getPlan().getId())
                    .nodes(nodes)
                    .createdAt(clock.instant())
                    .build();
            CheckpointDigest.seal(checkpoint);
            store.write(checkpoint);
            orchestrator.recordCheckpoint(executionId, checkpoint.getId());
            log.info("Created checkpoint {} for execution {}", checkpoint.getId(), executionId);
            prune(executionId);
            return checkpoint;
        }
    }

    /**
     * 执行的全部可读检查点，最新的在前
     */
    public List<Checkpoint> list(String executionId) {
        orchestrator.status(executionId);
        List<Checkpoint> result = new ArrayList<>();
        for (String id : store.listIds(executionId)) {
            try {
                store.read(executionId, id).ifPresent(result::add);
            } catch (IntegrityException e) {
                log.warn("Skipping unreadable checkpoint {} of execution {}: {}", id, executionId, e.getMessage());
            }
        }
        Collections.reverse(result);
        return result;
    }

    /**
     * 从检查点恢复，生成从记录位置继续的新执行
     *
     * @param checkpointId 为空时使用最新的校验通过的检查点
     * @throws IntegrityException 指定的检查点校验失败，或没有任何校验通过的检查点
     * @throws NotFoundException 检查点不存在
     */
    public ExecutionRecord restore(String executionId, String checkpointId) {
        orchestrator.status(executionId);
        Checkpoint checkpoint = checkpointId == null ? latestVerified(executionId) : verified(executionId, checkpointId);
        ResumePoint point = ResumePoint.builder()
                .sourceExecutionId(executionId)
                .checkpointId(checkpoint.getId())
                .build();
        for (NodeProgress node : checkpoint.getNodes().values()) {
            point.getLastCompletedIndex().put(node.getNodeId(), node.getLastCompletedIndex());
            point.getCompletedPackages().addAll(node.getCompletedPackages());
            point.getResumableState().put(node.getNodeId(), node.getResumableState());
        }
        ExecutionRecord resumed = orchestrator.resume(point);
        log.info("Restored execution {} from checkpoint {} as {}", executionId, checkpoint.getId(), resumed.getId());
        return resumed;
    }

    /**
     * 删除执行的全部检查点
     */
    public void discard(String executionId) {
        disarm(executionId);
        intervals.remove(executionId);
        store.deleteAll(executionId);
        writeLocks.remove(executionId);
    }

    private Checkpoint verified(String executionId, String checkpointId) {
        Checkpoint checkpoint = store.read(executionId, checkpointId).orElseThrow(() ->
                new NotFoundException("checkpoint:" + checkpointId,
                        "Checkpoint " + checkpointId + " of execution " + executionId + " not found"));
        if (!CheckpointDigest.verify(checkpoint)) {
            throw new IntegrityException("checkpoint:" + checkpointId,
                    "Checkpoint " + checkpointId + " of execution " + executionId + " failed integrity verification");
        }
        return checkpoint;
    }

    private Checkpoint latestVerified(String executionId) {
        List<String> ids = new ArrayList<>(store.listIds(executionId));
        if (ids.isEmpty()) {
            throw new NotFoundException("execution:" + executionId, "Execution " + executionId + " has no checkpoints");
        }
        Collections.reverse(ids);
        for (String id : ids) {
            try {
                Optional<Checkpoint> checkpoint = store.read(executionId, id);
                if (checkpoint.isPresent() && CheckpointDigest.verify(checkpoint.get())) {
                    return checkpoint.get();
                }
                log.warn("Checkpoint {} of execution {} failed verification, trying an older one", id, executionId);
            } catch (IntegrityException e) {
                log.warn("Checkpoint {} of execution {} is unreadable, trying an older one", id, executionId);
            }
        }
        throw new IntegrityException("execution:" + executionId,
                "None of the " + ids.size() + " checkpoints of execution " + executionId + " passed verification");
    }

    private void prune(String executionId) {
        int keep = Math.max(1, settings.getRetention());
        List<String> ids = store.listIds(executionId);
        for (int i = 0; i < ids.size() - keep; i++) {
            store.delete(executionId, ids.get(i));
            log.debug("Pruned checkpoint {} of execution {}", ids.get(i), executionId);
        }
    }

    private void arm(String executionId, Duration interval) {
        long millis = interval.toMillis();
        armed.compute(executionId, (id, previous) -> {
            if (previous != null) {
                previous.cancel(false);
            }
            return timers.scheduleAtFixedRate(() -> timedCheckpoint(id), millis, millis, TimeUnit.MILLISECONDS);
        });
    }

    private void disarm(String executionId) {
        ScheduledFuture<?> timer = armed.remove(executionId);
        if (timer != null) {
            timer.cancel(false);
        }
    }

    /**
     * 定时任务抛出异常会取消后续周期，单次失败只记录日志
     */
    private void timedCheckpoint(String executionId) {
        try {
            createCheckpoint(executionId);
        } catch (HpcflowException e) {
            log.warn("Scheduled checkpoint of execution {} failed: {}", executionId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Scheduled checkpoint of execution {} failed, retrying next interval", executionId, e);
        }
    }

    private void checkpointFinalProgress(String executionId) {
        try {
            ExecutionRecord record = orchestrator.status(executionId);
            boolean progressed = record.getNodes().values().stream().anyMatch(n -> n.getLastCompletedIndex() >= 0);
            if (record.getPlan() != null && progressed) {
                createCheckpoint(executionId);
            }
        } catch (HpcflowException e) {
            log.warn("Final checkpoint of execution {} failed: {}", executionId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Final checkpoint of execution {} failed", executionId, e);
        }
    }

    private static long sequenceOf(String checkpointId) {
        return Long.parseLong(checkpointId.substring(checkpointId.lastIndexOf('-') + 1));
    }
}
