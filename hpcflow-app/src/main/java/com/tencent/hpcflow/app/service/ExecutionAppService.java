package com.tencent.hpcflow.app.service;

import com.tencent.hpcflow.domain.checkpoint.Checkpoint;
import com.tencent.hpcflow.domain.checkpoint.CheckpointManager;
import com.tencent.hpcflow.domain.exception.ValidationException;
import com.tencent.hpcflow.domain.execution.CleanLevel;
import com.tencent.hpcflow.domain.execution.CleanReport;
import com.tencent.hpcflow.domain.execution.DryRunResult;
import com.tencent.hpcflow.domain.execution.ExecutionAnalysis;
import com.tencent.hpcflow.domain.execution.ExecutionOrchestrator;
import com.tencent.hpcflow.domain.execution.ExecutionRecord;
import com.tencent.hpcflow.domain.execution.RunRequest;
import com.tencent.hpcflow.domain.monitor.ExecutionLogCollector;
import com.tencent.hpcflow.domain.monitor.ExecutionLogs;
import com.tencent.hpcflow.domain.monitor.LogLevel;
import com.tencent.hpcflow.domain.monitor.MonitoringAggregator;
import com.tencent.hpcflow.domain.monitor.MonitoringFrame;
import com.tencent.hpcflow.domain.monitor.MonitoringStream;
import com.tencent.hpcflow.domain.resource.ResourceGraph;
import com.tencent.hpcflow.domain.resource.ResourceModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * ExecutionAppService - 执行、检查点与监控的操作入口
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionAppService {

    private final ExecutionOrchestrator executionOrchestrator;

    private final CheckpointManager checkpointManager;

    private final MonitoringAggregator monitoringAggregator;

    private final ExecutionLogCollector executionLogCollector;

    private final ResourceModel resourceModel;

    /**
     * 启动执行
     *
     * @param checkpointInterval 自动检查点间隔，为空时不定时创建
     */
    public ExecutionRecord run(RunRequest request, Duration checkpointInterval) {
        if (checkpointInterval != null && (checkpointInterval.isZero() || checkpointInterval.isNegative())) {
            throw new ValidationException("checkpoint-interval", "Checkpoint interval must be positive");
        }
        ExecutionRecord record = executionOrchestrator.run(request);
        if (checkpointInterval != null) {
            configureCheckpoints(record.getId(), checkpointInterval);
        }
        return record;
    }

    public DryRunResult dryRun(RunRequest request) {
        return executionOrchestrator.dryRun(request);
    }

    public ExecutionRecord stop(String executionId, boolean force) {
        return executionOrchestrator.stop(executionId, force);
    }

    public ExecutionRecord status(String executionId) {
        return executionOrchestrator.status(executionId);
    }

    public List<ExecutionRecord> history(String pipelineName) {
        return executionOrchestrator.history(pipelineName);
    }

    public ExecutionAnalysis analyze(String executionId) {
        return executionOrchestrator.analyze(executionId);
    }

    /**
     * 清理流水线的执行产物，被移除的执行记录同时丢弃其检查点；不保留日志时一并丢弃收集的日志
     */
    public CleanReport clean(String pipelineName, CleanLevel level, boolean preserveLogs, boolean preserveOutputs) {
        CleanReport report = executionOrchestrator.clean(pipelineName,
                level == null ? CleanLevel.STANDARD : level, preserveLogs, preserveOutputs);
        for (String executionId : report.getRemovedExecutions()) {
            checkpointManager.discard(executionId);
            if (!preserveLogs) {
                executionLogCollector.discard(executionId);
            }
        }
        return report;
    }

    public MonitoringFrame monitor(String executionId) {
        executionOrchestrator.status(executionId);
        return monitoringAggregator.snapshot(executionId);
    }

    /**
     * 检索执行日志
     *
     * @param minLevel 最低级别，为空时返回全部
     * @param pattern  正则表达式，为空时不过滤
     */
    public ExecutionLogs logs(String executionId, LogLevel minLevel, String pattern) {
        executionOrchestrator.status(executionId);
        return executionLogCollector.search(executionId, minLevel, pattern);
    }

    public MonitoringStream stream(String executionId, Duration interval) {
        executionOrchestrator.status(executionId);
        return monitoringAggregator.stream(executionId, interval);
    }

    /**
     * 为运行中的执行设置自动检查点间隔；执行已结束时只记录日志
     */
    public void configureCheckpoints(String executionId, Duration interval) {
        if (executionOrchestrator.status(executionId).isTerminal()) {
            log.info("Execution {} already finished, checkpoint interval {} not applied", executionId, interval);
            return;
        }
        checkpointManager.configure(executionId, interval);
    }

    public Checkpoint checkpoint(String executionId) {
        return checkpointManager.createCheckpoint(executionId);
    }

    public List<Checkpoint> checkpoints(String executionId) {
        return checkpointManager.list(executionId);
    }

    /**
     * 从检查点恢复为新的执行
     *
     * @param checkpointId 为空时使用最新的校验通过的检查点
     */
    public ExecutionRecord restore(String executionId, String checkpointId) {
        return checkpointManager.restore(executionId, checkpointId);
    }

    public ResourceGraph resources() {
        return resourceModel.current();
    }

    public ResourceGraph refreshResources() {
        return resourceModel.refresh();
    }
}
