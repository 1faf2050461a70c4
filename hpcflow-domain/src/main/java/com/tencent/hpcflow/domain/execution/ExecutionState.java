package com.tencent.hpcflow.domain.execution;

import com.tencent.hpcflow.domain.pipeline.PipelineStatus;

import java.util.EnumSet;
import java.util.Set;

/**
 * ExecutionState - 执行生命周期状态
 * <p>
 * CREATED → VALIDATED → ENVIRONMENT_READY → LAUNCHING → RUNNING →
 * {COMPLETING → COMPLETED | STOPPING → STOPPED | FAILING → FAILED}。
 * 启动前的各状态失败时直接进入 FAILED，不会出现部分启动。
 * </p>
 */
public enum ExecutionState {

    CREATED,
    VALIDATED,
    ENVIRONMENT_READY,
    LAUNCHING,
    RUNNING,
    COMPLETING,
    COMPLETED,
    STOPPING,
    STOPPED,
    FAILING,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == STOPPED || this == FAILED;
    }

    public boolean canTransitionTo(ExecutionState next) {
        return successors().contains(next);
    }

    private Set<ExecutionState> successors() {
        switch (this) {
            case CREATED:
                return EnumSet.of(VALIDATED, STOPPING, FAILED);
            case VALIDATED:
                return EnumSet.of(ENVIRONMENT_READY, STOPPING, FAILED);
            case ENVIRONMENT_READY:
                return EnumSet.of(LAUNCHING, STOPPING, FAILED);
            case LAUNCHING:
                return EnumSet.of(RUNNING, STOPPING, FAILING);
            case RUNNING:
                return EnumSet.of(COMPLETING, STOPPING, FAILING);
            case COMPLETING:
                return EnumSet.of(COMPLETED, FAILING);
            case STOPPING:
                return EnumSet.of(STOPPED);
            case FAILING:
                return EnumSet.of(FAILED);
            default:
                return EnumSet.noneOf(ExecutionState.class);
        }
    }

    /**
     * 流水线状态镜像，返回空表示不改变流水线状态
     */
    public PipelineStatus toPipelineStatus() {
        switch (this) {
            case LAUNCHING:
            case RUNNING:
                return PipelineStatus.RUNNING;
            case COMPLETED:
                return PipelineStatus.COMPLETED;
            case STOPPED:
                return PipelineStatus.STOPPED;
            case FAILED:
                return PipelineStatus.FAILED;
            default:
                return null;
        }
    }
}
