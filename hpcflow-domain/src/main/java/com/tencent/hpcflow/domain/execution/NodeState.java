package com.tencent.hpcflow.domain.execution;

/**
 * NodeState - 单个节点在一次执行中的状态
 */
public enum NodeState {
    PENDING,
    LAUNCHING,
    READY,
    RUNNING,
    COMPLETED,
    STOPPED,
    FAILED;

    public boolean isFinished() {
        return this == COMPLETED || this == STOPPED || this == FAILED;
    }
}
