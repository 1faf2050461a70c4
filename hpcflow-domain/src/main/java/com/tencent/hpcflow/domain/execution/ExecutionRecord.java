package com.tencent.hpcflow.domain.execution;

import com.tencent.hpcflow.domain.environment.Environment;
import com.tencent.hpcflow.domain.exception.ErrorCode;
import com.tencent.hpcflow.domain.schedule.AllocationPlan;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * ExecutionRecord - 一次执行尝试的状态与历史
 * <p>
 * 状态迁移历史只追加不修改。每条流水线同一时刻至多有一条非终态记录。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRecord {

    private String id;

    private String pipelineName;

    @Builder.Default
    private ExecutionState state = ExecutionState.CREATED;

    private Instant startedAt;

    private Instant finishedAt;

    @Builder.Default
    private Map<Integer, NodeStatus> nodes = new TreeMap<>();

    private String lastCheckpointId;

    @Builder.Default
    private List<StateTransition> transitions = new ArrayList<>();

    private ErrorCode failureCode;

    /**
     * 失败涉及的实体，如 "node:1" 或 "package:ior"
     */
    private String failedEntity;

    private String failureReason;

    private AllocationPlan plan;

    private Environment environment;

    /**
     * 从检查点恢复时的来源执行 ID
     */
    private String resumedFromExecution;

    private String resumedFromCheckpoint;

    /**
     * 恢复执行时每个节点最后完成的包位置，该位置及之前的包被跳过
     */
    @Builder.Default
    private Map<Integer, Integer> resumePoints = new LinkedHashMap<>();

    /**
     * 恢复执行时跳过的已完成包
     */
    @Builder.Default
    private List<String> skippedPackages = new ArrayList<>();

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * 迁移到下一个状态并追加历史
     *
     * @throws IllegalStateException 迁移不合法
     */
    public void transitionTo(ExecutionState next, String reason, Instant at) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Execution " + id + " cannot move from " + state + " to " + next);
        }
        transitions.add(new StateTransition(state, next, at, reason));
        state = next;
        if (next.isTerminal()) {
            finishedAt = at;
        }
    }

    public void fail(ErrorCode code, String entity, String reason) {
        if (failureReason == null) {
            failureCode = code;
            failedEntity = entity;
            failureReason = reason;
        }
    }

    public NodeStatus node(int nodeId) {
        return nodes.get(nodeId);
    }

    public ExecutionRecord copy() {
        Map<Integer, NodeStatus> nodeCopies = new TreeMap<>();
        nodes.forEach((id, status) -> nodeCopies.put(id, status.copy()));
        return new ExecutionRecord(id, pipelineName, state, startedAt, finishedAt, nodeCopies, lastCheckpointId,
                new ArrayList<>(transitions), failureCode, failedEntity, failureReason, plan, environment,
                resumedFromExecution, resumedFromCheckpoint, new LinkedHashMap<>(resumePoints),
                new ArrayList<>(skippedPackages));
    }
}
