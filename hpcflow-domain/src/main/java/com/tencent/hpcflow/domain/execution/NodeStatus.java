package com.tencent.hpcflow.domain.execution;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * NodeStatus - 节点执行进度
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeStatus {

    private int nodeId;

    private String host;

    @Builder.Default
    private NodeState state = NodeState.PENDING;

    /**
     * 最后一个完整执行完的包在流水线中的位置，-1 表示尚未完成任何包
     */
    @Builder.Default
    private int lastCompletedIndex = -1;

    @Builder.Default
    private List<String> completedPackages = new ArrayList<>();

    private String currentPackage;

    /**
     * 包声明的可恢复状态，检查点会保存
     */
    @Builder.Default
    private Map<String, Object> resumableState = new LinkedHashMap<>();

    private String message;

    private Instant updatedAt;

    public NodeStatus copy() {
        return new NodeStatus(nodeId, host, state, lastCompletedIndex, new ArrayList<>(completedPackages),
                currentPackage, new LinkedHashMap<>(resumableState), message, updatedAt);
    }
}
