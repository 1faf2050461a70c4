package com.tencent.hpcflow.domain.monitor;

import com.tencent.hpcflow.domain.execution.NodeState;
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
 * NodeFrame - 监控帧中的单个节点
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeFrame {

    private int nodeId;

    private NodeState state;

    private NodeHealth health;

    private Instant lastHeartbeat;

    /**
     * 最近一次采样
     */
    private UtilizationSample latest;

    private double averageCpu;

    private double averageMemory;

    private double averageIo;

    /**
     * 指标名（cpu/memory/io）到走势
     */
    @Builder.Default
    private Map<String, Trend> trends = new LinkedHashMap<>();

    @Builder.Default
    private List<String> recentLogs = new ArrayList<>();
}
