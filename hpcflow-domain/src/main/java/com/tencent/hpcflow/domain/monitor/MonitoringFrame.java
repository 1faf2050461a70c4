package com.tencent.hpcflow.domain.monitor;

import com.tencent.hpcflow.domain.execution.ExecutionState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * MonitoringFrame - 某一时刻的执行监控视图
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitoringFrame {

    private String executionId;

    private String pipelineName;

    private ExecutionState state;

    private Instant at;

    @Builder.Default
    private List<NodeFrame> nodes = new ArrayList<>();

    @Builder.Default
    private List<String> alerts = new ArrayList<>();

    public boolean isTerminal() {
        return state != null && state.isTerminal();
    }
}
