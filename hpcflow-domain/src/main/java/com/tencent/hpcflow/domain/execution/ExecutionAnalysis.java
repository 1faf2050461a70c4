package com.tencent.hpcflow.domain.execution;

import com.tencent.hpcflow.domain.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ExecutionAnalysis - 执行结果分析
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionAnalysis {

    private String executionId;

    private String pipelineName;

    private ExecutionState state;

    /**
     * 开始到结束（或到现在）的时长
     */
    private Duration totalDuration;

    /**
     * 各状态停留时长
     */
    @Builder.Default
    private Map<ExecutionState, Duration> timeInState = new LinkedHashMap<>();

    private int totalPackages;

    private int completedPackages;

    @Builder.Default
    private List<NodeStatus> nodes = new ArrayList<>();

    private ErrorCode failureCode;

    private String failedEntity;

    private String failureReason;
}
