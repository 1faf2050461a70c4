package com.tencent.hpcflow.domain.execution.launcher;

import com.tencent.hpcflow.domain.environment.Environment;
import com.tencent.hpcflow.domain.execution.ExecutionMethodConfig;
import com.tencent.hpcflow.domain.pipeline.PackageEntry;
import com.tencent.hpcflow.domain.schedule.NodeAssignment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * NodeLaunchRequest - 节点启动参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeLaunchRequest {

    private String executionId;

    private String pipelineName;

    private NodeAssignment assignment;

    /**
     * 该节点上按流水线顺序执行的包
     */
    @Builder.Default
    private List<PackageEntry> entries = new ArrayList<>();

    private Environment environment;

    private ExecutionMethodConfig methodConfig;

    /**
     * 从检查点恢复时的可恢复状态
     */
    @Builder.Default
    private Map<String, Object> resumableState = new LinkedHashMap<>();
}
