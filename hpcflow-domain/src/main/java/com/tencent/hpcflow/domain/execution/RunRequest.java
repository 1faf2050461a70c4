package com.tencent.hpcflow.domain.execution;

import com.tencent.hpcflow.domain.schedule.AllocationStrategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RunRequest - 启动执行的参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunRequest {

    private String pipelineName;

    /**
     * 调度策略，为空时使用默认策略
     */
    private AllocationStrategy strategy;

    /**
     * 包名到节点编号的硬性放置约束
     */
    @Builder.Default
    private Map<String, Integer> pins = new LinkedHashMap<>();

    /**
     * 覆盖流水线上配置的执行方式
     */
    private ExecutionMethodConfig methodConfig;
}
