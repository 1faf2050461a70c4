package com.tencent.hpcflow.client.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 启动执行
 */
@Data
public class RunPipelineRequest {

    /**
     * balanced、compute_intensive、io_intensive 或 memory_intensive，为空时用默认策略
     */
    private String strategy;

    /**
     * 包名到节点编号的放置约束
     */
    private Map<String, Integer> pins = new LinkedHashMap<>();

    /**
     * 覆盖流水线上的执行方式
     */
    @Valid
    private ExecutionMethodRequest method;

    @Positive
    private Long checkpointIntervalSeconds;
}
