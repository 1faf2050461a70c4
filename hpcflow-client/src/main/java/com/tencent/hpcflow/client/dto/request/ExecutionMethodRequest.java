package com.tencent.hpcflow.client.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 执行方式配置
 */
@Data
public class ExecutionMethodRequest {

    /**
     * local、ssh、parallel-ssh 或 mpi
     */
    @NotBlank
    private String method;

    private String hostfile;

    /**
     * 使用的节点数，0 表示全部节点
     */
    @PositiveOrZero
    private int nodeCount;

    @Positive
    private int processesPerNode = 1;

    private Map<String, String> settings = new LinkedHashMap<>();
}
