package com.tencent.hpcflow.domain.execution;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ExecutionMethodConfig - 执行方式及其参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionMethodConfig {

    @Builder.Default
    private ExecutionMethod method = ExecutionMethod.LOCAL;

    /**
     * hostfile 路径，local 方式忽略
     */
    private String hostfile;

    /**
     * 使用的节点数，0 表示全部
     */
    private int nodeCount;

    /**
     * 每个节点的进程数 (mpi)
     */
    @Builder.Default
    private int processesPerNode = 1;

    /**
     * 具体实现的附加参数，如 ssh 端口、mpirun 额外参数
     */
    @Builder.Default
    private Map<String, String> settings = new LinkedHashMap<>();

    public static ExecutionMethodConfig local() {
        return ExecutionMethodConfig.builder().build();
    }

    public ExecutionMethodConfig copy() {
        return new ExecutionMethodConfig(method, hostfile, nodeCount, processesPerNode, new LinkedHashMap<>(settings));
    }
}
