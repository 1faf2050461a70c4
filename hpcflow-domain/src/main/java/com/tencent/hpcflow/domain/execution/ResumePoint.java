package com.tencent.hpcflow.domain.execution;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * ResumePoint - 从检查点恢复执行的入口
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResumePoint {

    private String sourceExecutionId;

    private String checkpointId;

    /**
     * 节点编号到最后完成的包位置
     */
    @Builder.Default
    private Map<Integer, Integer> lastCompletedIndex = new LinkedHashMap<>();

    /**
     * 所有节点上已完成的包
     */
    @Builder.Default
    private Set<String> completedPackages = new LinkedHashSet<>();

    /**
     * 节点编号到可恢复状态
     */
    @Builder.Default
    private Map<Integer, Map<String, Object>> resumableState = new LinkedHashMap<>();
}
