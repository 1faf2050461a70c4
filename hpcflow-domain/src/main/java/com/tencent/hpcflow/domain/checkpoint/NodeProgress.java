package com.tencent.hpcflow.domain.checkpoint;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * NodeProgress - 检查点中单个节点的进度
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeProgress {

    private int nodeId;

    private String host;

    /**
     * 最后一个完整执行完的包位置，-1 表示没有
     */
    private int lastCompletedIndex;

    @Builder.Default
    private List<String> completedPackages = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> resumableState = new LinkedHashMap<>();
}
