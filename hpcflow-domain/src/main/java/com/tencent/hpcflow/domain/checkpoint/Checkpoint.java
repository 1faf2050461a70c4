package com.tencent.hpcflow.domain.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Checkpoint - 可恢复的执行进度快照
 * <p>
 * digest 是除自身外全部内容的 SHA-256，写入前计算，恢复前校验。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Checkpoint {

    private String id;

    private String executionId;

    private String pipelineName;

    /**
     * 同一执行内单调递增
     */
    private long sequence;

    private String planId;

    @Builder.Default
    private Map<Integer, NodeProgress> nodes = new TreeMap<>();

    private Instant createdAt;

    private String digest;

    @JsonIgnore
    public boolean hasProgress() {
        return nodes.values().stream().anyMatch(n -> n.getLastCompletedIndex() >= 0);
    }

    public static String idFor(long sequence) {
        return String.format("cp-%06d", sequence);
    }
}
