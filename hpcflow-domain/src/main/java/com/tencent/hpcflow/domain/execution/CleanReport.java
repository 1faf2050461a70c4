package com.tencent.hpcflow.domain.execution;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * CleanReport - 清理结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CleanReport {

    private String pipelineName;

    private CleanLevel level;

    @Builder.Default
    private List<String> removedExecutions = new ArrayList<>();

    @Builder.Default
    private List<String> cleanedNodes = new ArrayList<>();

    private boolean logsPreserved;

    private boolean outputsPreserved;
}
