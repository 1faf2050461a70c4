package com.tencent.hpcflow.domain.pipeline;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * ValidationReport - 流水线逐包校验结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationReport {

    private String pipelineName;

    @Builder.Default
    private List<Issue> issues = new ArrayList<>();

    public boolean isValid() {
        return issues.isEmpty();
    }

    public void addIssue(String packageName, String message) {
        issues.add(new Issue(packageName, message));
    }

    /**
     * 一条校验问题，packageName 为空表示流水线级问题
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Issue {

        private String packageName;

        private String message;
    }
}
