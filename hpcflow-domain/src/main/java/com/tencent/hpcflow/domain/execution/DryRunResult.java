package com.tencent.hpcflow.domain.execution;

import com.tencent.hpcflow.domain.environment.Environment;
import com.tencent.hpcflow.domain.pipeline.ValidationReport;
import com.tencent.hpcflow.domain.schedule.AllocationPlan;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DryRunResult - 只校验与计划、不启动的执行预演结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DryRunResult {

    private ValidationReport validation;

    private Environment environment;

    /**
     * 校验失败或无法放置时为空
     */
    private AllocationPlan plan;

    /**
     * 计划失败的原因
     */
    private String planError;
}
