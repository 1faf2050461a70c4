package com.tencent.hpcflow.adapter.web;

import com.tencent.hpcflow.client.dto.request.ExecutionMethodRequest;
import com.tencent.hpcflow.client.dto.request.RunPipelineRequest;
import com.tencent.hpcflow.domain.environment.OptimizationLevel;
import com.tencent.hpcflow.domain.execution.CleanLevel;
import com.tencent.hpcflow.domain.execution.ExecutionMethod;
import com.tencent.hpcflow.domain.execution.ExecutionMethodConfig;
import com.tencent.hpcflow.domain.execution.RunRequest;
import com.tencent.hpcflow.domain.monitor.LogLevel;
import com.tencent.hpcflow.domain.pkg.PackageType;
import com.tencent.hpcflow.domain.schedule.AllocationStrategy;

import java.time.Duration;
import java.util.LinkedHashMap;

/**
 * 请求 DTO 到领域参数的转换，未知的枚举值抛出 ValidationException
 */
final class RequestConverter {

    private RequestConverter() {
    }

    static ExecutionMethodConfig toMethodConfig(ExecutionMethodRequest request) {
        if (request == null) {
            return null;
        }
        return ExecutionMethodConfig.builder()
                .method(ExecutionMethod.fromValue(request.getMethod()))
                .hostfile(request.getHostfile())
                .nodeCount(request.getNodeCount())
                .processesPerNode(request.getProcessesPerNode())
                .settings(request.getSettings() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(request.getSettings()))
                .build();
    }

    static RunRequest toRunRequest(String pipelineName, RunPipelineRequest request) {
        RunPipelineRequest body = request == null ? new RunPipelineRequest() : request;
        return RunRequest.builder()
                .pipelineName(pipelineName)
                .strategy(isBlank(body.getStrategy()) ? null : AllocationStrategy.fromValue(body.getStrategy()))
                .pins(body.getPins() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(body.getPins()))
                .methodConfig(toMethodConfig(body.getMethod()))
                .build();
    }

    static Duration checkpointInterval(RunPipelineRequest request) {
        if (request == null || request.getCheckpointIntervalSeconds() == null) {
            return null;
        }
        return Duration.ofSeconds(request.getCheckpointIntervalSeconds());
    }

    static PackageType packageType(String value) {
        return isBlank(value) ? null : PackageType.fromValue(value);
    }

    static OptimizationLevel optimizationLevel(String value) {
        return isBlank(value) ? OptimizationLevel.BALANCED : OptimizationLevel.fromValue(value);
    }

    static CleanLevel cleanLevel(String value) {
        return isBlank(value) ? CleanLevel.STANDARD : CleanLevel.fromValue(value);
    }

    static LogLevel logLevel(String value) {
        return isBlank(value) ? null : LogLevel.fromValue(value);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
