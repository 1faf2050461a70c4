package com.tencent.hpcflow.adapter.web;

import com.tencent.hpcflow.app.service.ExecutionAppService;
import com.tencent.hpcflow.client.dto.MultiResponse;
import com.tencent.hpcflow.client.dto.Response;
import com.tencent.hpcflow.client.dto.SingleResponse;
import com.tencent.hpcflow.client.dto.request.CheckpointIntervalRequest;
import com.tencent.hpcflow.client.dto.request.CleanRequest;
import com.tencent.hpcflow.client.dto.request.RunPipelineRequest;
import com.tencent.hpcflow.domain.checkpoint.Checkpoint;
import com.tencent.hpcflow.domain.execution.CleanReport;
import com.tencent.hpcflow.domain.execution.DryRunResult;
import com.tencent.hpcflow.domain.execution.ExecutionAnalysis;
import com.tencent.hpcflow.domain.execution.ExecutionRecord;
import com.tencent.hpcflow.domain.monitor.ExecutionLogs;
import com.tencent.hpcflow.domain.monitor.MonitoringFrame;
import com.tencent.hpcflow.domain.resource.ResourceGraph;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/**
 * 执行、检查点、监控与资源接口
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ExecutionController {

    private final ExecutionAppService executionAppService;

    @PostMapping("/pipelines/{name}/executions")
    public SingleResponse<ExecutionRecord> run(@PathVariable String name,
                                               @Valid @RequestBody(required = false) RunPipelineRequest request) {
        return SingleResponse.of(executionAppService.run(RequestConverter.toRunRequest(name, request),
                RequestConverter.checkpointInterval(request)));
    }

    @PostMapping("/pipelines/{name}/dry-run")
    public SingleResponse<DryRunResult> dryRun(@PathVariable String name,
                                               @Valid @RequestBody(required = false) RunPipelineRequest request) {
        return SingleResponse.of(executionAppService.dryRun(RequestConverter.toRunRequest(name, request)));
    }

    @GetMapping("/pipelines/{name}/executions")
    public MultiResponse<ExecutionRecord> history(@PathVariable String name) {
        return MultiResponse.of(executionAppService.history(name));
    }

    @PostMapping("/pipelines/{name}/clean")
    public SingleResponse<CleanReport> clean(@PathVariable String name,
                                             @RequestBody(required = false) CleanRequest request) {
        CleanRequest body = request == null ? new CleanRequest() : request;
        return SingleResponse.of(executionAppService.clean(name, RequestConverter.cleanLevel(body.getLevel()),
                body.isPreserveLogs(), body.isPreserveOutputs()));
    }

    @GetMapping("/executions/{id}")
    public SingleResponse<ExecutionRecord> status(@PathVariable String id) {
        return SingleResponse.of(executionAppService.status(id));
    }

    @PostMapping("/executions/{id}/stop")
    public SingleResponse<ExecutionRecord> stop(@PathVariable String id,
                                                @RequestParam(defaultValue = "false") boolean force) {
        return SingleResponse.of(executionAppService.stop(id, force));
    }

    @GetMapping("/executions/{id}/monitor")
    public SingleResponse<MonitoringFrame> monitor(@PathVariable String id) {
        return SingleResponse.of(executionAppService.monitor(id));
    }

    /**
     * 按最低级别与正则检索执行日志
     */
    @GetMapping("/executions/{id}/logs")
    public SingleResponse<ExecutionLogs> logs(@PathVariable String id,
                                              @RequestParam(required = false) String level,
                                              @RequestParam(required = false) String pattern) {
        return SingleResponse.of(executionAppService.logs(id, RequestConverter.logLevel(level), pattern));
    }

    @GetMapping("/executions/{id}/analysis")
    public SingleResponse<ExecutionAnalysis> analyze(@PathVariable String id) {
        return SingleResponse.of(executionAppService.analyze(id));
    }

    @PutMapping("/executions/{id}/checkpoint-interval")
    public Response configureCheckpoints(@PathVariable String id,
                                         @Valid @RequestBody CheckpointIntervalRequest request) {
        executionAppService.configureCheckpoints(id, Duration.ofSeconds(request.getIntervalSeconds()));
        return Response.buildSuccess();
    }

    @PostMapping("/executions/{id}/checkpoints")
    public SingleResponse<Checkpoint> checkpoint(@PathVariable String id) {
        return SingleResponse.of(executionAppService.checkpoint(id));
    }

    @GetMapping("/executions/{id}/checkpoints")
    public MultiResponse<Checkpoint> checkpoints(@PathVariable String id) {
        return MultiResponse.of(executionAppService.checkpoints(id));
    }

    /**
     * 从检查点恢复为新执行，未指定检查点时用最新的校验通过的检查点
     */
    @PostMapping("/executions/{id}/restore")
    public SingleResponse<ExecutionRecord> restore(@PathVariable String id,
                                                   @RequestParam(required = false) String checkpoint) {
        return SingleResponse.of(executionAppService.restore(id, checkpoint));
    }

    @GetMapping("/resources")
    public SingleResponse<ResourceGraph> resources() {
        return SingleResponse.of(executionAppService.resources());
    }

    @PostMapping("/resources/refresh")
    public SingleResponse<ResourceGraph> refreshResources() {
        return SingleResponse.of(executionAppService.refreshResources());
    }
}
