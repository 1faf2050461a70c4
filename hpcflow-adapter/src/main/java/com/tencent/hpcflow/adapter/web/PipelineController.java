package com.tencent.hpcflow.adapter.web;

import com.tencent.hpcflow.app.service.PipelineAppService;
import com.tencent.hpcflow.client.dto.MultiResponse;
import com.tencent.hpcflow.client.dto.Response;
import com.tencent.hpcflow.client.dto.SingleResponse;
import com.tencent.hpcflow.client.dto.request.AddPackageRequest;
import com.tencent.hpcflow.client.dto.request.ConfigurePackageRequest;
import com.tencent.hpcflow.client.dto.request.CreatePipelineRequest;
import com.tencent.hpcflow.client.dto.request.ExecutionMethodRequest;
import com.tencent.hpcflow.client.dto.request.ImportDescriptorRequest;
import com.tencent.hpcflow.client.dto.request.ReorderRequest;
import com.tencent.hpcflow.domain.pipeline.PackageEntry;
import com.tencent.hpcflow.domain.pipeline.InterceptorSlot;
import com.tencent.hpcflow.domain.pipeline.PackageRelationship;
import com.tencent.hpcflow.domain.pipeline.Pipeline;
import com.tencent.hpcflow.domain.pipeline.ValidationReport;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 流水线组合接口
 */
@Slf4j
@RestController
@RequestMapping("/api/pipelines")
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineAppService pipelineAppService;

    @PostMapping
    public SingleResponse<Pipeline> create(@RequestHeader(value = SessionHeaders.SESSION_ID, required = false) String sessionId,
                                           @Valid @RequestBody CreatePipelineRequest request) {
        return SingleResponse.of(pipelineAppService.create(sessionId, request.getName(), request.getDescription()));
    }

    @GetMapping
    public MultiResponse<Pipeline> list() {
        return MultiResponse.of(pipelineAppService.list());
    }

    @GetMapping("/{name}")
    public SingleResponse<Pipeline> get(@PathVariable String name) {
        return SingleResponse.of(pipelineAppService.get(name));
    }

    /**
     * 加载并聚焦
     */
    @PostMapping("/{name}/load")
    public SingleResponse<Pipeline> load(@RequestHeader(value = SessionHeaders.SESSION_ID, required = false) String sessionId,
                                         @PathVariable String name) {
        return SingleResponse.of(pipelineAppService.load(sessionId, name));
    }

    @DeleteMapping("/{name}")
    public Response delete(@RequestHeader(value = SessionHeaders.SESSION_ID, required = false) String sessionId,
                           @PathVariable String name) {
        pipelineAppService.delete(sessionId, name);
        return Response.buildSuccess();
    }

    @PostMapping("/{name}/packages")
    public SingleResponse<PackageEntry> addPackage(@PathVariable String name,
                                                   @Valid @RequestBody AddPackageRequest request) {
        return SingleResponse.of(pipelineAppService.addPackage(name, request.getPackageName(),
                RequestConverter.packageType(request.getType()), request.getConfig(), request.getPosition()));
    }

    @DeleteMapping("/{name}/packages/{packageName}")
    public SingleResponse<Pipeline> removePackage(@PathVariable String name, @PathVariable String packageName) {
        return SingleResponse.of(pipelineAppService.removePackage(name, packageName));
    }

    @PutMapping("/{name}/packages/{packageName}/config")
    public SingleResponse<PackageEntry> configurePackage(@PathVariable String name, @PathVariable String packageName,
                                                         @Valid @RequestBody ConfigurePackageRequest request) {
        return SingleResponse.of(pipelineAppService.configurePackage(name, packageName, request.getConfig()));
    }

    @PutMapping("/{name}/order")
    public SingleResponse<Pipeline> reorder(@PathVariable String name, @Valid @RequestBody ReorderRequest request) {
        return SingleResponse.of(pipelineAppService.reorder(name, request.getOrder()));
    }

    @PutMapping("/{name}/execution-method")
    public SingleResponse<Pipeline> configureExecutionMethod(@PathVariable String name,
                                                             @Valid @RequestBody ExecutionMethodRequest request) {
        return SingleResponse.of(pipelineAppService.configureExecutionMethod(name,
                RequestConverter.toMethodConfig(request)));
    }

    @GetMapping("/{name}/validation")
    public SingleResponse<ValidationReport> validate(@PathVariable String name) {
        return SingleResponse.of(pipelineAppService.validate(name));
    }

    @GetMapping("/{name}/relationships")
    public MultiResponse<PackageRelationship> relationships(@PathVariable String name) {
        return MultiResponse.of(pipelineAppService.analyzeRelationships(name));
    }

    @GetMapping("/{name}/interceptors")
    public MultiResponse<InterceptorSlot> interceptors(@PathVariable String name) {
        return MultiResponse.of(pipelineAppService.interceptors(name));
    }

    /**
     * 按包目录声明的预加载优先级重排拦截器
     */
    @PostMapping("/{name}/interceptors/sort")
    public SingleResponse<Pipeline> sortInterceptors(@PathVariable String name) {
        return SingleResponse.of(pipelineAppService.sortInterceptors(name));
    }

    @PostMapping("/import")
    public SingleResponse<Pipeline> importDescriptor(
            @RequestHeader(value = SessionHeaders.SESSION_ID, required = false) String sessionId,
            @Valid @RequestBody ImportDescriptorRequest request) {
        Pipeline pipeline = pipelineAppService.importDescriptor(sessionId, request.getContent(), request.isReplace());
        log.info("Imported descriptor of pipeline [{}]", pipeline.getName());
        return SingleResponse.of(pipeline);
    }

    @GetMapping("/{name}/export")
    public SingleResponse<String> exportDescriptor(@PathVariable String name) {
        return SingleResponse.of(pipelineAppService.exportDescriptor(name));
    }
}
