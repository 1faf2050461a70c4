package com.tencent.hpcflow.adapter.web;

import com.tencent.hpcflow.app.service.EnvironmentAppService;
import com.tencent.hpcflow.client.dto.MultiResponse;
import com.tencent.hpcflow.client.dto.Response;
import com.tencent.hpcflow.client.dto.SingleResponse;
import com.tencent.hpcflow.client.dto.request.BuildEnvironmentRequest;
import com.tencent.hpcflow.client.dto.request.ConfigureEnvironmentRequest;
import com.tencent.hpcflow.client.dto.request.CopyEnvironmentRequest;
import com.tencent.hpcflow.domain.environment.Environment;
import com.tencent.hpcflow.domain.pipeline.Pipeline;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 命名环境接口
 */
@RestController
@RequestMapping("/api/environments")
@RequiredArgsConstructor
public class EnvironmentController {

    private final EnvironmentAppService environmentAppService;

    @PostMapping
    public SingleResponse<Environment> build(@Valid @RequestBody BuildEnvironmentRequest request) {
        return SingleResponse.of(environmentAppService.build(request.getPipeline(), request.getName(),
                RequestConverter.optimizationLevel(request.getOptimizationLevel()), request.isDevTools()));
    }

    @GetMapping
    public MultiResponse<Environment> list() {
        return MultiResponse.of(environmentAppService.list());
    }

    @GetMapping("/{name}")
    public SingleResponse<Environment> get(@PathVariable String name) {
        return SingleResponse.of(environmentAppService.get(name));
    }

    @PostMapping("/{name}/copy")
    public SingleResponse<Environment> copy(@PathVariable String name, @Valid @RequestBody CopyEnvironmentRequest request) {
        return SingleResponse.of(environmentAppService.copy(name, request.getTarget()));
    }

    @PutMapping("/{name}")
    public SingleResponse<Environment> configure(@PathVariable String name,
                                                 @RequestBody ConfigureEnvironmentRequest request) {
        return SingleResponse.of(environmentAppService.configure(name, request.getVariables(), request.getModules()));
    }

    /**
     * 把命名环境的当前快照关联到流水线
     */
    @PutMapping("/{name}/pipelines/{pipeline}")
    public SingleResponse<Pipeline> link(@PathVariable String name, @PathVariable String pipeline) {
        return SingleResponse.of(environmentAppService.link(pipeline, name));
    }

    @DeleteMapping("/{name}")
    public Response delete(@PathVariable String name) {
        environmentAppService.delete(name);
        return Response.buildSuccess();
    }
}
