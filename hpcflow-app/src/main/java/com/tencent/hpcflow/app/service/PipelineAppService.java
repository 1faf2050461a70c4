package com.tencent.hpcflow.app.service;

import com.tencent.hpcflow.app.dto.PipelineDescriptorDto;
import com.tencent.hpcflow.app.parser.PipelineDescriptorCodec;
import com.tencent.hpcflow.app.session.SessionRegistry;
import com.tencent.hpcflow.domain.composition.CompositionService;
import com.tencent.hpcflow.domain.environment.Environment;
import com.tencent.hpcflow.domain.exception.ConflictException;
import com.tencent.hpcflow.domain.exception.NotFoundException;
import com.tencent.hpcflow.domain.execution.ExecutionMethodConfig;
import com.tencent.hpcflow.domain.execution.ExecutionOrchestrator;
import com.tencent.hpcflow.domain.pipeline.PackageEntry;
import com.tencent.hpcflow.domain.pipeline.InterceptorSlot;
import com.tencent.hpcflow.domain.pipeline.PackageRelationship;
import com.tencent.hpcflow.domain.pipeline.Pipeline;
import com.tencent.hpcflow.domain.pipeline.ValidationReport;
import com.tencent.hpcflow.domain.pkg.PackageType;
import com.tencent.hpcflow.domain.repository.EnvironmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PipelineAppService - 流水线组合相关的操作入口
 * <p>
 * 在 {@link CompositionService} 之上处理会话聚焦、描述文件导入导出，
 * 以及删除前的会话与执行状态检查。sessionId 可为空，此时不改变任何会话的聚焦。
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineAppService {

    private final CompositionService compositionService;

    private final ExecutionOrchestrator executionOrchestrator;

    private final EnvironmentRepository environmentRepository;

    private final PipelineDescriptorCodec descriptorCodec;

    private final SessionRegistry sessionRegistry;

    public Pipeline create(String sessionId, String name, String description) {
        Pipeline pipeline = compositionService.create(name, description);
        focusIfPresent(sessionId, name);
        return pipeline;
    }

    /**
     * 加载流水线并设为会话的聚焦对象
     */
    public Pipeline load(String sessionId, String name) {
        Pipeline pipeline = compositionService.load(name);
        focusIfPresent(sessionId, name);
        return pipeline;
    }

    public Pipeline get(String name) {
        return compositionService.load(name);
    }

    public List<Pipeline> list() {
        return compositionService.list();
    }

    public Optional<Pipeline> focused(String sessionId) {
        return sessionRegistry.focused(sessionId).flatMap(name -> {
            try {
                return Optional.of(compositionService.load(name));
            } catch (NotFoundException e) {
                log.debug("Session {} focuses missing pipeline [{}]", sessionId, name);
                return Optional.empty();
            }
        });
    }

    /**
     * 删除流水线
     *
     * @throws ConflictException 流水线被其他会话聚焦，或有未结束的执行
     */
    public void delete(String sessionId, String name) {
        compositionService.load(name);
        List<String> others = sessionRegistry.focusedElsewhere(name, sessionId);
        if (!others.isEmpty()) {
            throw new ConflictException("pipeline:" + name,
                    "Pipeline '" + name + "' is focused in another session: " + String.join(", ", others));
        }
        if (executionOrchestrator.hasActiveExecution(name)) {
            throw new ConflictException("pipeline:" + name,
                    "Pipeline '" + name + "' has an active execution and cannot be deleted");
        }
        compositionService.delete(name);
        sessionRegistry.release(name);
    }

    public PackageEntry addPackage(String pipelineName, String packageName, PackageType type,
                                   Map<String, Object> config, Integer position) {
        return compositionService.addPackage(pipelineName, packageName, type, config, position);
    }

    public Pipeline removePackage(String pipelineName, String packageName) {
        return compositionService.removePackage(pipelineName, packageName);
    }

    public Pipeline reorder(String pipelineName, List<String> newOrder) {
        return compositionService.reorder(pipelineName, newOrder);
    }

    public PackageEntry configurePackage(String pipelineName, String packageName, Map<String, Object> config) {
        return compositionService.configurePackage(pipelineName, packageName, config);
    }

    public Pipeline configureExecutionMethod(String pipelineName, ExecutionMethodConfig methodConfig) {
        return compositionService.configureExecutionMethod(pipelineName, methodConfig);
    }

    public ValidationReport validate(String pipelineName) {
        return compositionService.validate(pipelineName);
    }

    public List<PackageRelationship> analyzeRelationships(String pipelineName) {
        return compositionService.analyzeRelationships(pipelineName);
    }

    public List<InterceptorSlot> interceptors(String pipelineName) {
        return compositionService.interceptors(pipelineName);
    }

    public Pipeline sortInterceptors(String pipelineName) {
        return compositionService.sortInterceptors(pipelineName);
    }

    /**
     * 从描述文件导入流水线并聚焦
     *
     * @param replace 同名流水线存在时是否覆盖
     * @throws NotFoundException 描述文件引用的命名环境不存在
     */
    public Pipeline importDescriptor(String sessionId, String text, boolean replace) {
        PipelineDescriptorDto dto = descriptorCodec.read(text);
        Environment environment = null;
        if (dto.getEnv() != null && !dto.getEnv().isBlank()) {
            environment = environmentRepository.findByName(dto.getEnv())
                    .orElseThrow(() -> new NotFoundException("environment:" + dto.getEnv(),
                            "Environment not found: " + dto.getEnv()));
        }
        if (replace && executionOrchestrator.hasActiveExecution(dto.getName())) {
            throw new ConflictException("pipeline:" + dto.getName(),
                    "Pipeline '" + dto.getName() + "' has an active execution and cannot be replaced");
        }
        Pipeline pipeline = compositionService.importPipeline(dto.getName(), dto.getDescription(), environment,
                descriptorCodec.toEntries(dto), replace);
        focusIfPresent(sessionId, pipeline.getName());
        return pipeline;
    }

    public String exportDescriptor(String pipelineName) {
        return descriptorCodec.export(compositionService.load(pipelineName));
    }

    private void focusIfPresent(String sessionId, String pipelineName) {
        if (sessionId != null) {
            sessionRegistry.focus(sessionId, pipelineName);
        }
    }
}
