package com.tencent.hpcflow.app.service;

import com.tencent.hpcflow.domain.composition.CompositionService;
import com.tencent.hpcflow.domain.environment.Environment;
import com.tencent.hpcflow.domain.environment.EnvironmentBuilder;
import com.tencent.hpcflow.domain.environment.OptimizationLevel;
import com.tencent.hpcflow.domain.exception.ConflictException;
import com.tencent.hpcflow.domain.exception.NotFoundException;
import com.tencent.hpcflow.domain.exception.ValidationException;
import com.tencent.hpcflow.domain.pipeline.Pipeline;
import com.tencent.hpcflow.domain.repository.EnvironmentRepository;
import com.tencent.hpcflow.domain.resource.ResourceModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * EnvironmentAppService - 命名环境的构建、复制、配置与关联
 * <p>
 * 流水线关联的是环境快照，之后修改命名环境不会影响已关联的流水线。
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnvironmentAppService {

    private final EnvironmentBuilder environmentBuilder;

    private final EnvironmentRepository environmentRepository;

    private final CompositionService compositionService;

    private final ResourceModel resourceModel;

    /**
     * 按流水线所需模块与当前资源构建命名环境，保存后关联到流水线
     */
    public Environment build(String pipelineName, String environmentName, OptimizationLevel level, boolean devTools) {
        requireName(environmentName);
        Pipeline pipeline = compositionService.load(pipelineName);
        Environment environment = environmentBuilder.build(environmentName, pipeline, resourceModel.current(),
                level == null ? OptimizationLevel.BALANCED : level, devTools);
        environmentRepository.save(environment);
        compositionService.linkEnvironment(pipelineName, environment);
        return environment;
    }

    /**
     * 复制命名环境
     *
     * @throws ConflictException 目标名称已存在
     */
    public Environment copy(String sourceName, String targetName) {
        requireName(targetName);
        Environment source = get(sourceName);
        if (environmentRepository.findByName(targetName).isPresent()) {
            throw new ConflictException("environment:" + targetName, "Environment already exists: " + targetName);
        }
        Environment copy = source.copy(targetName);
        environmentRepository.save(copy);
        log.info("Copied environment [{}] to [{}]", sourceName, targetName);
        return copy;
    }

    /**
     * 设置变量并追加模块，同名模块的新版本替换旧版本
     */
    public Environment configure(String name, Map<String, String> variables, List<String> extraModules) {
        Environment configured = environmentBuilder.configure(get(name), variables, extraModules);
        environmentRepository.save(configured);
        log.info("Configured environment [{}]", name);
        return configured;
    }

    public Pipeline link(String pipelineName, String environmentName) {
        return compositionService.linkEnvironment(pipelineName, get(environmentName));
    }

    public Environment get(String name) {
        return environmentRepository.findByName(name)
                .orElseThrow(() -> new NotFoundException("environment:" + name, "Environment not found: " + name));
    }

    public List<Environment> list() {
        return environmentRepository.findAll();
    }

    public void delete(String name) {
        if (!environmentRepository.delete(name)) {
            throw new NotFoundException("environment:" + name, "Environment not found: " + name);
        }
        log.info("Deleted environment [{}]", name);
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("environment", "Environment name cannot be empty");
        }
    }
}
