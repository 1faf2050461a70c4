package com.tencent.hpcflow.infrastructure.persistence.environment;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.tencent.hpcflow.domain.environment.Environment;
import com.tencent.hpcflow.domain.environment.OptimizationLevel;
import com.tencent.hpcflow.domain.repository.EnvironmentRepository;
import com.tencent.hpcflow.infrastructure.persistence.environment.entity.EnvironmentDO;
import com.tencent.hpcflow.infrastructure.persistence.environment.mapper.EnvironmentMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * EnvironmentRepositoryImpl - 命名环境仓储实现
 *
 * @author hpcflow
 */
@Repository
public class EnvironmentRepositoryImpl implements EnvironmentRepository {

    private final EnvironmentMapper environmentMapper;

    public EnvironmentRepositoryImpl(EnvironmentMapper environmentMapper) {
        this.environmentMapper = environmentMapper;
    }

    @Override
    @Transactional
    public void save(Environment environment) {
        EnvironmentDO existing = selectByName(environment.getName());
        EnvironmentDO dataObject = toDataObject(environment);
        if (existing == null) {
            environmentMapper.insert(dataObject);
        } else {
            dataObject.setId(existing.getId());
            environmentMapper.updateById(dataObject);
        }
    }

    @Override
    public Optional<Environment> findByName(String name) {
        return Optional.ofNullable(selectByName(name)).map(EnvironmentRepositoryImpl::toDomain);
    }

    @Override
    public List<Environment> findAll() {
        return environmentMapper.selectList(new LambdaQueryWrapper<EnvironmentDO>().orderByAsc(EnvironmentDO::getName))
                .stream()
                .map(EnvironmentRepositoryImpl::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    public boolean delete(String name) {
        return environmentMapper.delete(new LambdaQueryWrapper<EnvironmentDO>().eq(EnvironmentDO::getName, name)) > 0;
    }

    private EnvironmentDO selectByName(String name) {
        return environmentMapper.selectOne(new LambdaQueryWrapper<EnvironmentDO>().eq(EnvironmentDO::getName, name));
    }

    private static EnvironmentDO toDataObject(Environment domain) {
        EnvironmentDO dataObject = new EnvironmentDO();
        dataObject.setName(domain.getName());
        dataObject.setVariables(new LinkedHashMap<>(domain.getVariables()));
        dataObject.setModules(new ArrayList<>(domain.getModules()));
        dataObject.setOptimizationFlags(new ArrayList<>(domain.getOptimizationFlags()));
        dataObject.setOptimizationLevel(domain.getOptimizationLevel().name());
        return dataObject;
    }

    private static Environment toDomain(EnvironmentDO dataObject) {
        return Environment.builder()
                .name(dataObject.getName())
                .variables(dataObject.getVariables() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(dataObject.getVariables()))
                .modules(dataObject.getModules() == null ? new ArrayList<>() : new ArrayList<>(dataObject.getModules()))
                .optimizationFlags(dataObject.getOptimizationFlags() == null ? new ArrayList<>()
                        : new ArrayList<>(dataObject.getOptimizationFlags()))
                .optimizationLevel(OptimizationLevel.valueOf(dataObject.getOptimizationLevel()))
                .build();
    }
}
