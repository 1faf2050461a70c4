package com.tencent.hpcflow.infrastructure.persistence.pipeline;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.tencent.hpcflow.domain.exception.ConflictException;
import com.tencent.hpcflow.domain.exception.NotFoundException;
import com.tencent.hpcflow.domain.pipeline.PackageEntry;
import com.tencent.hpcflow.domain.pipeline.Pipeline;
import com.tencent.hpcflow.domain.repository.PipelineRepository;
import com.tencent.hpcflow.infrastructure.persistence.pipeline.converter.PipelineConverter;
import com.tencent.hpcflow.infrastructure.persistence.pipeline.entity.PackageEntryDO;
import com.tencent.hpcflow.infrastructure.persistence.pipeline.entity.PipelineDO;
import com.tencent.hpcflow.infrastructure.persistence.pipeline.mapper.PackageEntryMapper;
import com.tencent.hpcflow.infrastructure.persistence.pipeline.mapper.PipelineMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * PipelineRepositoryImpl - 流水线仓储实现
 * <p>
 * 使用 @Validated 注解启用方法参数校验；
 * 更新通过 revision 列做乐观锁，包列表整体替换。
 * </p>
 *
 * @author hpcflow
 */
@Slf4j
@Repository
@Validated
public class PipelineRepositoryImpl implements PipelineRepository {

    private final PipelineMapper pipelineMapper;
    private final PackageEntryMapper packageEntryMapper;

    public PipelineRepositoryImpl(PipelineMapper pipelineMapper, PackageEntryMapper packageEntryMapper) {
        this.pipelineMapper = pipelineMapper;
        this.packageEntryMapper = packageEntryMapper;
    }

    @Override
    @Transactional
    public void insert(Pipeline pipeline) {
        if (exists(pipeline.getName())) {
            throw new ConflictException("pipeline:" + pipeline.getName(),
                    "Pipeline '" + pipeline.getName() + "' already exists");
        }
        PipelineDO pipelineDO = PipelineConverter.toDataObject(pipeline);
        pipelineDO.setRevision(0);
        try {
            pipelineMapper.insert(pipelineDO);
        } catch (DuplicateKeyException e) {
            throw new ConflictException("pipeline:" + pipeline.getName(),
                    "Pipeline '" + pipeline.getName() + "' already exists", e);
        }
        insertEntries(pipeline, pipelineDO.getId());
        pipeline.setRevision(0);
    }

    @Override
    @Transactional
    public void update(Pipeline pipeline) {
        PipelineDO existing = selectByName(pipeline.getName());
        if (existing == null) {
            throw new NotFoundException("pipeline:" + pipeline.getName(),
                    "Pipeline not found: " + pipeline.getName());
        }

        PipelineDO pipelineDO = PipelineConverter.toDataObject(pipeline);
        pipelineDO.setId(existing.getId());
        // 乐观锁：revision 不匹配时更新行数为 0
        if (pipelineMapper.updateById(pipelineDO) == 0) {
            throw new ConflictException("pipeline:" + pipeline.getName(),
                    "Pipeline '" + pipeline.getName() + "' was modified concurrently (revision "
                            + pipeline.getRevision() + " is stale)");
        }

        packageEntryMapper.delete(new LambdaQueryWrapper<PackageEntryDO>()
                .eq(PackageEntryDO::getPipelineId, existing.getId()));
        insertEntries(pipeline, existing.getId());
        pipeline.setRevision(pipeline.getRevision() + 1);
        log.debug("Updated pipeline [{}] to revision {}", pipeline.getName(), pipeline.getRevision());
    }

    @Override
    public Optional<Pipeline> findByName(String name) {
        PipelineDO pipelineDO = selectByName(name);
        if (pipelineDO == null) {
            return Optional.empty();
        }
        return Optional.of(PipelineConverter.toDomain(pipelineDO, selectEntries(pipelineDO.getId())));
    }

    @Override
    public List<Pipeline> findAll() {
        List<PipelineDO> pipelineDOs = pipelineMapper.selectList(
                new LambdaQueryWrapper<PipelineDO>().orderByAsc(PipelineDO::getName));
        return pipelineDOs.stream()
                .map(pipelineDO -> PipelineConverter.toDomain(pipelineDO, selectEntries(pipelineDO.getId())))
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public boolean delete(String name) {
        PipelineDO pipelineDO = selectByName(name);
        if (pipelineDO == null) {
            return false;
        }
        packageEntryMapper.delete(new LambdaQueryWrapper<PackageEntryDO>()
                .eq(PackageEntryDO::getPipelineId, pipelineDO.getId()));
        return pipelineMapper.deleteById(pipelineDO.getId()) > 0;
    }

    @Override
    public boolean exists(String name) {
        return pipelineMapper.exists(new LambdaQueryWrapper<PipelineDO>().eq(PipelineDO::getName, name));
    }

    private PipelineDO selectByName(String name) {
        return pipelineMapper.selectOne(new LambdaQueryWrapper<PipelineDO>().eq(PipelineDO::getName, name));
    }

    private List<PackageEntryDO> selectEntries(Long pipelineId) {
        return packageEntryMapper.selectList(new LambdaQueryWrapper<PackageEntryDO>()
                .eq(PackageEntryDO::getPipelineId, pipelineId)
                .orderByAsc(PackageEntryDO::getPosition));
    }

    private void insertEntries(Pipeline pipeline, Long pipelineId) {
        for (PackageEntry entry : pipeline.getEntries()) {
            packageEntryMapper.insert(PipelineConverter.entryToDataObject(entry, pipelineId));
        }
    }
}
