package com.tencent.hpcflow.infrastructure.persistence.pipeline.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tencent.hpcflow.domain.environment.Environment;
import com.tencent.hpcflow.domain.execution.ExecutionMethodConfig;
import com.tencent.hpcflow.domain.pipeline.PackageEntry;
import com.tencent.hpcflow.domain.pipeline.Pipeline;
import com.tencent.hpcflow.domain.pipeline.PipelineStatus;
import com.tencent.hpcflow.domain.pkg.PackageType;
import com.tencent.hpcflow.infrastructure.persistence.pipeline.entity.PackageEntryDO;
import com.tencent.hpcflow.infrastructure.persistence.pipeline.entity.PipelineDO;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * PipelineConverter - 流水线转换器
 * <p>
 * 负责领域对象与数据对象之间的转换，环境与执行方式以 JSON 列保存
 * </p>
 *
 * @author hpcflow
 */
public class PipelineConverter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private PipelineConverter() {
    }

    /**
     * 领域对象转数据对象
     */
    public static PipelineDO toDataObject(Pipeline domain) {
        if (domain == null) {
            return null;
        }

        PipelineDO dataObject = new PipelineDO();
        dataObject.setName(domain.getName());
        dataObject.setDescription(domain.getDescription());
        dataObject.setStatus(domain.getStatus().name());
        dataObject.setEnvironment(domain.getEnvironment() == null ? null
                : MAPPER.convertValue(domain.getEnvironment(), MAP_TYPE));
        dataObject.setExecutionMethod(domain.getExecutionMethod() == null ? null
                : MAPPER.convertValue(domain.getExecutionMethod(), MAP_TYPE));
        dataObject.setCreatedAt(domain.getCreatedAt());
        dataObject.setUpdatedAt(domain.getUpdatedAt());
        dataObject.setRevision(domain.getRevision());

        return dataObject;
    }

    /**
     * 数据对象转领域对象
     */
    public static Pipeline toDomain(PipelineDO dataObject, List<PackageEntryDO> entryDOs) {
        if (dataObject == null) {
            return null;
        }

        Pipeline domain = new Pipeline();
        domain.setName(dataObject.getName());
        domain.setDescription(dataObject.getDescription());
        domain.setStatus(PipelineStatus.valueOf(dataObject.getStatus()));
        if (dataObject.getEnvironment() != null) {
            domain.setEnvironment(MAPPER.convertValue(dataObject.getEnvironment(), Environment.class));
        }
        if (dataObject.getExecutionMethod() != null) {
            domain.setExecutionMethod(MAPPER.convertValue(dataObject.getExecutionMethod(), ExecutionMethodConfig.class));
        }
        domain.setCreatedAt(dataObject.getCreatedAt());
        domain.setUpdatedAt(dataObject.getUpdatedAt());
        domain.setRevision(dataObject.getRevision());

        // 按位置恢复包顺序
        if (entryDOs != null) {
            domain.setEntries(entryDOs.stream()
                    .sorted((a, b) -> Integer.compare(a.getPosition(), b.getPosition()))
                    .map(PipelineConverter::entryToDomain)
                    .collect(Collectors.toList()));
        }

        return domain;
    }

    /**
     * 包领域对象转数据对象
     */
    public static PackageEntryDO entryToDataObject(PackageEntry domain, Long pipelineId) {
        PackageEntryDO dataObject = new PackageEntryDO();
        dataObject.setPipelineId(pipelineId);
        dataObject.setName(domain.getName());
        dataObject.setType(domain.getType().name());
        dataObject.setConfig(new LinkedHashMap<>(domain.getConfig()));
        dataObject.setPosition(domain.getOrder());
        return dataObject;
    }

    /**
     * 包数据对象转领域对象
     */
    public static PackageEntry entryToDomain(PackageEntryDO dataObject) {
        return PackageEntry.builder()
                .name(dataObject.getName())
                .type(PackageType.valueOf(dataObject.getType()))
                .config(dataObject.getConfig() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(dataObject.getConfig()))
                .order(dataObject.getPosition())
                .build();
    }
}
