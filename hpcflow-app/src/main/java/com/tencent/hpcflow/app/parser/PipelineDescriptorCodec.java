package com.tencent.hpcflow.app.parser;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.tencent.hpcflow.app.dto.PackageDescriptorDto;
import com.tencent.hpcflow.app.dto.PipelineDescriptorDto;
import com.tencent.hpcflow.domain.exception.ParseException;
import com.tencent.hpcflow.domain.pipeline.PackageEntry;
import com.tencent.hpcflow.domain.pipeline.Pipeline;
import com.tencent.hpcflow.domain.pkg.PackageType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * PipelineDescriptorCodec - 流水线描述文件的读写
 * <p>
 * 导出是规范形式：字段顺序固定，包配置按键排序，空值省略。
 * 因此导出、导入、再导出得到相同的文本。
 * </p>
 */
@Component
public class PipelineDescriptorCodec {

    private static final String ENTITY = "descriptor";

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS))
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_EMPTY);

    /**
     * 解析描述文件
     *
     * @throws ParseException 文本不是合法的描述文件，或缺少流水线名、包名
     */
    public PipelineDescriptorDto read(String text) {
        if (text == null || text.isBlank()) {
            throw new ParseException(ENTITY, "Pipeline descriptor is empty");
        }
        PipelineDescriptorDto dto;
        try {
            dto = mapper.readValue(text, PipelineDescriptorDto.class);
        } catch (JsonProcessingException e) {
            throw new ParseException(ENTITY, "Failed to parse pipeline descriptor: " + e.getOriginalMessage(), e);
        }
        if (dto == null || dto.getName() == null || dto.getName().isBlank()) {
            throw new ParseException(ENTITY, "Pipeline descriptor has no name");
        }
        if (dto.getPkgs() == null) {
            dto.setPkgs(new ArrayList<>());
        }
        for (int i = 0; i < dto.getPkgs().size(); i++) {
            PackageDescriptorDto pkg = dto.getPkgs().get(i);
            if (pkg == null || pkg.getName() == null || pkg.getName().isBlank()) {
                throw new ParseException(ENTITY, "Package #" + (i + 1) + " of pipeline '" + dto.getName()
                        + "' has no name");
            }
        }
        return dto;
    }

    public String write(PipelineDescriptorDto dto) {
        try {
            return mapper.writeValueAsString(dto);
        } catch (JsonProcessingException e) {
            throw new ParseException(ENTITY, "Failed to write descriptor of pipeline " + dto.getName(), e);
        }
    }

    /**
     * 描述文件中的包，类型缺省时留空由包目录决定
     *
     * @throws com.tencent.hpcflow.domain.exception.ValidationException 未知的包类型
     */
    public List<PackageEntry> toEntries(PipelineDescriptorDto dto) {
        List<PackageEntry> entries = new ArrayList<>();
        for (PackageDescriptorDto pkg : dto.getPkgs()) {
            entries.add(PackageEntry.builder()
                    .name(pkg.getName().trim())
                    .type(pkg.getType() == null ? null : PackageType.fromValue(pkg.getType()))
                    .config(pkg.getConfig() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(pkg.getConfig()))
                    .order(entries.size())
                    .build());
        }
        return entries;
    }

    public PipelineDescriptorDto fromPipeline(Pipeline pipeline) {
        PipelineDescriptorDto dto = new PipelineDescriptorDto();
        dto.setName(pipeline.getName());
        dto.setDescription(pipeline.getDescription());
        dto.setEnv(pipeline.getEnvironment() == null ? null : pipeline.getEnvironment().getName());
        for (PackageEntry entry : pipeline.getEntries()) {
            PackageDescriptorDto pkg = new PackageDescriptorDto();
            pkg.setName(entry.getName());
            pkg.setType(entry.getType() == null ? null : entry.getType().getValue());
            pkg.setConfig(new LinkedHashMap<>(entry.getConfig()));
            dto.getPkgs().add(pkg);
        }
        return dto;
    }

    public String export(Pipeline pipeline) {
        return write(fromPipeline(pipeline));
    }
}
