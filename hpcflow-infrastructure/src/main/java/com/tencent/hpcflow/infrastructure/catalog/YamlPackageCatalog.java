package com.tencent.hpcflow.infrastructure.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.tencent.hpcflow.domain.exception.ParseException;
import com.tencent.hpcflow.domain.pkg.PackageCatalog;
import com.tencent.hpcflow.domain.pkg.PackageDefinition;
import com.tencent.hpcflow.domain.pkg.PackageType;
import com.tencent.hpcflow.domain.pkg.ParameterConstraint;
import com.tencent.hpcflow.domain.pkg.ParameterDefinition;
import com.tencent.hpcflow.domain.pkg.ParameterType;
import com.tencent.hpcflow.domain.resource.ResourceDemand;
import com.tencent.hpcflow.infrastructure.catalog.dto.PackageCatalogYamlDto;
import com.tencent.hpcflow.infrastructure.catalog.dto.PackageYamlDto;
import com.tencent.hpcflow.infrastructure.catalog.dto.ParameterYamlDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * YamlPackageCatalog - 从 YAML 文件加载的包目录
 * <p>
 * 启动时一次性读取；文件格式错误或包声明不完整时拒绝启动。
 * </p>
 *
 * @author hpcflow
 */
@Slf4j
public class YamlPackageCatalog implements PackageCatalog {

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    private final Map<String, PackageDefinition> packages = new LinkedHashMap<>();

    public YamlPackageCatalog(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            load(mapper.readValue(in, PackageCatalogYamlDto.class), resource.getDescription());
        } catch (IOException e) {
            throw new ParseException("catalog:" + resource.getDescription(),
                    "Failed to parse package catalog " + resource.getDescription() + ": " + e.getMessage(), e);
        }
        log.info("Loaded {} packages from {}", packages.size(), resource.getDescription());
    }

    @Override
    public Optional<PackageDefinition> find(String packageName) {
        return Optional.ofNullable(packages.get(packageName));
    }

    @Override
    public Collection<PackageDefinition> findAll() {
        return Collections.unmodifiableCollection(packages.values());
    }

    private void load(PackageCatalogYamlDto dto, String source) {
        if (dto == null || dto.getPackages() == null) {
            return;
        }
        for (PackageYamlDto pkg : dto.getPackages()) {
            if (pkg.getName() == null || pkg.getName().isBlank()) {
                throw new ParseException("catalog:" + source, "Package without a name in " + source);
            }
            if (packages.containsKey(pkg.getName())) {
                throw new ParseException("package:" + pkg.getName(),
                        "Package '" + pkg.getName() + "' is declared twice in " + source);
            }
            packages.put(pkg.getName(), convert(pkg));
        }
    }

    private PackageDefinition convert(PackageYamlDto dto) {
        List<ParameterDefinition> parameters = new ArrayList<>();
        if (dto.getParameters() != null) {
            for (ParameterYamlDto p : dto.getParameters()) {
                parameters.add(convertParameter(dto.getName(), p));
            }
        }
        return PackageDefinition.builder()
                .name(dto.getName())
                .type(PackageType.fromValue(dto.getType()))
                .description(dto.getDescription())
                .command(dto.getCommand())
                .defaultDemand(ResourceDemand.of(
                        dto.getCores() == null ? 0 : dto.getCores(),
                        dto.getMemoryMb() == null ? 0L : dto.getMemoryMb(),
                        dto.getStorageGb() == null ? 0L : dto.getStorageGb()))
                .storageService(dto.isStorageService())
                .resumable(dto.isResumable())
                .preloadPriority(dto.getPreloadPriority())
                .requiredModules(copy(dto.getModules()))
                .dependencies(copy(dto.getDependencies()))
                .conflicts(copy(dto.getConflicts()))
                .complements(copy(dto.getComplements()))
                .parameters(parameters)
                .build();
    }

    private ParameterDefinition convertParameter(String packageName, ParameterYamlDto dto) {
        ParameterType type;
        try {
            type = ParameterType.valueOf(String.valueOf(dto.getType()).toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ParseException("package:" + packageName,
                    "Parameter '" + dto.getName() + "' of package '" + packageName + "' has unknown type "
                            + dto.getType(), e);
        }
        boolean constrained = dto.getPattern() != null || dto.getMinLength() != null || dto.getMaxLength() != null
                || dto.getEnumValues() != null || dto.getMin() != null || dto.getMax() != null;
        return ParameterDefinition.builder()
                .name(dto.getName())
                .type(type)
                .required(dto.isRequired())
                .description(dto.getDescription())
                .defaultValue(dto.getDefaultValue())
                .constraint(constrained ? ParameterConstraint.builder()
                        .pattern(dto.getPattern())
                        .minLength(dto.getMinLength())
                        .maxLength(dto.getMaxLength())
                        .enumValues(dto.getEnumValues())
                        .minValue(dto.getMin())
                        .maxValue(dto.getMax())
                        .build() : null)
                .build();
    }

    private static List<String> copy(List<String> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }
}
