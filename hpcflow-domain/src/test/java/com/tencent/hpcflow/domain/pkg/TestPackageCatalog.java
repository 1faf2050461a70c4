package com.tencent.hpcflow.domain.pkg;

import com.tencent.hpcflow.domain.resource.ResourceDemand;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 测试用包目录
 */
public class TestPackageCatalog implements PackageCatalog {

    private final Map<String, PackageDefinition> packages = new LinkedHashMap<>();

    public TestPackageCatalog() {
        register(PackageDefinition.builder()
                .name("orangefs")
                .type(PackageType.SERVICE)
                .storageService(true)
                .defaultDemand(ResourceDemand.of(2, 4096, 100))
                .requiredModules(List.of("orangefs/2.9"))
                .conflicts(List.of("hermes"))
                .parameters(List.of(ParameterDefinition.builder()
                        .name("mount").type(ParameterType.STRING).defaultValue("/mnt/ofs").build()))
                .build());
        register(PackageDefinition.builder()
                .name("hermes")
                .type(PackageType.SERVICE)
                .storageService(true)
                .defaultDemand(ResourceDemand.of(2, 2048, 50))
                .build());
        register(PackageDefinition.builder()
                .name("storage_service")
                .type(PackageType.SERVICE)
                .storageService(true)
                .defaultDemand(ResourceDemand.of(2, 2048, 50))
                .parameters(List.of(ParameterDefinition.builder()
                        .name("capacity_gb").type(ParameterType.INTEGER).defaultValue(50).build()))
                .build());
        register(PackageDefinition.builder()
                .name("benchmark")
                .type(PackageType.APPLICATION)
                .defaultDemand(ResourceDemand.of(2, 1024, 10))
                .parameters(List.of(ParameterDefinition.builder()
                        .name("iterations").type(ParameterType.INTEGER).defaultValue(1).build()))
                .build());
        register(PackageDefinition.builder()
                .name("ior")
                .type(PackageType.APPLICATION)
                .defaultDemand(ResourceDemand.of(4, 2048, 10))
                .requiredModules(List.of("openmpi/4.1"))
                .complements(List.of("orangefs", "darshan"))
                .parameters(List.of(
                        ParameterDefinition.builder().name("nprocs").type(ParameterType.INTEGER).defaultValue(1)
                                .constraint(ParameterConstraint.builder().minValue(1.0).build()).build(),
                        ParameterDefinition.builder().name("block").type(ParameterType.STRING).defaultValue("1m")
                                .constraint(ParameterConstraint.builder().pattern("[0-9]+[kmg]").build()).build(),
                        ParameterDefinition.builder().name("write").type(ParameterType.BOOLEAN).defaultValue(true)
                                .build(),
                        ParameterDefinition.builder().name("api").type(ParameterType.STRING).defaultValue("POSIX")
                                .constraint(ParameterConstraint.builder().enumValues(List.<Object>of("POSIX", "MPIIO")).build())
                                .build()))
                .build());
        register(PackageDefinition.builder()
                .name("analyzer")
                .type(PackageType.APPLICATION)
                .defaultDemand(ResourceDemand.of(1, 512, 1))
                .dependencies(List.of("ior"))
                .parameters(List.of(ParameterDefinition.builder()
                        .name("input").type(ParameterType.STRING).required(true).build()))
                .build());
        register(PackageDefinition.builder()
                .name("incompact3d")
                .type(PackageType.APPLICATION)
                .defaultDemand(ResourceDemand.of(8, 8192, 20))
                .requiredModules(List.of("openmpi/4.0"))
                .build());
        register(PackageDefinition.builder()
                .name("darshan")
                .type(PackageType.INTERCEPTOR)
                .preloadPriority(10)
                .defaultDemand(ResourceDemand.of(0, 128, 1))
                .build());
        register(PackageDefinition.builder()
                .name("tracer")
                .type(PackageType.INTERCEPTOR)
                .preloadPriority(20)
                .defaultDemand(ResourceDemand.of(0, 64, 0))
                .build());
        for (String step : List.of("step0", "step1", "step2", "step3", "step4")) {
            register(PackageDefinition.builder()
                    .name(step)
                    .type(PackageType.APPLICATION)
                    .resumable(true)
                    .defaultDemand(ResourceDemand.of(1, 256, 1))
                    .build());
        }
    }

    public void register(PackageDefinition definition) {
        packages.put(definition.getName(), definition);
    }

    @Override
    public Optional<PackageDefinition> find(String packageName) {
        return Optional.ofNullable(packages.get(packageName));
    }

    @Override
    public Collection<PackageDefinition> findAll() {
        return packages.values();
    }
}
