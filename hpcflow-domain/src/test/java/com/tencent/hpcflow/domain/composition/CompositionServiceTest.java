package com.tencent.hpcflow.domain.composition;

import com.tencent.hpcflow.domain.exception.ConflictException;
import com.tencent.hpcflow.domain.exception.InvalidConfigException;
import com.tencent.hpcflow.domain.exception.NotFoundException;
import com.tencent.hpcflow.domain.exception.OrderConstraintException;
import com.tencent.hpcflow.domain.exception.UnknownPackageException;
import com.tencent.hpcflow.domain.exception.ValidationException;
import com.tencent.hpcflow.domain.execution.ExecutionMethod;
import com.tencent.hpcflow.domain.execution.ExecutionMethodConfig;
import com.tencent.hpcflow.domain.pipeline.InterceptorSlot;
import com.tencent.hpcflow.domain.pipeline.PackageEntry;
import com.tencent.hpcflow.domain.pipeline.PackageRelationship;
import com.tencent.hpcflow.domain.pipeline.Pipeline;
import com.tencent.hpcflow.domain.pipeline.PipelineStatus;
import com.tencent.hpcflow.domain.pipeline.ValidationReport;
import com.tencent.hpcflow.domain.pkg.PackageDefinition;
import com.tencent.hpcflow.domain.pkg.PackageType;
import com.tencent.hpcflow.domain.pkg.TestPackageCatalog;
import com.tencent.hpcflow.domain.repository.InMemoryPipelineRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompositionServiceTest {

    private InMemoryPipelineRepository repository;

    private TestPackageCatalog catalog;

    private CompositionService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryPipelineRepository();
        catalog = new TestPackageCatalog();
        service = new CompositionService(repository, catalog, Clock.systemUTC());
        service.create("io_test", "storage benchmark");
    }

    @Test
    void testCreateRejectsDuplicateAndBlankNames() {
        assertThrows(ConflictException.class, () -> service.create("io_test", null));
        assertThrows(ValidationException.class, () -> service.create("  ", null));
    }

    @Test
    void testAddPackageAppendsAndPersistsImmediately() {
        service.addPackage("io_test", "storage_service", null, Map.of(), null);
        PackageEntry benchmark = service.addPackage("io_test", "benchmark", PackageType.APPLICATION,
                Map.of("iterations", 3), null);

        assertEquals(1, benchmark.getOrder());
        Pipeline stored = repository.findByName("io_test").orElseThrow();
        assertEquals(List.of("storage_service", "benchmark"), stored.entryNames());
        assertEquals(PipelineStatus.CONFIGURED, stored.getStatus());
        assertEquals(50, stored.entry("storage_service").getConfig().get("capacity_gb"));
    }

    @Test
    void testAddPackageAtPosition() {
        service.addPackage("io_test", "benchmark", null, null, null);
        service.addPackage("io_test", "storage_service", null, null, 0);

        assertEquals(List.of("storage_service", "benchmark"), service.load("io_test").entryNames());
    }

    @Test
    void testAddPackageFailures() {
        // 1. 未知包
        assertThrows(UnknownPackageException.class,
                () -> service.addPackage("io_test", "no_such_package", null, null, null));

        // 2. 类型不符
        assertThrows(InvalidConfigException.class,
                () -> service.addPackage("io_test", "benchmark", PackageType.SERVICE, null, null));

        // 3. 配置非法
        assertThrows(InvalidConfigException.class,
                () -> service.addPackage("io_test", "benchmark", null, Map.of("iterations", "many"), null));

        // 4. 重复添加
        service.addPackage("io_test", "benchmark", null, null, null);
        assertThrows(ConflictException.class, () -> service.addPackage("io_test", "benchmark", null, null, null));

        // 5. 位置越界
        assertThrows(ValidationException.class, () -> service.addPackage("io_test", "ior", null, null, 5));

        // 6. 失败的操作不改变流水线
        assertEquals(List.of("benchmark"), service.load("io_test").entryNames());
    }

    @Test
    void testConflictingPackagesCannotCoexist() {
        service.addPackage("io_test", "orangefs", null, null, null);

        ValidationException e = assertThrows(ValidationException.class,
                () -> service.addPackage("io_test", "hermes", null, null, null));
        assertTrue(e.getMessage().contains("conflicts with 'orangefs'"));
    }

    @Test
    void testRemoveMiddlePackageResequences() {
        service.addPackage("io_test", "storage_service", null, null, null);
        service.addPackage("io_test", "benchmark", null, null, null);
        service.addPackage("io_test", "ior", null, null, null);

        Pipeline pipeline = service.removePackage("io_test", "benchmark");

        assertEquals(List.of("storage_service", "ior"), pipeline.entryNames());
        assertEquals(0, pipeline.entry("storage_service").getOrder());
        assertEquals(1, pipeline.entry("ior").getOrder());
        assertEquals(List.of("storage_service", "ior"), service.load("io_test").entryNames());
    }

    @Test
    void testRemovingLastPackageResetsStatus() {
        service.addPackage("io_test", "benchmark", null, null, null);

        Pipeline pipeline = service.removePackage("io_test", "benchmark");

        assertEquals(PipelineStatus.CREATED, pipeline.getStatus());
        assertThrows(NotFoundException.class, () -> service.removePackage("io_test", "benchmark"));
    }

    @Test
    void testReorderRequiresPermutation() {
        service.addPackage("io_test", "storage_service", null, null, null);
        service.addPackage("io_test", "benchmark", null, null, null);

        assertThrows(OrderConstraintException.class,
                () -> service.reorder("io_test", List.of("benchmark")));
        assertThrows(OrderConstraintException.class,
                () -> service.reorder("io_test", List.of("benchmark", "benchmark")));
        assertThrows(OrderConstraintException.class,
                () -> service.reorder("io_test", List.of("benchmark", "ior")));

        Pipeline pipeline = service.reorder("io_test", List.of("benchmark", "storage_service"));
        assertEquals(List.of("benchmark", "storage_service"), pipeline.entryNames());
        assertEquals(0, pipeline.entry("benchmark").getOrder());
    }

    @Test
    void testReorderRejectsDependencyInversion() {
        service.addPackage("io_test", "ior", null, null, null);
        service.addPackage("io_test", "analyzer", null, Map.of("input", "/tmp/ior.out"), null);

        OrderConstraintException e = assertThrows(OrderConstraintException.class,
                () -> service.reorder("io_test", List.of("analyzer", "ior")));
        assertTrue(e.getMessage().contains("'analyzer' depends on 'ior'"));
        assertEquals(List.of("ior", "analyzer"), service.load("io_test").entryNames());
    }

    @Test
    void testInterceptorPreloadPriorityIsEnforced() {
        service.addPackage("io_test", "darshan", null, null, null);
        service.addPackage("io_test", "tracer", null, null, null);

        assertThrows(OrderConstraintException.class,
                () -> service.reorder("io_test", List.of("tracer", "darshan")));

        service.addPackage("io_test", "ior", null, null, 0);
        assertEquals(List.of("ior", "darshan", "tracer"), service.load("io_test").entryNames());
    }

    @Test
    void testInterceptorChainView() {
        service.addPackage("io_test", "ior", null, null, null);
        service.addPackage("io_test", "darshan", null, null, null);
        service.addPackage("io_test", "storage_service", null, null, null);
        service.addPackage("io_test", "tracer", null, null, null);

        List<InterceptorSlot> chain = service.interceptors("io_test");

        assertEquals(List.of("darshan", "tracer"),
                chain.stream().map(InterceptorSlot::getName).collect(Collectors.toList()));
        assertEquals(1, chain.get(0).getPreloadOrder());
        assertEquals(10, chain.get(0).getPreloadPriority());
        assertEquals(2, chain.get(1).getPreloadOrder());
        assertEquals(List.of("ior"), chain.get(1).getTargetPackages());
    }

    @Test
    void testSortInterceptorsFollowsCatalogPriority() {
        catalog.register(PackageDefinition.builder().name("profiler").type(PackageType.INTERCEPTOR).build());
        service.addPackage("io_test", "profiler", null, null, null);
        service.addPackage("io_test", "darshan", null, null, null);
        service.addPackage("io_test", "ior", null, null, null);
        service.addPackage("io_test", "tracer", null, null, null);
        // 包目录更新后 darshan 的优先级排到了 tracer 之后
        catalog.register(PackageDefinition.builder().name("darshan").type(PackageType.INTERCEPTOR)
                .preloadPriority(30).build());

        Pipeline sorted = service.sortInterceptors("io_test");

        assertEquals(List.of("tracer", "darshan", "ior", "profiler"), sorted.entryNames());
        assertEquals(List.of("tracer", "darshan", "ior", "profiler"), service.load("io_test").entryNames());
        assertTrue(service.validate("io_test").isValid());
    }

    @Test
    void testConfigurePackageMergesAndRevalidates() {
        service.addPackage("io_test", "ior", null, Map.of("nprocs", 4), null);

        PackageEntry entry = service.configurePackage("io_test", "ior", Map.of("api", "MPIIO"));

        assertEquals(4, entry.getConfig().get("nprocs"));
        assertEquals("MPIIO", entry.getConfig().get("api"));
        assertThrows(InvalidConfigException.class,
                () -> service.configurePackage("io_test", "ior", Map.of("api", "HDF5")));
        assertEquals("MPIIO", service.load("io_test").entry("ior").getConfig().get("api"));
    }

    @Test
    void testValidateReportsEveryIssue() {
        service.addPackage("io_test", "analyzer", null, Map.of("input", "x"), null);
        Pipeline pipeline = service.load("io_test");
        pipeline.getEntries().add(PackageEntry.builder().name("ghost").type(PackageType.APPLICATION).order(1).build());

        ValidationReport report = service.validate(pipeline);

        assertFalse(report.isValid());
        assertEquals(2, report.getIssues().size());
        assertThrows(ValidationException.class, () -> service.requireValid(pipeline));
    }

    @Test
    void testEmptyPipelineIsInvalid() {
        assertFalse(service.validate("io_test").isValid());
    }

    @Test
    void testAnalyzeRelationships() {
        service.addPackage("io_test", "orangefs", null, null, null);
        service.addPackage("io_test", "ior", null, null, null);

        List<PackageRelationship> relationships = service.analyzeRelationships("io_test");

        assertTrue(relationships.contains(new PackageRelationship("ior", "orangefs",
                PackageRelationship.Kind.COMPLEMENTS, true)));
        assertTrue(relationships.contains(new PackageRelationship("ior", "darshan",
                PackageRelationship.Kind.COMPLEMENTS, false)));
        assertTrue(relationships.contains(new PackageRelationship("orangefs", "hermes",
                PackageRelationship.Kind.CONFLICTS_WITH, false)));
    }

    @Test
    void testConfigureExecutionMethod() {
        service.configureExecutionMethod("io_test", ExecutionMethodConfig.builder()
                .method(ExecutionMethod.MPI).nodeCount(2).processesPerNode(4).build());

        assertEquals(ExecutionMethod.MPI, service.load("io_test").getExecutionMethod().getMethod());
        assertThrows(ValidationException.class, () -> service.configureExecutionMethod("io_test",
                ExecutionMethodConfig.builder().processesPerNode(0).build()));
    }

    @Test
    void testImportPipelineReplacesOnlyWhenAsked() {
        List<PackageEntry> entries = List.of(
                PackageEntry.builder().name("benchmark").type(PackageType.APPLICATION).build(),
                PackageEntry.builder().name("darshan").type(PackageType.INTERCEPTOR).build());

        assertThrows(ConflictException.class,
                () -> service.importPipeline("io_test", "imported", null, entries, false));

        Pipeline imported = service.importPipeline("io_test", "imported", null, entries, true);

        assertEquals(List.of("benchmark", "darshan"), imported.entryNames());
        assertEquals("imported", service.load("io_test").getDescription());
        assertEquals(1, service.load("io_test").entry("benchmark").getConfig().get("iterations"));
    }

    @Test
    void testStaleRevisionIsRejected() {
        Pipeline first = service.load("io_test");
        Pipeline second = service.load("io_test");
        first.setDescription("first");
        repository.update(first);

        second.setDescription("second");
        assertThrows(ConflictException.class, () -> repository.update(second));
        assertEquals("first", service.load("io_test").getDescription());
    }
}
