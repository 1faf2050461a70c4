package com.tencent.hpcflow.domain.environment;

import com.tencent.hpcflow.domain.exception.InvalidConfigException;
import com.tencent.hpcflow.domain.exception.ValidationException;
import com.tencent.hpcflow.domain.pipeline.Pipeline;
import com.tencent.hpcflow.domain.pkg.TestPackageCatalog;
import com.tencent.hpcflow.domain.resource.ResourceGraph;
import com.tencent.hpcflow.domain.support.Pipelines;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvironmentBuilderTest {

    private TestPackageCatalog catalog;

    private EnvironmentBuilder builder;

    private ResourceGraph graph;

    @BeforeEach
    void setUp() {
        catalog = new TestPackageCatalog();
        builder = new EnvironmentBuilder(catalog);
        graph = Pipelines.graph(List.of(
                Pipelines.node(0, 16, 16384, 500, 1000),
                Pipelines.node(1, 12, 16384, 500, 1000)));
    }

    @Test
    void testBuildResolvesModulesAndFlags() {
        Pipeline pipeline = Pipelines.of(catalog, "ior_run", "orangefs", "ior");

        Environment env = builder.build("ior-env", pipeline, graph, OptimizationLevel.AGGRESSIVE, false);

        assertEquals(List.of("gcc", "openmpi/4.1", "cmake", "orangefs/2.9"), env.getModules());
        assertEquals(List.of("-O3", "-march=native", "-funroll-loops", "-flto"), env.getOptimizationFlags());
        assertEquals("-O3 -march=native -funroll-loops -flto", env.getVariables().get("CFLAGS"));
        assertEquals("12", env.getVariables().get(EnvironmentBuilder.VAR_THREADS));
        assertEquals("ior_run", env.getVariables().get(EnvironmentBuilder.VAR_PIPELINE));
        assertFalse(env.getVariables().containsKey("DEBUG"));
    }

    @Test
    void testDevToolsAddDebuggers() {
        Pipeline pipeline = Pipelines.of(catalog, "debug", "benchmark");

        Environment env = builder.build("debug-env", pipeline, graph, OptimizationLevel.FAST, true);

        assertTrue(env.getModules().containsAll(List.of("gdb", "valgrind", "perf")));
        assertEquals("1", env.getVariables().get("DEBUG"));
        assertEquals(List.of("-O2", "-march=native"), env.getOptimizationFlags());
    }

    @Test
    void testConflictingModuleVersionsAreRejected() {
        Pipeline pipeline = Pipelines.of(catalog, "mixed", "ior", "incompact3d");

        InvalidConfigException e = assertThrows(InvalidConfigException.class,
                () -> builder.build("mixed-env", pipeline, graph, OptimizationLevel.BALANCED, false));
        assertTrue(e.getMessage().contains("openmpi/4.1 vs openmpi/4.0"));
    }

    @Test
    void testPrepareWithoutLinkedEnvironmentUsesBalanced() {
        Pipeline pipeline = Pipelines.of(catalog, "plain", "benchmark");

        Environment env = builder.prepare(pipeline, graph);

        assertEquals("plain-env", env.getName());
        assertEquals(OptimizationLevel.BALANCED, env.getOptimizationLevel());
    }

    @Test
    void testPrepareCopiesLinkedEnvironment() {
        Pipeline pipeline = Pipelines.of(catalog, "linked", "ior");
        Environment linked = builder.build("shared", Pipelines.of(catalog, "other", "benchmark"), graph,
                OptimizationLevel.FAST, false);
        pipeline.setEnvironment(linked);

        Environment env = builder.prepare(pipeline, graph);

        assertTrue(env.getModules().contains("openmpi/4.1"));
        assertEquals("linked", env.getVariables().get(EnvironmentBuilder.VAR_PIPELINE));
        assertFalse(linked.getModules().contains("openmpi/4.1"));
        assertEquals("other", linked.getVariables().get(EnvironmentBuilder.VAR_PIPELINE));
    }

    @Test
    void testConfigureReturnsIndependentSnapshot() {
        Environment source = builder.build("base", Pipelines.of(catalog, "p", "benchmark"), graph,
                OptimizationLevel.BALANCED, false);

        Environment updated = builder.configure(source, Map.of("OMP_PROC_BIND", "close"), List.of("hdf5/1.12"));

        assertEquals("close", updated.getVariables().get("OMP_PROC_BIND"));
        assertTrue(updated.getModules().contains("hdf5/1.12"));
        assertFalse(source.getVariables().containsKey("OMP_PROC_BIND"));
        assertFalse(source.getModules().contains("hdf5/1.12"));
    }

    @Test
    void testUnknownOptimizationLevel() {
        assertEquals(OptimizationLevel.BALANCED, OptimizationLevel.fromValue(""));
        assertEquals(OptimizationLevel.AGGRESSIVE, OptimizationLevel.fromValue("aggressive"));
        assertThrows(ValidationException.class, () -> OptimizationLevel.fromValue("ludicrous"));
    }
}
