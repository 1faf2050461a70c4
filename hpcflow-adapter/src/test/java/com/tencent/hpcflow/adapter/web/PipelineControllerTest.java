package com.tencent.hpcflow.adapter.web;

import com.tencent.hpcflow.app.session.SessionContext;
import com.tencent.hpcflow.app.support.AppFixture;
import com.tencent.hpcflow.domain.pkg.PackageDefinition;
import com.tencent.hpcflow.domain.pkg.PackageType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class PipelineControllerTest {

    private AppFixture fixture;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        fixture = new AppFixture();
        mockMvc = ControllerTestSupport.mockMvc(fixture);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void testCreateAndGet() throws Exception {
        mockMvc.perform(post("/api/pipelines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"io_test\",\"description\":\"IOR\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.name").value("io_test"));

        mockMvc.perform(get("/api/pipelines/io_test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.description").value("IOR"));
        mockMvc.perform(get("/api/pipelines"))
                .andExpect(jsonPath("$.data", hasSize(1)));
    }

    @Test
    void testDuplicateNameIsConflict() throws Exception {
        fixture.pipelines.create(null, "io_test", null);

        mockMvc.perform(post("/api/pipelines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"io_test\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errCode").value("CONFLICT"))
                .andExpect(jsonPath("$.errEntity").value("pipeline:io_test"));
    }

    @Test
    void testInterceptorChain() throws Exception {
        fixture.pipelines.create(null, "io_test", null);
        fixture.pipelines.addPackage("io_test", "darshan", null, null, null);
        fixture.pipelines.addPackage("io_test", "tracer", null, null, null);
        fixture.pipelines.addPackage("io_test", "ior", null, null, null);

        mockMvc.perform(get("/api/pipelines/io_test/interceptors"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(2)))
                .andExpect(jsonPath("$.data[0].name").value("darshan"))
                .andExpect(jsonPath("$.data[0].preloadPriority").value(10))
                .andExpect(jsonPath("$.data[1].targetPackages[0]").value("ior"));

        fixture.harness.catalog.register(PackageDefinition.builder().name("tracer").type(PackageType.INTERCEPTOR)
                .preloadPriority(5).build());
        mockMvc.perform(post("/api/pipelines/io_test/interceptors/sort"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.entries[0].name").value("tracer"))
                .andExpect(jsonPath("$.data.entries[1].name").value("darshan"));
        mockMvc.perform(get("/api/pipelines/missing/interceptors"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testInvalidRequests() throws Exception {
        mockMvc.perform(post("/api/pipelines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errCode").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.errMessage", containsString("name")));

        mockMvc.perform(get("/api/pipelines/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errCode").value("NOT_FOUND"));

        fixture.pipelines.create(null, "io_test", null);
        mockMvc.perform(post("/api/pipelines/io_test/packages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"packageName\":\"ior\",\"type\":\"daemon\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errCode").value("VALIDATION_ERROR"));
        mockMvc.perform(post("/api/pipelines/io_test/packages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"packageName\":\"no_such_package\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errCode").value("UNKNOWN_PACKAGE"));
    }

    @Test
    void testComposeAndExport() throws Exception {
        fixture.pipelines.create(null, "io_test", null);

        mockMvc.perform(post("/api/pipelines/io_test/packages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"packageName\":\"benchmark\",\"config\":{\"iterations\":3}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.type").value("APPLICATION"));
        mockMvc.perform(post("/api/pipelines/io_test/packages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"packageName\":\"storage_service\",\"position\":0}"))
                .andExpect(status().isOk());
        mockMvc.perform(put("/api/pipelines/io_test/execution-method")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"method\":\"ssh\",\"nodeCount\":2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.executionMethod.method").value("SSH"));

        mockMvc.perform(get("/api/pipelines/io_test/export"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", containsString("name: io_test")))
                .andExpect(jsonPath("$.data", containsString("iterations: 3")));
        mockMvc.perform(get("/api/pipelines/io_test/validation"))
                .andExpect(jsonPath("$.data.valid").value(true));
    }

    @Test
    void testImportDescriptor() throws Exception {
        String body = "{\"content\":\"name: imported\\npkgs:\\n  - name: benchmark\\n\",\"replace\":false}";

        mockMvc.perform(post("/api/pipelines/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.entries", hasSize(1)));

        mockMvc.perform(post("/api/pipelines/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"name: [broken\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errCode").value("PARSE_ERROR"));
    }

    @Test
    void testDeleteFocusedElsewhereIsConflict() throws Exception {
        SessionContext owner = fixture.sessionRegistry.open();
        SessionContext other = fixture.sessionRegistry.open();
        fixture.pipelines.create(owner.getId(), "io_test", null);

        mockMvc.perform(delete("/api/pipelines/io_test").header(SessionHeaders.SESSION_ID, other.getId()))
                .andExpect(status().isConflict());
        mockMvc.perform(get("/api/sessions/" + owner.getId() + "/focus"))
                .andExpect(jsonPath("$.data.name").value("io_test"));

        mockMvc.perform(delete("/api/pipelines/io_test").header(SessionHeaders.SESSION_ID, owner.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
    }
}
