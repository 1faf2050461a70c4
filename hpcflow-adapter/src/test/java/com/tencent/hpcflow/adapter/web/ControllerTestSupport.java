package com.tencent.hpcflow.adapter.web;

import com.tencent.hpcflow.app.support.AppFixture;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * 以独立模式挂载全部控制器，应用服务来自测试装置
 */
final class ControllerTestSupport {

    private ControllerTestSupport() {
    }

    static MockMvc mockMvc(AppFixture fixture) {
        return MockMvcBuilders.standaloneSetup(
                        new HealthController(fixture.executions),
                        new SessionController(fixture.sessionRegistry, fixture.pipelines),
                        new PipelineController(fixture.pipelines),
                        new EnvironmentController(fixture.environments),
                        new ExecutionController(fixture.executions))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }
}
