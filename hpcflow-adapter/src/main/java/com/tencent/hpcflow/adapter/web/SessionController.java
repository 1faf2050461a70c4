package com.tencent.hpcflow.adapter.web;

import com.tencent.hpcflow.app.service.PipelineAppService;
import com.tencent.hpcflow.app.session.SessionContext;
import com.tencent.hpcflow.app.session.SessionRegistry;
import com.tencent.hpcflow.client.dto.Response;
import com.tencent.hpcflow.client.dto.SingleResponse;
import com.tencent.hpcflow.domain.pipeline.Pipeline;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionRegistry sessionRegistry;

    private final PipelineAppService pipelineAppService;

    @PostMapping
    public SingleResponse<SessionContext> open() {
        return SingleResponse.of(sessionRegistry.open());
    }

    @DeleteMapping("/{sessionId}")
    public Response close(@PathVariable String sessionId) {
        sessionRegistry.close(sessionId);
        return Response.buildSuccess();
    }

    /**
     * 会话聚焦的流水线，未聚焦时 data 为空
     */
    @GetMapping("/{sessionId}/focus")
    public SingleResponse<Pipeline> focused(@PathVariable String sessionId) {
        return SingleResponse.of(pipelineAppService.focused(sessionId).orElse(null));
    }
}
