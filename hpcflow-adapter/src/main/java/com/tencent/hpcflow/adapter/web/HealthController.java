package com.tencent.hpcflow.adapter.web;

import com.tencent.hpcflow.app.service.ExecutionAppService;
import com.tencent.hpcflow.client.dto.SingleResponse;
import com.tencent.hpcflow.domain.resource.ResourceGraph;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 健康检查，附带当前资源快照的概要
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HealthController {

    private final ExecutionAppService executionAppService;

    @GetMapping("/health")
    public SingleResponse<Map<String, Object>> health() {
        ResourceGraph graph = executionAppService.resources();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("status", "UP");
        summary.put("nodes", graph.getNodes().size());
        summary.put("graphVersion", graph.getVersion());
        summary.put("graphRefreshedAt", graph.getRefreshedAt());
        return SingleResponse.of(summary);
    }
}
