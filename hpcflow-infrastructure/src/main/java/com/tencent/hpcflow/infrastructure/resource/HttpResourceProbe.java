package com.tencent.hpcflow.infrastructure.resource;

import com.tencent.hpcflow.domain.resource.NodeResource;
import com.tencent.hpcflow.domain.resource.ResourceProbe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * HttpResourceProbe - 通过节点上的硬件代理探测容量
 * <p>
 * 对 hostfile 中的每个主机请求 GET {agent}/api/hardware，agentUrl 中的 {host} 替换为主机名。
 * 代理不可达或字段缺失时退回默认容量，节点仍然参与调度。
 * </p>
 *
 * @author hpcflow
 */
@Slf4j
public class HttpResourceProbe implements ResourceProbe {

    private static final String HARDWARE_PATH = "/api/hardware";

    private final RestTemplate restTemplate;

    private final Path hostfile;

    private final String agentUrl;

    private final NodeCapacityDefaults defaults;

    public HttpResourceProbe(RestTemplate restTemplate, Path hostfile, String agentUrl, NodeCapacityDefaults defaults) {
        this.restTemplate = restTemplate;
        this.hostfile = hostfile;
        this.agentUrl = agentUrl;
        this.defaults = defaults;
    }

    @Override
    public List<NodeResource> probe() {
        List<String> hosts = hostfile == null ? List.of("localhost") : HostfileParser.read(hostfile);
        List<NodeResource> nodes = new ArrayList<>(hosts.size());
        for (int i = 0; i < hosts.size(); i++) {
            String host = HostfileParser.hostName(hosts.get(i));
            nodes.add(toNode(i, host, fetch(host)));
        }
        return nodes;
    }

    private HardwareReport fetch(String host) {
        String url = buildUrl(host);
        try {
            HardwareReport report = restTemplate.getForObject(url, HardwareReport.class);
            return report != null ? report : new HardwareReport();
        } catch (RestClientException e) {
            log.warn("Hardware agent {} unreachable, using default capacity for {}: {}", url, host, e.getMessage());
            return new HardwareReport();
        }
    }

    private String buildUrl(String host) {
        String base = agentUrl.replace("{host}", host);
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + HARDWARE_PATH;
    }

    private NodeResource toNode(int id, String host, HardwareReport report) {
        return NodeResource.builder()
                .id(id)
                .host(host)
                .cores(report.getCores() != null ? report.getCores() : defaults.getCores())
                .memoryMb(report.getMemoryMb() != null ? report.getMemoryMb() : defaults.getMemoryMb())
                .storageGb(report.getStorageGb() != null ? report.getStorageGb() : defaults.getStorageGb())
                .storageBandwidthMbps(report.getStorageBandwidthMbps() != null
                        ? report.getStorageBandwidthMbps() : defaults.getStorageBandwidthMbps())
                .networkBandwidthMbps(report.getNetworkBandwidthMbps() != null
                        ? report.getNetworkBandwidthMbps() : defaults.getNetworkBandwidthMbps())
                .build();
    }
}
