package com.tencent.hpcflow.infrastructure.resource;

import com.tencent.hpcflow.domain.resource.NodeResource;
import com.tencent.hpcflow.domain.resource.ResourceProbe;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * HostfileResourceProbe - 按 hostfile 列出节点，容量取配置的默认值
 * <p>
 * 未配置 hostfile 时只有本机一个节点，核数取本机可用处理器数。
 * </p>
 *
 * @author hpcflow
 */
@Slf4j
public class HostfileResourceProbe implements ResourceProbe {

    private final Path hostfile;

    private final NodeCapacityDefaults defaults;

    public HostfileResourceProbe(Path hostfile, NodeCapacityDefaults defaults) {
        this.hostfile = hostfile;
        this.defaults = defaults;
    }

    @Override
    public List<NodeResource> probe() {
        if (hostfile == null) {
            return List.of(node(0, "localhost", Runtime.getRuntime().availableProcessors()));
        }
        List<String> hosts = HostfileParser.read(hostfile);
        List<NodeResource> nodes = new ArrayList<>(hosts.size());
        for (int i = 0; i < hosts.size(); i++) {
            nodes.add(node(i, HostfileParser.hostName(hosts.get(i)), defaults.getCores()));
        }
        log.debug("Probed {} nodes from {}", nodes.size(), hostfile);
        return nodes;
    }

    private NodeResource node(int id, String host, int cores) {
        return NodeResource.builder()
                .id(id)
                .host(host)
                .cores(cores)
                .memoryMb(defaults.getMemoryMb())
                .storageGb(defaults.getStorageGb())
                .storageBandwidthMbps(defaults.getStorageBandwidthMbps())
                .networkBandwidthMbps(defaults.getNetworkBandwidthMbps())
                .build();
    }
}
