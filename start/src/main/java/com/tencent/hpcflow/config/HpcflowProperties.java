package com.tencent.hpcflow.config;

import com.tencent.hpcflow.domain.checkpoint.CheckpointSettings;
import com.tencent.hpcflow.domain.execution.OrchestratorSettings;
import com.tencent.hpcflow.domain.monitor.MonitoringSettings;
import com.tencent.hpcflow.domain.schedule.SchedulerSettings;
import com.tencent.hpcflow.infrastructure.resource.NodeCapacityDefaults;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * HpcflowProperties - application.yml 中 hpcflow 前缀下的配置
 * <p>
 * 领域设置对象直接绑定，未配置的项保留各设置类的默认值。
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "hpcflow")
public class HpcflowProperties {

    private OrchestratorSettings orchestrator = OrchestratorSettings.builder().build();

    private SchedulerSettings scheduler = SchedulerSettings.builder().build();

    private CheckpointSettings checkpoint = CheckpointSettings.builder().build();

    private MonitoringSettings monitoring = MonitoringSettings.builder().build();

    private Resource resource = new Resource();

    private Launcher launcher = new Launcher();

    private Storage storage = new Storage();

    @Data
    public static class Resource {

        /**
         * 集群节点清单，为空时只使用本机
         */
        private String hostfile;

        /**
         * 节点硬件代理地址模板，{host} 替换为节点名；为空时使用默认容量
         */
        private String agentUrl;

        private Duration refreshInterval = Duration.ofMinutes(1);

        private Duration agentTimeout = Duration.ofSeconds(5);

        private NodeCapacityDefaults defaults = NodeCapacityDefaults.builder().build();
    }

    @Data
    public static class Launcher {

        /**
         * 节点上的工作根目录，每个执行使用其下的子目录
         */
        private String workRoot = "/tmp/hpcflow";

        private Duration sampleTimeout = Duration.ofSeconds(10);

        private int timerThreads = 4;
    }

    @Data
    public static class Storage {

        private String catalog = "classpath:package-catalog.yaml";

        private String checkpointDir = "./hpcflow-data/checkpoints";
    }
}
