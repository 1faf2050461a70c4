package com.tencent.hpcflow.config;

import com.tencent.hpcflow.domain.checkpoint.CheckpointManager;
import com.tencent.hpcflow.domain.checkpoint.CheckpointStore;
import com.tencent.hpcflow.domain.composition.CompositionService;
import com.tencent.hpcflow.domain.environment.EnvironmentBuilder;
import com.tencent.hpcflow.domain.event.SimpleEventBus;
import com.tencent.hpcflow.domain.execution.ExecutionOrchestrator;
import com.tencent.hpcflow.domain.execution.launcher.NodeLauncher;
import com.tencent.hpcflow.domain.monitor.ExecutionLogCollector;
import com.tencent.hpcflow.domain.monitor.MonitoringAggregator;
import com.tencent.hpcflow.domain.pkg.PackageCatalog;
import com.tencent.hpcflow.domain.repository.ExecutionRepository;
import com.tencent.hpcflow.domain.repository.PipelineRepository;
import com.tencent.hpcflow.domain.resource.ResourceModel;
import com.tencent.hpcflow.domain.resource.ResourceProbe;
import com.tencent.hpcflow.domain.schedule.Scheduler;
import com.tencent.hpcflow.infrastructure.catalog.YamlPackageCatalog;
import com.tencent.hpcflow.infrastructure.checkpoint.FileCheckpointStore;
import com.tencent.hpcflow.infrastructure.launcher.CommandRunner;
import com.tencent.hpcflow.infrastructure.launcher.LocalNodeLauncher;
import com.tencent.hpcflow.infrastructure.launcher.MpiNodeLauncher;
import com.tencent.hpcflow.infrastructure.launcher.ParallelSshNodeLauncher;
import com.tencent.hpcflow.infrastructure.launcher.ProcessCommandRunner;
import com.tencent.hpcflow.infrastructure.launcher.SshNodeLauncher;
import com.tencent.hpcflow.infrastructure.resource.HostfileResourceProbe;
import com.tencent.hpcflow.infrastructure.resource.HttpResourceProbe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * OrchestrationConfiguration - 组装领域服务与基础设施实现
 * <p>
 * 领域层不依赖 Spring，所有领域服务在这里显式构造。
 * 事件由单线程分发，监听者按发布顺序收到事件。
 * </p>
 */
@Slf4j
@Configuration
public class OrchestrationConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService orchestrationTimers(HpcflowProperties properties) {
        return Executors.newScheduledThreadPool(properties.getLauncher().getTimerThreads(), named("hpcflow-timer"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService eventDispatcher() {
        return Executors.newSingleThreadExecutor(named("hpcflow-events"));
    }

    @Bean
    public SimpleEventBus eventBus(@Qualifier("eventDispatcher") ExecutorService eventDispatcher) {
        return new SimpleEventBus(eventDispatcher);
    }

    @Bean
    public PackageCatalog packageCatalog(HpcflowProperties properties, ResourceLoader resourceLoader) {
        return new YamlPackageCatalog(resourceLoader.getResource(properties.getStorage().getCatalog()));
    }

    @Bean
    public ResourceProbe resourceProbe(HpcflowProperties properties, RestTemplateBuilder restTemplateBuilder) {
        HpcflowProperties.Resource resource = properties.getResource();
        Path hostfile = resource.getHostfile() == null || resource.getHostfile().isBlank()
                ? null : Path.of(resource.getHostfile());
        if (resource.getAgentUrl() == null || resource.getAgentUrl().isBlank()) {
            return new HostfileResourceProbe(hostfile, resource.getDefaults());
        }
        RestTemplate restTemplate = restTemplateBuilder
                .setConnectTimeout(resource.getAgentTimeout())
                .setReadTimeout(resource.getAgentTimeout())
                .build();
        log.info("Probing node hardware through agent {}", resource.getAgentUrl());
        return new HttpResourceProbe(restTemplate, hostfile, resource.getAgentUrl(), resource.getDefaults());
    }

    /**
     * 资源快照按 refresh-interval 定时刷新
     */
    @Bean
    public ResourceModel resourceModel(ResourceProbe resourceProbe, HpcflowProperties properties, Clock clock,
                                       @Qualifier("orchestrationTimers") ScheduledExecutorService timers) {
        ResourceModel model = new ResourceModel(resourceProbe, properties.getResource().getRefreshInterval(), clock);
        model.scheduleRefresh(timers);
        return model;
    }

    @Bean
    public CommandRunner commandRunner() {
        return new ProcessCommandRunner();
    }

    @Bean
    public NodeLauncher localNodeLauncher(CommandRunner commandRunner, PackageCatalog packageCatalog,
                                          HpcflowProperties properties) {
        HpcflowProperties.Launcher launcher = properties.getLauncher();
        return new LocalNodeLauncher(commandRunner, packageCatalog, launcher.getWorkRoot(), launcher.getSampleTimeout());
    }

    @Bean
    public NodeLauncher sshNodeLauncher(CommandRunner commandRunner, PackageCatalog packageCatalog,
                                        HpcflowProperties properties) {
        HpcflowProperties.Launcher launcher = properties.getLauncher();
        return new SshNodeLauncher(commandRunner, packageCatalog, launcher.getWorkRoot(), launcher.getSampleTimeout());
    }

    @Bean
    public NodeLauncher parallelSshNodeLauncher(CommandRunner commandRunner, PackageCatalog packageCatalog,
                                                HpcflowProperties properties) {
        HpcflowProperties.Launcher launcher = properties.getLauncher();
        return new ParallelSshNodeLauncher(commandRunner, packageCatalog, launcher.getWorkRoot(),
                launcher.getSampleTimeout());
    }

    @Bean
    public NodeLauncher mpiNodeLauncher(CommandRunner commandRunner, PackageCatalog packageCatalog,
                                        HpcflowProperties properties) {
        HpcflowProperties.Launcher launcher = properties.getLauncher();
        return new MpiNodeLauncher(commandRunner, packageCatalog, launcher.getWorkRoot(), launcher.getSampleTimeout());
    }

    @Bean
    public CompositionService compositionService(PipelineRepository pipelineRepository, PackageCatalog packageCatalog,
                                                 Clock clock) {
        return new CompositionService(pipelineRepository, packageCatalog, clock);
    }

    @Bean
    public EnvironmentBuilder environmentBuilder(PackageCatalog packageCatalog) {
        return new EnvironmentBuilder(packageCatalog);
    }

    @Bean
    public Scheduler scheduler(PackageCatalog packageCatalog, HpcflowProperties properties, Clock clock) {
        return new Scheduler(packageCatalog, properties.getScheduler(), clock);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutionOrchestrator executionOrchestrator(CompositionService compositionService,
                                                       EnvironmentBuilder environmentBuilder,
                                                       Scheduler scheduler,
                                                       ResourceModel resourceModel,
                                                       List<NodeLauncher> nodeLaunchers,
                                                       ExecutionRepository executionRepository,
                                                       SimpleEventBus eventBus,
                                                       HpcflowProperties properties,
                                                       @Qualifier("orchestrationTimers") ScheduledExecutorService timers,
                                                       Clock clock) {
        return new ExecutionOrchestrator(compositionService, environmentBuilder, scheduler, resourceModel,
                nodeLaunchers, executionRepository, eventBus, properties.getOrchestrator(),
                named("hpcflow-exec"), timers, clock);
    }

    @Bean
    public CheckpointStore checkpointStore(HpcflowProperties properties) {
        return new FileCheckpointStore(Path.of(properties.getStorage().getCheckpointDir()));
    }

    @Bean
    public CheckpointManager checkpointManager(CheckpointStore checkpointStore, ExecutionOrchestrator executionOrchestrator,
                                               HpcflowProperties properties,
                                               @Qualifier("orchestrationTimers") ScheduledExecutorService timers,
                                               Clock clock, SimpleEventBus eventBus) {
        CheckpointManager manager = new CheckpointManager(checkpointStore, executionOrchestrator,
                properties.getCheckpoint(), timers, clock);
        eventBus.subscribe(manager);
        return manager;
    }

    @Bean
    public MonitoringAggregator monitoringAggregator(HpcflowProperties properties, Clock clock, SimpleEventBus eventBus) {
        MonitoringAggregator aggregator = new MonitoringAggregator(properties.getMonitoring(), clock);
        eventBus.subscribe(aggregator);
        return aggregator;
    }

    @Bean
    public ExecutionLogCollector executionLogCollector(HpcflowProperties properties, SimpleEventBus eventBus) {
        ExecutionLogCollector collector = new ExecutionLogCollector(properties.getMonitoring());
        eventBus.subscribe(collector);
        return collector;
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
