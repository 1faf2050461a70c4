package com.tencent.hpcflow.domain.execution;

import com.tencent.hpcflow.domain.composition.CompositionService;
import com.tencent.hpcflow.domain.environment.Environment;
import com.tencent.hpcflow.domain.environment.EnvironmentBuilder;
import com.tencent.hpcflow.domain.event.Event;
import com.tencent.hpcflow.domain.event.EventPublisher;
import com.tencent.hpcflow.domain.event.ExecutionEvents;
import com.tencent.hpcflow.domain.exception.ConflictException;
import com.tencent.hpcflow.domain.exception.ErrorCode;
import com.tencent.hpcflow.domain.exception.HpcflowException;
import com.tencent.hpcflow.domain.exception.InsufficientResourcesException;
import com.tencent.hpcflow.domain.exception.LaunchTimeoutException;
import com.tencent.hpcflow.domain.exception.NodeUnresponsiveException;
import com.tencent.hpcflow.domain.exception.NotFoundException;
import com.tencent.hpcflow.domain.exception.ResourcePlanStaleException;
import com.tencent.hpcflow.domain.exception.ValidationException;
import com.tencent.hpcflow.domain.execution.launcher.NodeLaunchRequest;
import com.tencent.hpcflow.domain.execution.launcher.NodeLauncher;
import com.tencent.hpcflow.domain.execution.launcher.NodeSession;
import com.tencent.hpcflow.domain.execution.launcher.PackageResult;
import com.tencent.hpcflow.domain.monitor.UtilizationSample;
import com.tencent.hpcflow.domain.pipeline.PackageEntry;
import com.tencent.hpcflow.domain.pipeline.Pipeline;
import com.tencent.hpcflow.domain.pipeline.PipelineStatus;
import com.tencent.hpcflow.domain.pipeline.ValidationReport;
import com.tencent.hpcflow.domain.pkg.PackageType;
import com.tencent.hpcflow.domain.repository.ExecutionRepository;
import com.tencent.hpcflow.domain.resource.ResourceGraph;
import com.tencent.hpcflow.domain.resource.ResourceModel;
import com.tencent.hpcflow.domain.schedule.AllocationPlan;
import com.tencent.hpcflow.domain.schedule.NodeAssignment;
import com.tencent.hpcflow.domain.schedule.PackagePlacement;
import com.tencent.hpcflow.domain.schedule.Scheduler;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * ExecutionOrchestrator - 执行编排器
 * <p>
 * 每条执行记录的状态机只有一个所有者（{@link Run} 上的锁），同一执行的状态迁移串行，
 * 不同执行完全并行。校验、环境准备与计划在调用线程上同步完成，失败直接进入 FAILED；
 * 启动与运行在该执行独占的线程池上异步进行，执行之间不争用线程。
 * </p>
 * <p>
 * 节点命令按扇出上限并发下发，收到法定数量（默认全部）的就绪确认后进入 RUNNING。
 * 节点内按流水线顺序执行包，节点之间并行。
 * </p>
 *
 * @author hpcflow
 */
@Slf4j
public class ExecutionOrchestrator {

    private static final long OUTCOME_POLL_MILLIS = 50;

    private final CompositionService compositionService;

    private final EnvironmentBuilder environmentBuilder;

    private final Scheduler scheduler;

    private final ResourceModel resourceModel;

    private final Map<ExecutionMethod, NodeLauncher> launchers = new EnumMap<>(ExecutionMethod.class);

    private final ExecutionRepository executionRepository;

    private final EventPublisher eventPublisher;

    private final OrchestratorSettings settings;

    /**
     * 每次执行独占一个线程池：一个驱动线程加每个节点一个线程，执行结束即关闭
     */
    private final ThreadFactory threadFactory;

    private final ScheduledExecutorService timers;

    private final Clock clock;

    /**
     * 流水线名称到其非终态执行 ID
     */
    private final ConcurrentMap<String, String> activeByPipeline = new ConcurrentHashMap<>();

    private final ConcurrentMap<String, Run> runs = new ConcurrentHashMap<>();

    public ExecutionOrchestrator(CompositionService compositionService,
                                 EnvironmentBuilder environmentBuilder,
                                 Scheduler scheduler,
                                 ResourceModel resourceModel,
                                 List<NodeLauncher> nodeLaunchers,
                                 ExecutionRepository executionRepository,
                                 EventPublisher eventPublisher,
                                 OrchestratorSettings settings,
                                 ThreadFactory threadFactory,
                                 ScheduledExecutorService timers,
                                 Clock clock) {
        this.compositionService = compositionService;
        this.environmentBuilder = environmentBuilder;
        this.scheduler = scheduler;
        this.resourceModel = resourceModel;
        nodeLaunchers.forEach(l -> launchers.put(l.method(), l));
        this.executionRepository = executionRepository;
        this.eventPublisher = eventPublisher;
        this.settings = settings;
        this.threadFactory = threadFactory;
        this.timers = timers;
        this.clock = clock;
    }

    // ==================== 启动 ====================

    /**
     * 启动一次执行
     * <p>
     * 校验、环境准备与计划同步完成；返回时记录处于 ENVIRONMENT_READY 或之后的状态。
     * </p>
     *
     * @throws ConflictException 流水线已有非终态执行
     * @throws HpcflowException 校验、环境或计划失败，记录已置为 FAILED
     */
    public ExecutionRecord run(RunRequest request) {
        Pipeline pipeline = compositionService.load(request.getPipelineName()).copy();
        ExecutionMethodConfig method = methodFor(request.getMethodConfig(), pipeline);
        Run run = claim(pipeline, ExecutionRecord.builder().build());

        boolean ready = prepare(run, graph -> scheduler.plan(run.pipeline, graph, request.getStrategy(),
                request.getPins(), method));
        if (ready) {
            start(run);
        }
        return run.snapshot();
    }

    /**
     * 从检查点恢复：新建执行记录，跳过已完成的包。
     * 当前资源快照仍能容纳原计划时复用，否则按原策略与约束重新计划。
     *
     * @throws ResourcePlanStaleException 无法以原约束重新计划
     */
    public ExecutionRecord resume(ResumePoint point) {
        ExecutionRecord source = status(point.getSourceExecutionId());
        AllocationPlan previous = source.getPlan();
        if (previous == null) {
            throw new ValidationException("execution:" + source.getId(),
                    "Execution " + source.getId() + " never reached planning and cannot be resumed");
        }
        Pipeline pipeline = compositionService.load(source.getPipelineName()).copy();
        ExecutionRecord record = ExecutionRecord.builder()
                .resumedFromExecution(source.getId())
                .resumedFromCheckpoint(point.getCheckpointId())
                .resumePoints(new LinkedHashMap<>(point.getLastCompletedIndex()))
                .build();
        Set<String> interceptors = pipeline.entriesOfType(PackageType.INTERCEPTOR).stream()
                .map(PackageEntry::getName).collect(Collectors.toSet());
        point.getCompletedPackages().stream()
                .filter(name -> !interceptors.contains(name))
                .forEach(record.getSkippedPackages()::add);
        Run run = claim(pipeline, record);

        boolean ready = prepare(run, graph -> {
            if (previous.isCompatibleWith(graph)) {
                log.info("Reusing plan {} for resumed execution {}", previous.getId(), run.id());
                run.resumableState = point.getResumableState();
                return previous;
            }
            try {
                AllocationPlan replanned = scheduler.plan(run.pipeline, graph, previous.getStrategy(),
                        previous.getPins(), previous.getMethodConfig());
                Map<String, Object> merged = new LinkedHashMap<>();
                point.getResumableState().values().forEach(merged::putAll);
                Map<Integer, Map<String, Object>> state = new HashMap<>();
                replanned.nodeIds().forEach(id -> state.put(id, merged));
                run.resumableState = state;
                return replanned;
            } catch (InsufficientResourcesException e) {
                throw new ResourcePlanStaleException("plan:" + previous.getId(),
                        "Resource graph v" + graph.getVersion() + " no longer fits plan " + previous.getId()
                                + " and re-planning failed: " + e.getMessage(), e);
            }
        });
        if (ready) {
            start(run);
        }
        return run.snapshot();
    }

    /**
     * 只校验、准备环境与计划，不创建执行记录
     */
    public DryRunResult dryRun(RunRequest request) {
        Pipeline pipeline = compositionService.load(request.getPipelineName());
        ValidationReport report = compositionService.validate(pipeline);
        DryRunResult result = DryRunResult.builder().validation(report).build();
        if (!report.isValid()) {
            return result;
        }
        try {
            ResourceGraph graph = resourceModel.freshSnapshot(scheduler.getSettings().getMaxGraphAge());
            result.setEnvironment(environmentBuilder.prepare(pipeline, graph));
            result.setPlan(scheduler.plan(pipeline, graph, request.getStrategy(), request.getPins(),
                    methodFor(request.getMethodConfig(), pipeline)));
        } catch (HpcflowException e) {
            result.setPlanError(e.getMessage());
        }
        return result;
    }

    private Run claim(Pipeline pipeline, ExecutionRecord record) {
        record.setId(UUID.randomUUID().toString());
        record.setPipelineName(pipeline.getName());
        record.setState(ExecutionState.CREATED);
        record.setStartedAt(clock.instant());
        String existing = activeByPipeline.putIfAbsent(pipeline.getName(), record.getId());
        if (existing != null) {
            throw new ConflictException("pipeline:" + pipeline.getName(),
                    "Pipeline '" + pipeline.getName() + "' already has an active execution: " + existing);
        }
        Run run = new Run(record, pipeline);
        runs.put(record.getId(), run);
        try {
            executionRepository.save(record.copy());
        } catch (RuntimeException e) {
            runs.remove(record.getId(), run);
            activeByPipeline.remove(pipeline.getName(), record.getId());
            throw e;
        }
        log.info("Created execution {} for pipeline [{}]", record.getId(), pipeline.getName());
        return run;
    }

    /**
     * CREATED → VALIDATED → ENVIRONMENT_READY
     *
     * @return 是否可以进入启动阶段
     */
    private boolean prepare(Run run, Function<ResourceGraph, AllocationPlan> planner) {
        try {
            compositionService.requireValid(run.pipeline);
            if (!tryAdvance(run, ExecutionState.VALIDATED, "all package configurations valid")) {
                return false;
            }
            ResourceGraph graph = resourceModel.freshSnapshot(scheduler.getSettings().getMaxGraphAge());
            Environment environment = environmentBuilder.prepare(run.pipeline, graph);
            run.lock.lock();
            try {
                run.record.setEnvironment(environment);
            } finally {
                run.lock.unlock();
            }
            if (!tryAdvance(run, ExecutionState.ENVIRONMENT_READY, "environment " + environment.getName() + " ready")) {
                return false;
            }
            AllocationPlan plan = planner.apply(graph);
            launcherFor(plan.getMethodConfig().getMethod());
            run.lock.lock();
            try {
                run.record.setPlan(plan);
                for (NodeAssignment assignment : plan.getAssignments()) {
                    run.record.getNodes().put(assignment.getNodeId(), NodeStatus.builder()
                            .nodeId(assignment.getNodeId())
                            .host(assignment.getHost())
                            .lastCompletedIndex(run.record.getResumePoints()
                                    .getOrDefault(assignment.getNodeId(), -1))
                            .updatedAt(clock.instant())
                            .build());
                }
                executionRepository.save(run.record.copy());
            } finally {
                run.lock.unlock();
            }
            return !run.record.isTerminal();
        } catch (HpcflowException e) {
            log.error("Execution {} of pipeline [{}] failed before launch: {}", run.id(), run.pipeline.getName(),
                    e.getMessage());
            failBeforeLaunch(run, e.getErrorCode(), e.getEntity(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Execution {} of pipeline [{}] failed before launch", run.id(), run.pipeline.getName(), e);
            failBeforeLaunch(run, null, "execution:" + run.id(), String.valueOf(e.getMessage()));
            throw e;
        }
    }

    /**
     * 启动前失败：记录进入终态并释放流水线上的执行占用
     */
    private void failBeforeLaunch(Run run, ErrorCode code, String entity, String reason) {
        List<StateTransition> fired = new ArrayList<>();
        run.lock.lock();
        try {
            if (run.record.isTerminal()) {
                return;
            }
            run.record.fail(code, entity, reason);
            ExecutionState target = run.record.getState() == ExecutionState.STOPPING
                    ? ExecutionState.STOPPED : ExecutionState.FAILED;
            fired.add(transition(run, target, reason));
        } finally {
            run.lock.unlock();
        }
        announce(run, fired);
    }

    // ==================== 启动与运行（工作线程） ====================

    private void start(Run run) {
        int nodes = run.record.getPlan().getAssignments().size();
        run.pool = Executors.newFixedThreadPool(nodes + 1, threadFactory);
        run.pool.execute(() -> drive(run));
    }

    private void drive(Run run) {
        try {
            launchAndRun(run);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            nodeFailure(run, null, "execution:" + run.id(), "Orchestrator interrupted");
            settle(run);
        } catch (RuntimeException e) {
            log.error("Execution {} driver failed", run.id(), e);
            ErrorCode code = e instanceof HpcflowException ? ((HpcflowException) e).getErrorCode() : null;
            nodeFailure(run, code, "execution:" + run.id(), String.valueOf(e.getMessage()));
            settle(run);
        } finally {
            run.abortGate();
            run.pool.shutdown();
        }
    }

    private void launchAndRun(Run run) throws InterruptedException {
        AllocationPlan plan = run.record.getPlan();
        List<NodeAssignment> assignments = plan.getAssignments();
        if (!tryAdvance(run, ExecutionState.LAUNCHING, "dispatching to nodes " + plan.nodeIds())) {
            settle(run);
            return;
        }
        NodeLauncher launcher = launcherFor(plan.getMethodConfig().getMethod());
        Semaphore fanOut = new Semaphore(Math.max(1, settings.getFanOutLimit()));
        BlockingQueue<Boolean> outcomes = new LinkedBlockingQueue<>();
        List<Future<?>> runners = new ArrayList<>();
        for (NodeAssignment assignment : assignments) {
            runners.add(run.pool.submit(() -> runNode(run, launcher, assignment, fanOut, outcomes)));
        }

        int total = assignments.size();
        int required = settings.getQuorum() <= 0 ? total : Math.min(settings.getQuorum(), total);
        long deadline = System.nanoTime() + launchBudget(total).toNanos();
        int ready = 0;
        int failed = 0;
        while (ready < required && failed <= total - required && !run.stopRequested) {
            Boolean outcome = outcomes.poll(OUTCOME_POLL_MILLIS, TimeUnit.MILLISECONDS);
            if (outcome == null) {
                if (System.nanoTime() - deadline > 0) {
                    break;
                }
            } else if (outcome) {
                ready++;
            } else {
                failed++;
            }
        }

        if (run.stopRequested) {
            run.abortGate();
            awaitRunners(run, runners);
            settle(run);
            return;
        }
        if (ready < required) {
            nodeFailure(run, ErrorCode.LAUNCH_TIMEOUT, firstFailedNode(run),
                    "Only " + ready + " of " + total + " nodes acknowledged readiness, " + required + " required");
            run.abortGate();
            awaitRunners(run, runners);
            settle(run);
            return;
        }
        if (!tryAdvance(run, ExecutionState.RUNNING, ready + " of " + total + " nodes ready")) {
            run.abortGate();
            awaitRunners(run, runners);
            settle(run);
            return;
        }
        run.openGate();
        startHeartbeat(run);
        awaitRunners(run, runners);
        settle(run);
    }

    private void runNode(Run run, NodeLauncher launcher, NodeAssignment assignment,
                         Semaphore fanOut, BlockingQueue<Boolean> outcomes) {
        int nodeId = assignment.getNodeId();
        NodeSession session = null;
        String launchError = null;
        boolean ready = false;
        try {
            fanOut.acquire();
            try {
                if (run.stopRequested) {
                    updateNode(run, nodeId, NodeState.STOPPED, "stopped before launch");
                    outcomes.offer(false);
                    return;
                }
                updateNode(run, nodeId, NodeState.LAUNCHING, null);
                session = launcher.launch(launchRequest(run, assignment));
                run.sessions.put(nodeId, session);
                if (run.stopRequested) {
                    session.kill();
                }
                ready = awaitReady(run, session);
            } finally {
                fanOut.release();
            }
        } catch (HpcflowException e) {
            launchError = e.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            launchError = "interrupted while launching";
        } catch (RuntimeException e) {
            log.error("Launching node {} of execution {} failed", nodeId, run.id(), e);
            launchError = e.getMessage();
        }

        if (!ready) {
            if (run.stopRequested) {
                updateNode(run, nodeId, NodeState.STOPPED, "stopped during launch");
            } else {
                String message = launchError != null ? launchError : "node did not become ready";
                updateNode(run, nodeId, NodeState.FAILED, message);
                if (run.gateOpen) {
                    nodeFailure(run, ErrorCode.LAUNCH_TIMEOUT, "node:" + nodeId, message);
                }
            }
            outcomes.offer(false);
            return;
        }

        updateNode(run, nodeId, NodeState.READY, null);
        outcomes.offer(true);
        try {
            if (!run.awaitGate()) {
                updateNode(run, nodeId, NodeState.STOPPED, "launch aborted");
                session.kill();
                return;
            }
            runPackages(run, session, assignment);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            updateNode(run, nodeId, NodeState.STOPPED, "interrupted");
        }
    }

    private void runPackages(Run run, NodeSession session, NodeAssignment assignment) throws InterruptedException {
        int nodeId = assignment.getNodeId();
        updateNode(run, nodeId, NodeState.RUNNING, null);
        for (PackageEntry entry : entriesFor(run, assignment)) {
            if (run.stopRequested || run.failing) {
                updateNode(run, nodeId, NodeState.STOPPED, "stopped before " + entry.getName());
                return;
            }
            if (run.record.getSkippedPackages().contains(entry.getName())) {
                log.debug("Skipping completed package [{}] on node {}", entry.getName(), nodeId);
                continue;
            }
            startPackage(run, nodeId, entry);
            PackageResult result = session.run(entry);
            if (!result.isSuccess()) {
                if (run.stopRequested || run.failing) {
                    updateNode(run, nodeId, NodeState.STOPPED, "stopped during " + entry.getName());
                } else {
                    String reason = "Package '" + entry.getName() + "' failed on node " + nodeId + ": "
                            + result.getMessage();
                    updateNode(run, nodeId, NodeState.FAILED, reason);
                    nodeFailure(run, null, "package:" + entry.getName(), reason);
                }
                return;
            }
            completePackage(run, nodeId, entry, result);
        }
        updateNode(run, nodeId, NodeState.COMPLETED, null);
    }

    private boolean awaitReady(Run run, NodeSession session) throws InterruptedException {
        int attempts = settings.getAckRetries() + 1;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (run.stopRequested) {
                return false;
            }
            if (session.awaitReady(settings.getLaunchTimeout())) {
                return true;
            }
            if (attempt < attempts) {
                log.warn("Node {} of execution {} did not acknowledge readiness within {} (attempt {}/{})",
                        session.nodeId(), run.id(), settings.getLaunchTimeout(), attempt, attempts);
                Thread.sleep(settings.getAckBackoff().toMillis() * attempt);
            }
        }
        throw new LaunchTimeoutException("node:" + session.nodeId(), "Node " + session.nodeId()
                + " did not acknowledge readiness after " + attempts + " attempts");
    }

    /**
     * 等待就绪确认的总时限：每个节点的全部重试，乘以扇出批次数
     */
    private Duration launchBudget(int nodes) {
        int attempts = settings.getAckRetries() + 1;
        long backoff = settings.getAckBackoff().toMillis() * attempts * (attempts - 1) / 2;
        int fanOut = Math.max(1, settings.getFanOutLimit());
        long waves = Math.max(1, (nodes + fanOut - 1) / fanOut);
        return settings.getLaunchTimeout().multipliedBy(attempts).plusMillis(backoff).multipliedBy(waves)
                .plusSeconds(1);
    }

    private List<PackageEntry> entriesFor(Run run, NodeAssignment assignment) {
        List<PackageEntry> entries = new ArrayList<>();
        for (PackagePlacement placement : assignment.getPlacements()) {
            run.pipeline.findEntry(placement.getPackageName()).ifPresent(entries::add);
        }
        return entries;
    }

    private NodeLaunchRequest launchRequest(Run run, NodeAssignment assignment) {
        Map<String, Object> state = run.resumableState.getOrDefault(assignment.getNodeId(), Map.of());
        return NodeLaunchRequest.builder()
                .executionId(run.id())
                .pipelineName(run.pipeline.getName())
                .assignment(assignment)
                .entries(entriesFor(run, assignment))
                .environment(run.record.getEnvironment())
                .methodConfig(run.record.getPlan().getMethodConfig())
                .resumableState(new LinkedHashMap<>(state))
                .build();
    }

    private void awaitRunners(Run run, List<Future<?>> runners) throws InterruptedException {
        for (Future<?> runner : runners) {
            try {
                runner.get();
            } catch (ExecutionException e) {
                log.error("Node runner of execution {} failed", run.id(), e.getCause());
            }
        }
    }

    // ==================== 停止 ====================

    /**
     * 停止执行
     * <p>
     * 优雅停止向各节点请求在安全点停止，宽限期内未确认的节点被强制终止；
     * 强制停止直接终止所有节点，不等待确认。对终态执行重复调用直接返回已有记录。
     * </p>
     *
     * @param force 是否强制停止
     */
    public ExecutionRecord stop(String executionId, boolean force) {
        Run run = runs.get(executionId);
        if (run == null) {
            return status(executionId);
        }
        List<StateTransition> fired = new ArrayList<>();
        boolean initiated = false;
        run.lock.lock();
        try {
            ExecutionState state = run.record.getState();
            if (state.isTerminal()) {
                return run.record.copy();
            }
            if (state.canTransitionTo(ExecutionState.STOPPING)) {
                run.stopRequested = true;
                fired.add(transition(run, ExecutionState.STOPPING, force ? "forced stop requested" : "stop requested"));
                initiated = true;
            }
        } finally {
            run.lock.unlock();
        }
        announce(run, fired);

        if (!initiated) {
            // 已在停止、失败或完成收尾中，等待其自行结束
            awaitDone(run, settings.getStopGracePeriod());
            return run.snapshot();
        }

        log.info("Stopping execution {} ({})", executionId, force ? "forced" : "graceful");
        run.abortGate();
        List<NodeSession> sessions = new ArrayList<>(run.sessions.values());
        if (force) {
            sessions.forEach(s -> killQuietly(run, s));
        } else {
            stopGracefully(run, sessions);
        }
        finishStop(run);
        return run.snapshot();
    }

    private void stopGracefully(Run run, List<NodeSession> sessions) {
        if (sessions.isEmpty()) {
            return;
        }
        ExecutorService stopPool = Executors.newFixedThreadPool(sessions.size(), threadFactory);
        try {
            requestStops(run, sessions, stopPool);
        } finally {
            stopPool.shutdownNow();
        }
    }

    /**
     * 节点线程此时仍阻塞在包执行中，停止请求必须走独立的线程
     */
    private void requestStops(Run run, List<NodeSession> sessions, ExecutorService stopPool) {
        Duration grace = settings.getStopGracePeriod();
        List<CompletableFuture<Boolean>> acks = new ArrayList<>();
        for (NodeSession session : sessions) {
            acks.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return session.requestStop(grace);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                } catch (RuntimeException e) {
                    log.warn("Stop request to node {} of execution {} failed", session.nodeId(), run.id(), e);
                    return false;
                }
            }, stopPool));
        }
        for (int i = 0; i < sessions.size(); i++) {
            boolean acked;
            try {
                acked = acks.get(i).get(grace.toMillis() + OUTCOME_POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                acked = false;
            } catch (Exception e) {
                acked = false;
            }
            if (!acked) {
                log.warn("Node {} of execution {} did not acknowledge stop within {}, killing",
                        sessions.get(i).nodeId(), run.id(), grace);
                killQuietly(run, sessions.get(i));
            }
        }
    }

    private void finishStop(Run run) {
        drainLogs(run);
        List<StateTransition> fired = new ArrayList<>();
        run.lock.lock();
        try {
            if (run.record.getState() == ExecutionState.STOPPING) {
                for (NodeStatus node : run.record.getNodes().values()) {
                    if (!node.getState().isFinished()) {
                        node.setState(NodeState.STOPPED);
                        node.setUpdatedAt(clock.instant());
                    }
                }
                fired.add(transition(run, ExecutionState.STOPPED, "all nodes stopped"));
            }
        } finally {
            run.lock.unlock();
        }
        announce(run, fired);
    }

    private void killQuietly(Run run, NodeSession session) {
        try {
            session.kill();
        } catch (RuntimeException e) {
            log.warn("Killing node {} of execution {} failed", session.nodeId(), run.id(), e);
        }
    }

    // ==================== 失败与收尾 ====================

    /**
     * 记录不可恢复的节点错误：RUNNING/LAUNCHING → FAILING，并尽力停止已启动的节点
     */
    private void nodeFailure(Run run, ErrorCode code, String entity, String reason) {
        List<StateTransition> fired = new ArrayList<>();
        run.lock.lock();
        try {
            run.record.fail(code, entity, reason);
            if (run.record.getState().canTransitionTo(ExecutionState.FAILING)
                    && run.record.getState() != ExecutionState.COMPLETING) {
                run.failing = true;
                fired.add(transition(run, ExecutionState.FAILING, reason));
            } else {
                executionRepository.save(run.record.copy());
            }
        } finally {
            run.lock.unlock();
        }
        if (fired.isEmpty()) {
            return;
        }
        log.error("Execution {} of pipeline [{}] is failing: {}", run.id(), run.pipeline.getName(), reason);
        announce(run, fired);
        run.abortGate();
        run.sessions.values().forEach(s -> killQuietly(run, s));
    }

    /**
     * 所有节点结束后推进到终态
     */
    private void settle(Run run) {
        stopHeartbeat(run);
        drainLogs(run);
        List<StateTransition> fired = new ArrayList<>();
        run.lock.lock();
        try {
            ExecutionRecord record = run.record;
            switch (record.getState()) {
                case STOPPING:
                    fired.add(transition(run, ExecutionState.STOPPED, "all nodes stopped"));
                    break;
                case FAILING:
                    fired.add(transition(run, ExecutionState.FAILED, record.getFailureReason()));
                    break;
                case RUNNING:
                    Optional<NodeStatus> unfinished = record.getNodes().values().stream()
                            .filter(n -> n.getState() != NodeState.COMPLETED).findFirst();
                    if (unfinished.isPresent()) {
                        NodeStatus node = unfinished.get();
                        String reason = "Node " + node.getNodeId() + " ended in " + node.getState()
                                + (node.getMessage() == null ? "" : ": " + node.getMessage());
                        record.fail(null, "node:" + node.getNodeId(), reason);
                        fired.add(transition(run, ExecutionState.FAILING, reason));
                        fired.add(transition(run, ExecutionState.FAILED, reason));
                    } else {
                        fired.add(transition(run, ExecutionState.COMPLETING, "all packages succeeded"));
                        fired.add(transition(run, ExecutionState.COMPLETED, "execution completed"));
                    }
                    break;
                default:
                    break;
            }
        } finally {
            run.lock.unlock();
        }
        announce(run, fired);
        if (run.record.getState() == ExecutionState.FAILED) {
            log.error("Execution {} of pipeline [{}] failed: {}", run.id(), run.pipeline.getName(),
                    run.record.getFailureReason());
        }
    }

    // ==================== 心跳 ====================

    private void startHeartbeat(Run run) {
        long millis = settings.getHeartbeatInterval().toMillis();
        run.heartbeat = timers.scheduleWithFixedDelay(() -> pollHeartbeats(run), millis, millis,
                TimeUnit.MILLISECONDS);
    }

    private void stopHeartbeat(Run run) {
        ScheduledFuture<?> heartbeat = run.heartbeat;
        if (heartbeat != null) {
            heartbeat.cancel(false);
        }
    }

    /**
     * 终态前取走节点上尚未上报的日志
     */
    private void drainLogs(Run run) {
        for (NodeSession session : run.sessions.values()) {
            try {
                for (String line : session.drainLogs()) {
                    publish(run, session.nodeId(), ExecutionEvents.NODE_LOG, Map.of(ExecutionEvents.KEY_LINE, line));
                }
            } catch (RuntimeException e) {
                log.warn("Could not drain logs of node {} of execution {}", session.nodeId(), run.id(), e);
            }
        }
    }

    void pollHeartbeats(Run run) {
        for (NodeSession session : run.sessions.values()) {
            int nodeId = session.nodeId();
            NodeStatus status = run.record.node(nodeId);
            if (status == null || status.getState().isFinished()) {
                continue;
            }
            Optional<UtilizationSample> sample;
            RuntimeException probeError = null;
            try {
                sample = session.sample();
                for (String line : session.drainLogs()) {
                    publish(run, nodeId, ExecutionEvents.NODE_LOG, Map.of(ExecutionEvents.KEY_LINE, line));
                }
            } catch (RuntimeException e) {
                log.warn("Heartbeat from node {} of execution {} failed", nodeId, run.id(), e);
                probeError = e;
                sample = Optional.empty();
            }
            if (sample.isPresent()) {
                run.missedHeartbeats.remove(nodeId);
                UtilizationSample s = sample.get();
                publish(run, nodeId, ExecutionEvents.NODE_HEARTBEAT, Map.of(
                        ExecutionEvents.KEY_CPU, s.getCpu(),
                        ExecutionEvents.KEY_MEMORY, s.getMemory(),
                        ExecutionEvents.KEY_IO, s.getIo()));
                continue;
            }
            int missed = run.missedHeartbeats.merge(nodeId, 1, Integer::sum);
            if (missed > settings.getMaxMissedHeartbeats()) {
                NodeUnresponsiveException unresponsive = new NodeUnresponsiveException("node:" + nodeId,
                        "Node " + nodeId + " missed " + missed + " consecutive heartbeats", probeError);
                log.error("Execution {} lost node {}", run.id(), nodeId, unresponsive);
                updateNode(run, nodeId, NodeState.FAILED, unresponsive.getMessage());
                nodeFailure(run, unresponsive.getErrorCode(), unresponsive.getEntity(), unresponsive.getMessage());
            } else {
                log.warn("Node {} of execution {} missed heartbeat {}/{}", nodeId, run.id(), missed,
                        settings.getMaxMissedHeartbeats());
            }
        }
    }

    // ==================== 查询 ====================

    public ExecutionRecord status(String executionId) {
        Run run = runs.get(executionId);
        if (run != null) {
            return run.snapshot();
        }
        return executionRepository.findById(executionId).orElseThrow(() ->
                new NotFoundException("execution:" + executionId, "Execution not found: " + executionId));
    }

    /**
     * 某条流水线的执行历史，最新的在前
     */
    public List<ExecutionRecord> history(String pipelineName) {
        compositionService.load(pipelineName);
        return executionRepository.findByPipeline(pipelineName);
    }

    public Optional<ExecutionRecord> activeExecution(String pipelineName) {
        String executionId = activeByPipeline.get(pipelineName);
        return executionId == null ? Optional.empty() : Optional.of(status(executionId));
    }

    public boolean hasActiveExecution(String pipelineName) {
        return activeByPipeline.containsKey(pipelineName);
    }

    /**
     * 等待执行进入终态
     *
     * @return 超时后返回当前状态
     */
    public ExecutionRecord awaitTermination(String executionId, Duration timeout) {
        Run run = runs.get(executionId);
        if (run == null) {
            return status(executionId);
        }
        awaitDone(run, timeout);
        return run.snapshot();
    }

    private void awaitDone(Run run, Duration timeout) {
        try {
            run.done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 执行结果分析：各状态停留时长、节点结果与失败原因
     */
    public ExecutionAnalysis analyze(String executionId) {
        ExecutionRecord record = status(executionId);
        Map<ExecutionState, Duration> timeInState = new LinkedHashMap<>();
        Instant enteredAt = record.getStartedAt();
        ExecutionState current = ExecutionState.CREATED;
        for (StateTransition transition : record.getTransitions()) {
            timeInState.merge(current, Duration.between(enteredAt, transition.getAt()), Duration::plus);
            current = transition.getTo();
            enteredAt = transition.getAt();
        }
        Instant end = record.getFinishedAt() != null ? record.getFinishedAt() : clock.instant();
        if (!current.isTerminal()) {
            timeInState.merge(current, Duration.between(enteredAt, end), Duration::plus);
        }
        Set<String> completed = new LinkedHashSet<>(record.getSkippedPackages());
        record.getNodes().values().forEach(n -> completed.addAll(n.getCompletedPackages()));
        int totalPackages = record.getPlan() == null ? 0 : (int) record.getPlan().getAssignments().stream()
                .flatMap(a -> a.getPlacements().stream())
                .map(PackagePlacement::getPackageName)
                .distinct()
                .count();
        return ExecutionAnalysis.builder()
                .executionId(record.getId())
                .pipelineName(record.getPipelineName())
                .state(record.getState())
                .totalDuration(Duration.between(record.getStartedAt(), end))
                .timeInState(timeInState)
                .totalPackages(totalPackages)
                .completedPackages(completed.size())
                .nodes(new ArrayList<>(record.getNodes().values()))
                .failureCode(record.getFailureCode())
                .failedEntity(record.getFailedEntity())
                .failureReason(record.getFailureReason())
                .build();
    }

    /**
     * 清理终态执行留下的数据
     *
     * @throws ConflictException 流水线有非终态执行
     */
    public CleanReport clean(String pipelineName, CleanLevel level, boolean preserveLogs, boolean preserveOutputs) {
        compositionService.load(pipelineName);
        if (hasActiveExecution(pipelineName)) {
            throw new ConflictException("pipeline:" + pipelineName,
                    "Pipeline '" + pipelineName + "' has an active execution and cannot be cleaned");
        }
        CleanReport report = CleanReport.builder()
                .pipelineName(pipelineName)
                .level(level)
                .logsPreserved(preserveLogs)
                .outputsPreserved(preserveOutputs)
                .build();
        List<ExecutionRecord> records = executionRepository.findByPipeline(pipelineName);
        for (int i = 0; i < records.size(); i++) {
            ExecutionRecord record = records.get(i);
            if (record.getPlan() != null) {
                NodeLauncher launcher = launchers.get(record.getPlan().getMethodConfig().getMethod());
                for (NodeAssignment assignment : record.getPlan().getAssignments()) {
                    if (launcher == null) {
                        continue;
                    }
                    try {
                        launcher.clean(record.getId(), assignment, record.getPlan().getMethodConfig(),
                                preserveLogs, preserveOutputs);
                        report.getCleanedNodes().add(record.getId() + "@" + assignment.getHost());
                    } catch (RuntimeException e) {
                        log.warn("Cleaning node {} for execution {} failed", assignment.getHost(), record.getId(), e);
                    }
                }
            }
            boolean remove = level == CleanLevel.DEEP || (level == CleanLevel.STANDARD && i > 0);
            if (remove) {
                executionRepository.delete(record.getId());
                report.getRemovedExecutions().add(record.getId());
            }
        }
        log.info("Cleaned pipeline [{}] at level {}: removed {} executions", pipelineName, level,
                report.getRemovedExecutions().size());
        return report;
    }

    /**
     * 检查点写入后登记为最新检查点
     */
    public void recordCheckpoint(String executionId, String checkpointId) {
        Run run = runs.get(executionId);
        if (run != null) {
            run.lock.lock();
            try {
                run.record.setLastCheckpointId(checkpointId);
                executionRepository.save(run.record.copy());
            } finally {
                run.lock.unlock();
            }
            return;
        }
        ExecutionRecord record = status(executionId);
        record.setLastCheckpointId(checkpointId);
        executionRepository.save(record);
    }

    public void shutdown() {
        for (Run run : runs.values()) {
            stopHeartbeat(run);
            if (run.pool != null) {
                run.pool.shutdownNow();
            }
        }
    }

    // ==================== 状态迁移 ====================

    private boolean tryAdvance(Run run, ExecutionState next, String reason) {
        List<StateTransition> fired = new ArrayList<>();
        run.lock.lock();
        try {
            if (!run.record.getState().canTransitionTo(next)) {
                return false;
            }
            fired.add(transition(run, next, reason));
        } finally {
            run.lock.unlock();
        }
        announce(run, fired);
        return true;
    }

    /**
     * 调用方必须持有 run.lock
     */
    private StateTransition transition(Run run, ExecutionState next, String reason) {
        ExecutionRecord record = run.record;
        record.transitionTo(next, reason, clock.instant());
        executionRepository.save(record.copy());
        if (next.isTerminal()) {
            activeByPipeline.remove(record.getPipelineName(), record.getId());
            runs.remove(record.getId(), run);
            run.done.countDown();
        }
        return record.getTransitions().get(record.getTransitions().size() - 1);
    }

    /**
     * 在锁外发布事件并同步流水线状态
     */
    private void announce(Run run, List<StateTransition> fired) {
        for (StateTransition transition : fired) {
            log.info("Execution {} of pipeline [{}]: {} -> {} ({})", run.id(), run.pipeline.getName(),
                    transition.getFrom(), transition.getTo(), transition.getReason());
            Map<String, Object> payload = new HashMap<>();
            payload.put(ExecutionEvents.KEY_FROM, transition.getFrom().name());
            payload.put(ExecutionEvents.KEY_TO, transition.getTo().name());
            publish(run, null, ExecutionEvents.STATE_CHANGED, payload);
            PipelineStatus mirrored = transition.getTo().toPipelineStatus();
            if (mirrored != null) {
                try {
                    compositionService.updateStatus(run.pipeline.getName(), mirrored);
                } catch (HpcflowException e) {
                    log.warn("Could not mirror status {} onto pipeline [{}]: {}", mirrored,
                            run.pipeline.getName(), e.getMessage());
                }
            }
        }
    }

    private void updateNode(Run run, int nodeId, NodeState state, String message) {
        run.lock.lock();
        try {
            NodeStatus node = run.record.node(nodeId);
            if (node == null || run.record.isTerminal()) {
                return;
            }
            node.setState(state);
            node.setMessage(message);
            node.setUpdatedAt(clock.instant());
            if (state.isFinished()) {
                node.setCurrentPackage(null);
            }
            executionRepository.save(run.record.copy());
        } finally {
            run.lock.unlock();
        }
        publish(run, nodeId, ExecutionEvents.NODE_STATUS, Map.of(ExecutionEvents.KEY_STATUS, state.name()));
    }

    private void startPackage(Run run, int nodeId, PackageEntry entry) {
        run.lock.lock();
        try {
            NodeStatus node = run.record.node(nodeId);
            if (node != null && !run.record.isTerminal()) {
                node.setCurrentPackage(entry.getName());
                node.setUpdatedAt(clock.instant());
            }
        } finally {
            run.lock.unlock();
        }
    }

    private void completePackage(Run run, int nodeId, PackageEntry entry, PackageResult result) {
        run.lock.lock();
        try {
            NodeStatus node = run.record.node(nodeId);
            if (node == null || run.record.isTerminal()) {
                return;
            }
            node.setLastCompletedIndex(entry.getOrder());
            node.getCompletedPackages().add(entry.getName());
            node.setCurrentPackage(null);
            if (result.getState() != null) {
                node.getResumableState().putAll(result.getState());
            }
            node.setUpdatedAt(clock.instant());
            executionRepository.save(run.record.copy());
        } finally {
            run.lock.unlock();
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put(ExecutionEvents.KEY_PACKAGE, entry.getName());
        payload.put(ExecutionEvents.KEY_INDEX, entry.getOrder());
        publish(run, nodeId, ExecutionEvents.PACKAGE_COMPLETED, payload);
    }

    private void publish(Run run, Integer nodeId, String type, Map<String, Object> payload) {
        eventPublisher.publish(Event.builder()
                .type(type)
                .source(nodeId == null ? ExecutionEvents.executionSource(run.id())
                        : ExecutionEvents.nodeSource(run.id(), nodeId))
                .time(clock.instant())
                .pipelineName(run.pipeline.getName())
                .executionId(run.id())
                .nodeId(nodeId)
                .payload(new HashMap<>(payload))
                .build());
    }

    private String firstFailedNode(Run run) {
        run.lock.lock();
        try {
            return run.record.getNodes().values().stream()
                    .filter(n -> n.getState() == NodeState.FAILED)
                    .map(n -> "node:" + n.getNodeId())
                    .findFirst()
                    .orElse("execution:" + run.id());
        } finally {
            run.lock.unlock();
        }
    }

    private NodeLauncher launcherFor(ExecutionMethod method) {
        NodeLauncher launcher = launchers.get(method);
        if (launcher == null) {
            throw new ValidationException("execution-method:" + method.getValue(),
                    "No launcher registered for execution method " + method.getValue());
        }
        return launcher;
    }

    private static ExecutionMethodConfig methodFor(ExecutionMethodConfig override, Pipeline pipeline) {
        if (override != null) {
            return override;
        }
        return pipeline.getExecutionMethod() != null ? pipeline.getExecutionMethod() : ExecutionMethodConfig.local();
    }

    /**
     * 一次执行的运行期状态，record 的所有修改都在 lock 内进行
     */
    static final class Run {

        final ExecutionRecord record;

        final Pipeline pipeline;

        final ReentrantLock lock = new ReentrantLock();

        final Map<Integer, NodeSession> sessions = new ConcurrentHashMap<>();

        final Map<Integer, Integer> missedHeartbeats = new ConcurrentHashMap<>();

        final CountDownLatch done = new CountDownLatch(1);

        private final CountDownLatch gate = new CountDownLatch(1);

        volatile boolean gateOpen;

        volatile boolean aborted;

        volatile boolean stopRequested;

        volatile boolean failing;

        volatile Map<Integer, Map<String, Object>> resumableState = Map.of();

        volatile ScheduledFuture<?> heartbeat;

        volatile ExecutorService pool;

        Run(ExecutionRecord record, Pipeline pipeline) {
            this.record = record;
            this.pipeline = pipeline;
        }

        String id() {
            return record.getId();
        }

        ExecutionRecord snapshot() {
            lock.lock();
            try {
                return record.copy();
            } finally {
                lock.unlock();
            }
        }

        boolean awaitGate() throws InterruptedException {
            gate.await();
            return !aborted;
        }

        void openGate() {
            gateOpen = true;
            gate.countDown();
        }

        void abortGate() {
            aborted = true;
            gate.countDown();
        }
    }
}
