package com.tencent.hpcflow.infrastructure.launcher;

import com.tencent.hpcflow.domain.execution.launcher.NodeLaunchRequest;
import com.tencent.hpcflow.domain.execution.launcher.NodeSession;
import com.tencent.hpcflow.domain.execution.launcher.PackageResult;
import com.tencent.hpcflow.domain.monitor.UtilizationSample;
import com.tencent.hpcflow.domain.pipeline.PackageEntry;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ProcessNodeSession - 一个节点上的进程会话
 * <p>
 * 包边界即安全点：停止请求在当前包的进程结束时得到确认。
 * </p>
 *
 * @author hpcflow
 */
@Slf4j
public class ProcessNodeSession implements NodeSession {

    static final String STATE_LAST_PACKAGE = "last_package";

    private final ProcessNodeLauncher launcher;

    private final NodeLaunchRequest request;

    private final String workDir;

    private final AtomicReference<Process> current = new AtomicReference<>();

    private final Queue<String> logs = new ConcurrentLinkedQueue<>();

    private volatile boolean killed;

    ProcessNodeSession(ProcessNodeLauncher launcher, NodeLaunchRequest request) {
        this.launcher = launcher;
        this.request = request;
        this.workDir = launcher.workDir(request.getExecutionId());
    }

    @Override
    public int nodeId() {
        return request.getAssignment().getNodeId();
    }

    @Override
    public boolean awaitReady(Duration timeout) throws InterruptedException {
        String script = ShellScripts.prelude(request.getEnvironment(), workDir);
        Process process;
        try {
            process = start(null, script);
        } catch (IOException e) {
            log.warn("Node {} readiness check could not start: {}", nodeId(), e.getMessage());
            return false;
        }
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return false;
            }
            collect(process);
            return process.exitValue() == 0;
        } finally {
            current.compareAndSet(process, null);
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    @Override
    public PackageResult run(PackageEntry entry) throws InterruptedException {
        if (killed) {
            return PackageResult.failure("killed");
        }
        Optional<String> command = launcher.commandFor(entry);
        if (command.isEmpty()) {
            logs.add("[" + entry.getName() + "] no command declared, environment prepared only");
            return PackageResult.success(Map.of(STATE_LAST_PACKAGE, entry.getName()));
        }
        String script = ShellScripts.packageScript(request.getEnvironment(), workDir, entry.getName(), command.get());
        Process process;
        try {
            process = start(entry, script);
        } catch (IOException e) {
            return PackageResult.failure("failed to start: " + e.getMessage());
        }
        try {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    logs.add("[" + entry.getName() + "] " + line);
                }
            } catch (IOException e) {
                // 进程被强制终止时输出流随之关闭
                log.debug("Output of {} on node {} closed: {}", entry.getName(), nodeId(), e.getMessage());
            }
            int exit = process.waitFor();
            if (killed) {
                return PackageResult.failure("killed");
            }
            if (exit != 0) {
                return PackageResult.failure("exit code " + exit);
            }
            return PackageResult.success(Map.of(STATE_LAST_PACKAGE, entry.getName()));
        } finally {
            current.compareAndSet(process, null);
        }
    }

    @Override
    public boolean requestStop(Duration gracePeriod) throws InterruptedException {
        Process process = current.get();
        if (process == null) {
            return true;
        }
        return process.waitFor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void kill() {
        killed = true;
        Process process = current.getAndSet(null);
        if (process != null) {
            try {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
            } catch (UnsupportedOperationException e) {
                log.debug("Process on node {} does not expose its descendants", nodeId());
            }
            process.destroyForcibly();
            log.info("Killed process on node {} of execution {}", nodeId(), request.getExecutionId());
        }
    }

    @Override
    public Optional<UtilizationSample> sample() {
        if (killed) {
            return Optional.empty();
        }
        try {
            Process process = launcher.runner.start(launcher.wrap(request.getAssignment(), request.getMethodConfig(),
                    null, ShellScripts.sampleScript()));
            if (!process.waitFor(launcher.getSampleTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return Optional.empty();
            }
            List<String> lines = collect(process);
            if (process.exitValue() != 0 || lines.size() < 4) {
                return Optional.empty();
            }
            double load = Double.parseDouble(lines.get(0).trim());
            int cores = Integer.parseInt(lines.get(1).trim());
            double total = Double.parseDouble(lines.get(2).trim());
            double available = Double.parseDouble(lines.get(3).trim());
            return Optional.of(UtilizationSample.builder()
                    .at(Instant.now())
                    .cpu(Math.min(100.0, load / Math.max(1, cores) * 100.0))
                    .memory(total <= 0 ? 0 : (1 - available / total) * 100.0)
                    .io(0)
                    .build());
        } catch (IOException | NumberFormatException e) {
            log.debug("Sampling node {} failed: {}", nodeId(), e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public List<String> drainLogs() {
        List<String> drained = new ArrayList<>();
        String line;
        while ((line = logs.poll()) != null) {
            drained.add(line);
        }
        return drained;
    }

    private Process start(PackageEntry entry, String script) throws IOException {
        Process process = launcher.runner.start(launcher.wrap(request.getAssignment(), request.getMethodConfig(),
                entry, script));
        current.set(process);
        // kill 可能发生在进程登记之前
        if (killed) {
            process.destroyForcibly();
        }
        return process;
    }

    private static List<String> collect(Process process) {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            log.debug("Reading process output failed: {}", e.getMessage());
        }
        return lines;
    }
}
