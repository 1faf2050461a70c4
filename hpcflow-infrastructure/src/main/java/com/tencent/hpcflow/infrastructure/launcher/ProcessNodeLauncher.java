package com.tencent.hpcflow.infrastructure.launcher;

import com.tencent.hpcflow.domain.execution.ExecutionMethodConfig;
import com.tencent.hpcflow.domain.execution.launcher.NodeLaunchRequest;
import com.tencent.hpcflow.domain.execution.launcher.NodeLauncher;
import com.tencent.hpcflow.domain.execution.launcher.NodeSession;
import com.tencent.hpcflow.domain.pipeline.PackageEntry;
import com.tencent.hpcflow.domain.pkg.PackageCatalog;
import com.tencent.hpcflow.domain.pkg.PackageDefinition;
import com.tencent.hpcflow.domain.schedule.NodeAssignment;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * ProcessNodeLauncher - 以操作系统进程驱动节点的启动器基类
 * <p>
 * 每个包在节点上以一段 bash 脚本运行，子类只决定脚本如何送达节点：
 * 本机 bash、ssh 或 mpirun。
 * </p>
 *
 * @author hpcflow
 */
@Slf4j
public abstract class ProcessNodeLauncher implements NodeLauncher {

    private static final Duration CLEAN_TIMEOUT = Duration.ofMinutes(2);

    protected final CommandRunner runner;

    private final PackageCatalog packageCatalog;

    private final String workRoot;

    private final Duration sampleTimeout;

    protected ProcessNodeLauncher(CommandRunner runner, PackageCatalog packageCatalog, String workRoot,
                                  Duration sampleTimeout) {
        this.runner = runner;
        this.packageCatalog = packageCatalog;
        this.workRoot = workRoot;
        this.sampleTimeout = sampleTimeout;
    }

    /**
     * 把脚本包装成在目标节点上执行的命令
     *
     * @param entry 运行的包，控制命令（就绪检查、采样、清理）为空
     */
    protected abstract List<String> wrap(NodeAssignment assignment, ExecutionMethodConfig methodConfig,
                                         PackageEntry entry, String script);

    @Override
    public NodeSession launch(NodeLaunchRequest request) {
        log.info("Launching node {} ({}) for execution {} via {}", request.getAssignment().getNodeId(),
                request.getAssignment().getHost(), request.getExecutionId(), method().getValue());
        return new ProcessNodeSession(this, request);
    }

    @Override
    public void clean(String executionId, NodeAssignment assignment, ExecutionMethodConfig methodConfig,
                      boolean preserveLogs, boolean preserveOutputs) {
        String script = ShellScripts.cleanScript(workDir(executionId), preserveLogs, preserveOutputs);
        List<String> command = wrap(assignment, methodConfig, null, script);
        try {
            Process process = runner.start(command);
            process.getInputStream().transferTo(OutputStream.nullOutputStream());
            if (!process.waitFor(CLEAN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IllegalStateException("Cleaning " + assignment.getHost() + " timed out");
            }
            if (process.exitValue() != 0) {
                throw new IllegalStateException("Cleaning " + assignment.getHost() + " exited with code "
                        + process.exitValue());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clean " + assignment.getHost(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while cleaning " + assignment.getHost(), e);
        }
    }

    public String workDir(String executionId) {
        return workRoot + "/" + executionId;
    }

    Duration getSampleTimeout() {
        return sampleTimeout;
    }

    /**
     * 包的命令，未声明命令时为空
     */
    Optional<String> commandFor(PackageEntry entry) {
        return packageCatalog.find(entry.getName())
                .map(PackageDefinition::getCommand)
                .filter(c -> !c.isBlank())
                .map(template -> ShellScripts.render(template, entry.getConfig()));
    }
}
