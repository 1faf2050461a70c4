package com.tencent.hpcflow.infrastructure.launcher;

import com.tencent.hpcflow.domain.execution.ExecutionMethod;
import com.tencent.hpcflow.domain.execution.ExecutionMethodConfig;
import com.tencent.hpcflow.domain.pipeline.PackageEntry;
import com.tencent.hpcflow.domain.pkg.PackageCatalog;
import com.tencent.hpcflow.domain.pkg.PackageType;
import com.tencent.hpcflow.domain.schedule.NodeAssignment;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * MpiNodeLauncher - 应用包经 mpirun 启动，其余命令走 ssh
 * <p>
 * 每个节点启动 processesPerNode 个进程；执行方式参数 mpirun 指定可执行文件，
 * mpi_args 为附加参数。
 * </p>
 *
 * @author hpcflow
 */
public class MpiNodeLauncher extends SshNodeLauncher {

    public static final String SETTING_MPIRUN = "mpirun";

    public static final String SETTING_MPI_ARGS = "mpi_args";

    public MpiNodeLauncher(CommandRunner runner, PackageCatalog packageCatalog, String workRoot,
                           Duration sampleTimeout) {
        super(runner, packageCatalog, workRoot, sampleTimeout);
    }

    @Override
    public ExecutionMethod method() {
        return ExecutionMethod.MPI;
    }

    @Override
    protected List<String> wrap(NodeAssignment assignment, ExecutionMethodConfig methodConfig,
                                PackageEntry entry, String script) {
        if (entry == null || entry.getType() != PackageType.APPLICATION) {
            return super.wrap(assignment, methodConfig, entry, script);
        }
        Map<String, String> settings = methodConfig == null ? Map.of() : methodConfig.getSettings();
        int ppn = methodConfig == null ? 1 : Math.max(1, methodConfig.getProcessesPerNode());
        List<String> command = new ArrayList<>();
        command.add(settings.getOrDefault(SETTING_MPIRUN, "mpirun"));
        command.add("-np");
        command.add(String.valueOf(ppn));
        command.add("--host");
        command.add(assignment.getHost() + ":" + ppn);
        String extra = settings.get(SETTING_MPI_ARGS);
        if (extra != null && !extra.isBlank()) {
            command.addAll(Arrays.asList(extra.trim().split("\\s+")));
        }
        command.add("bash");
        command.add("-c");
        command.add(script);
        return command;
    }
}
