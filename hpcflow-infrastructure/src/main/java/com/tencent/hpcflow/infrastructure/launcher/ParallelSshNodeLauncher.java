package com.tencent.hpcflow.infrastructure.launcher;

import com.tencent.hpcflow.domain.execution.ExecutionMethod;
import com.tencent.hpcflow.domain.pkg.PackageCatalog;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * ParallelSshNodeLauncher - 面向大规模扇出的 ssh
 * <p>
 * 复用 ssh 主连接并限制连接超时，编排器按扇出上限并发下发到各节点。
 * </p>
 */
public class ParallelSshNodeLauncher extends SshNodeLauncher {

    public static final String SETTING_CONNECT_TIMEOUT = "connect_timeout";

    private static final String DEFAULT_CONNECT_TIMEOUT = "10";

    public ParallelSshNodeLauncher(CommandRunner runner, PackageCatalog packageCatalog, String workRoot,
                                   Duration sampleTimeout) {
        super(runner, packageCatalog, workRoot, sampleTimeout);
    }

    @Override
    public ExecutionMethod method() {
        return ExecutionMethod.PARALLEL_SSH;
    }

    @Override
    protected List<String> sshOptions(Map<String, String> settings) {
        return List.of(
                "-o", "ConnectTimeout=" + settings.getOrDefault(SETTING_CONNECT_TIMEOUT, DEFAULT_CONNECT_TIMEOUT),
                "-o", "ControlMaster=auto",
                "-o", "ControlPersist=60",
                "-o", "ControlPath=~/.ssh/hpcflow-%r@%h:%p");
    }
}
