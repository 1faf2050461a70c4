package com.tencent.hpcflow.infrastructure.launcher;

import com.tencent.hpcflow.domain.execution.ExecutionMethod;
import com.tencent.hpcflow.domain.execution.ExecutionMethodConfig;
import com.tencent.hpcflow.domain.pipeline.PackageEntry;
import com.tencent.hpcflow.domain.pkg.PackageCatalog;
import com.tencent.hpcflow.domain.schedule.NodeAssignment;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * SshNodeLauncher - 通过 ssh 在节点上运行
 * <p>
 * 执行方式参数中的 port、user 对应 ssh 的端口与登录用户。
 * </p>
 *
 * @author hpcflow
 */
public class SshNodeLauncher extends ProcessNodeLauncher {

    public static final String SETTING_PORT = "port";

    public static final String SETTING_USER = "user";

    public SshNodeLauncher(CommandRunner runner, PackageCatalog packageCatalog, String workRoot,
                           Duration sampleTimeout) {
        super(runner, packageCatalog, workRoot, sampleTimeout);
    }

    @Override
    public ExecutionMethod method() {
        return ExecutionMethod.SSH;
    }

    @Override
    protected List<String> wrap(NodeAssignment assignment, ExecutionMethodConfig methodConfig,
                                PackageEntry entry, String script) {
        Map<String, String> settings = methodConfig == null ? Map.of() : methodConfig.getSettings();
        List<String> command = new ArrayList<>(List.of("ssh", "-o", "BatchMode=yes"));
        command.addAll(sshOptions(settings));
        if (settings.containsKey(SETTING_PORT)) {
            command.add("-p");
            command.add(settings.get(SETTING_PORT));
        }
        String user = settings.get(SETTING_USER);
        command.add(user == null ? assignment.getHost() : user + "@" + assignment.getHost());
        command.add("bash -c " + ShellScripts.quote(script));
        return command;
    }

    /**
     * 附加的 ssh 选项
     */
    protected List<String> sshOptions(Map<String, String> settings) {
        return List.of();
    }
}
