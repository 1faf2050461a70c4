package com.tencent.hpcflow.infrastructure.launcher;

import com.tencent.hpcflow.domain.execution.ExecutionMethod;
import com.tencent.hpcflow.domain.execution.ExecutionMethodConfig;
import com.tencent.hpcflow.domain.pipeline.PackageEntry;
import com.tencent.hpcflow.domain.pkg.PackageCatalog;
import com.tencent.hpcflow.domain.schedule.NodeAssignment;

import java.time.Duration;
import java.util.List;

/**
 * LocalNodeLauncher - 在本机以 bash 运行
 */
public class LocalNodeLauncher extends ProcessNodeLauncher {

    public LocalNodeLauncher(CommandRunner runner, PackageCatalog packageCatalog, String workRoot,
                             Duration sampleTimeout) {
        super(runner, packageCatalog, workRoot, sampleTimeout);
    }

    @Override
    public ExecutionMethod method() {
        return ExecutionMethod.LOCAL;
    }

    @Override
    protected List<String> wrap(NodeAssignment assignment, ExecutionMethodConfig methodConfig,
                                PackageEntry entry, String script) {
        return List.of("bash", "-c", script);
    }
}
