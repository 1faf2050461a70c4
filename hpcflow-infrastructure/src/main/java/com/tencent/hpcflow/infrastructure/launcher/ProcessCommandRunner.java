package com.tencent.hpcflow.infrastructure.launcher;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;

/**
 * ProcessCommandRunner - 基于 {@link ProcessBuilder} 的进程启动
 */
@Slf4j
public class ProcessCommandRunner implements CommandRunner {

    @Override
    public Process start(List<String> command) throws IOException {
        log.debug("Starting process: {}", command);
        return new ProcessBuilder(command).redirectErrorStream(true).start();
    }
}
