package com.tencent.hpcflow.infrastructure.launcher;

import java.io.IOException;
import java.util.List;

/**
 * CommandRunner - 启动操作系统进程
 * <p>
 * 标准错误合并到标准输出。
 * </p>
 */
public interface CommandRunner {

    Process start(List<String> command) throws IOException;
}
