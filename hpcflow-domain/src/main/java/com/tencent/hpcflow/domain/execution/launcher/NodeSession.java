package com.tencent.hpcflow.domain.execution.launcher;

import com.tencent.hpcflow.domain.monitor.UtilizationSample;
import com.tencent.hpcflow.domain.pipeline.PackageEntry;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * NodeSession - 一个节点上的执行会话
 * <p>
 * 统一的 launch/stop/status 能力接口。停止是协作式的：
 * {@link #requestStop(Duration)} 通知节点并等待确认，只有 {@link #kill()} 会强制终止。
 * </p>
 */
public interface NodeSession {

    int nodeId();

    /**
     * 等待节点确认就绪
     * @return 超时前是否收到确认
     */
    boolean awaitReady(Duration timeout) throws InterruptedException;

    /**
     * 在节点上运行一个包直至结束
     */
    PackageResult run(PackageEntry entry) throws InterruptedException;

    /**
     * 请求节点在安全点停止
     * @return 宽限期内是否收到确认
     */
    boolean requestStop(Duration gracePeriod) throws InterruptedException;

    /**
     * 强制终止，不等待确认
     */
    void kill();

    /**
     * 心跳采样，节点无响应时返回空
     */
    Optional<UtilizationSample> sample();

    /**
     * 取出上次调用以来的新日志行
     */
    List<String> drainLogs();
}
