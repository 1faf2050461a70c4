package com.tencent.hpcflow.domain.execution;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * OrchestratorSettings - 编排器参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrchestratorSettings {

    /**
     * 单次等待节点就绪确认的超时
     */
    @Builder.Default
    private Duration launchTimeout = Duration.ofSeconds(30);

    /**
     * 就绪确认超时后的重试次数
     */
    @Builder.Default
    private int ackRetries = 2;

    /**
     * 重试退避基数，第 n 次重试等待 n 倍
     */
    @Builder.Default
    private Duration ackBackoff = Duration.ofSeconds(1);

    /**
     * 单次执行并发下发命令的节点数上限
     */
    @Builder.Default
    private int fanOutLimit = 16;

    /**
     * 进入 RUNNING 所需的就绪节点数，0 表示全部节点
     */
    @Builder.Default
    private int quorum = 0;

    /**
     * 优雅停止的宽限期
     */
    @Builder.Default
    private Duration stopGracePeriod = Duration.ofSeconds(30);

    @Builder.Default
    private Duration heartbeatInterval = Duration.ofSeconds(5);

    /**
     * 连续失败的心跳采样次数上限，超过后判定节点失联
     */
    @Builder.Default
    private int maxMissedHeartbeats = 3;
}
