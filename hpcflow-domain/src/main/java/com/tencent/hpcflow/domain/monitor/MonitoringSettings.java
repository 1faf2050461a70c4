package com.tencent.hpcflow.domain.monitor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * MonitoringSettings - 监控参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitoringSettings {

    /**
     * 每个节点保留的采样数
     */
    @Builder.Default
    private int windowSize = 60;

    /**
     * 每个节点保留的日志行数
     */
    @Builder.Default
    private int logLines = 100;

    /**
     * 日志收集时每个执行保留的行数
     */
    @Builder.Default
    private int collectedLogLines = 10000;

    /**
     * 超过该时长未收到心跳的节点判为失联
     */
    @Builder.Default
    private Duration heartbeatTimeout = Duration.ofSeconds(15);

    /**
     * 走势判定阈值：前后半窗口均值之差超过该值
     */
    @Builder.Default
    private double trendThreshold = 5.0;

    /**
     * 最多跟踪的已结束执行数
     */
    @Builder.Default
    private int retainedExecutions = 100;

    @Builder.Default
    private List<AlertRule> alertRules = new ArrayList<>();
}
