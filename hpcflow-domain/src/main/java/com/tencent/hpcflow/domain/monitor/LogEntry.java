package com.tencent.hpcflow.domain.monitor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * LogEntry - 收集到的一行执行日志
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogEntry {

    /**
     * 在执行内单调递增
     */
    private long sequence;

    private Instant time;

    /**
     * 为空表示编排器自身记录的状态迁移
     */
    private Integer nodeId;

    private LogLevel level;

    private String line;
}
