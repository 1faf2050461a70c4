package com.tencent.hpcflow.domain.monitor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * ExecutionLogs - 一次执行的日志查询结果
 * <p>
 * entries 只包含匹配过滤条件的行；countsByLevel 与 total 统计全部已保留的行。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionLogs {

    private String executionId;

    private String pipelineName;

    @Builder.Default
    private List<LogEntry> entries = new ArrayList<>();

    @Builder.Default
    private Map<LogLevel, Long> countsByLevel = new EnumMap<>(LogLevel.class);

    private long total;

    /**
     * 超出保留上限而被丢弃的最早的行数
     */
    private long dropped;
}
