package com.tencent.hpcflow.domain.monitor;

import com.tencent.hpcflow.domain.event.Event;
import com.tencent.hpcflow.domain.event.EventListener;
import com.tencent.hpcflow.domain.event.ExecutionEvents;
import com.tencent.hpcflow.domain.exception.ValidationException;
import com.tencent.hpcflow.domain.execution.ExecutionState;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * ExecutionLogCollector - 执行日志收集
 * <p>
 * 汇总各节点上报的日志行与编排器的状态迁移，按执行保存，支持按级别与正则检索。
 * 与监控聚合的日志尾不同，这里保留整个执行的日志，直到超出保留行数或被清理。
 * </p>
 *
 * @author hpcflow
 */
@Slf4j
public class ExecutionLogCollector implements EventListener {

    private final MonitoringSettings settings;

    private final ConcurrentMap<String, ExecutionLog> executions = new ConcurrentHashMap<>();

    private final Deque<String> finished = new ConcurrentLinkedDeque<>();

    public ExecutionLogCollector(MonitoringSettings settings) {
        this.settings = settings;
    }

    @Override
    public void onEvent(Event event) {
        if (event.getExecutionId() == null || event.getType() == null) {
            return;
        }
        boolean becameTerminal = false;
        switch (event.getType()) {
            case ExecutionEvents.NODE_LOG: {
                String line = String.valueOf(event.getPayload().get(ExecutionEvents.KEY_LINE));
                logOf(event).append(event, LogLevel.detect(line), line, settings.getCollectedLogLines());
                break;
            }
            case ExecutionEvents.STATE_CHANGED: {
                ExecutionState to = ExecutionState.valueOf(String.valueOf(event.getPayload().get(ExecutionEvents.KEY_TO)));
                LogLevel level = to == ExecutionState.FAILED || to == ExecutionState.FAILING
                        ? LogLevel.ERROR : LogLevel.INFO;
                logOf(event).append(event, level, "state " + event.getPayload().get(ExecutionEvents.KEY_FROM) + " -> " + to,
                        settings.getCollectedLogLines());
                becameTerminal = to.isTerminal();
                break;
            }
            default:
                break;
        }
        if (becameTerminal) {
            retire(event.getExecutionId());
        }
    }

    /**
     * 全部已保留的日志
     */
    public ExecutionLogs collect(String executionId) {
        return search(executionId, LogLevel.DEBUG, null);
    }

    /**
     * 检索日志
     *
     * @param minLevel 最低级别，为空时不过滤
     * @param pattern  在行内查找的正则表达式，为空时不过滤
     * @throws ValidationException 正则表达式无法编译
     */
    public ExecutionLogs search(String executionId, LogLevel minLevel, String pattern) {
        Pattern regex = compile(pattern);
        LogLevel floor = minLevel == null ? LogLevel.DEBUG : minLevel;
        ExecutionLog collected = executions.get(executionId);
        if (collected == null) {
            return ExecutionLogs.builder().executionId(executionId).build();
        }
        synchronized (collected) {
            List<LogEntry> matched = new ArrayList<>();
            Map<LogLevel, Long> counts = new EnumMap<>(LogLevel.class);
            for (LogEntry entry : collected.entries) {
                counts.merge(entry.getLevel(), 1L, Long::sum);
                if (entry.getLevel().isAtLeast(floor) && (regex == null || regex.matcher(entry.getLine()).find())) {
                    matched.add(entry);
                }
            }
            return ExecutionLogs.builder()
                    .executionId(executionId)
                    .pipelineName(collected.pipelineName)
                    .entries(matched)
                    .countsByLevel(counts)
                    .total(collected.entries.size())
                    .dropped(collected.dropped)
                    .build();
        }
    }

    /**
     * 丢弃一次执行的全部日志
     */
    public void discard(String executionId) {
        if (executions.remove(executionId) != null) {
            finished.remove(executionId);
            log.debug("Discarded collected logs of execution {}", executionId);
        }
    }

    private ExecutionLog logOf(Event event) {
        return executions.computeIfAbsent(event.getExecutionId(), id -> new ExecutionLog(event.getPipelineName()));
    }

    private void retire(String executionId) {
        finished.addLast(executionId);
        while (finished.size() > settings.getRetainedExecutions()) {
            String evicted = finished.pollFirst();
            if (evicted != null) {
                executions.remove(evicted);
            }
        }
    }

    private static Pattern compile(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return null;
        }
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new ValidationException("log-pattern", "Invalid log search pattern: " + e.getDescription());
        }
    }

    private static final class ExecutionLog {

        private final String pipelineName;

        private final Deque<LogEntry> entries = new ArrayDeque<>();

        private long sequence;

        private long dropped;

        private ExecutionLog(String pipelineName) {
            this.pipelineName = pipelineName;
        }

        synchronized void append(Event event, LogLevel level, String line, int limit) {
            entries.addLast(LogEntry.builder()
                    .sequence(++sequence)
                    .time(event.getTime())
                    .nodeId(event.getNodeId())
                    .level(level)
                    .line(line)
                    .build());
            while (entries.size() > Math.max(1, limit)) {
                entries.removeFirst();
                dropped++;
            }
        }
    }
}
