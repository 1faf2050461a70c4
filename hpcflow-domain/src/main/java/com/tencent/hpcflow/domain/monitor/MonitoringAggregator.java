package com.tencent.hpcflow.domain.monitor;

import com.tencent.hpcflow.domain.event.Event;
import com.tencent.hpcflow.domain.event.EventListener;
import com.tencent.hpcflow.domain.event.ExecutionEvents;
import com.tencent.hpcflow.domain.exception.NotFoundException;
import com.tencent.hpcflow.domain.exception.ValidationException;
import com.tencent.hpcflow.domain.execution.ExecutionState;
import com.tencent.hpcflow.domain.execution.NodeState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentMap;
import java.util.function.ToDoubleFunction;

/**
 * MonitoringAggregator - 监控聚合
 * <p>
 * 订阅状态迁移、节点状态、心跳与日志事件，为每个执行维护滚动采样窗口和最近 N 行日志。
 * 只读事件，不回调编排器；超过心跳超时的节点标记为 UNRESPONSIVE，不会阻塞监控。
 * </p>
 *
 * @author hpcflow
 */
@Slf4j
public class MonitoringAggregator implements EventListener {

    private final MonitoringSettings settings;

    private final Clock clock;

    private final ExpressionParser parser = new SpelExpressionParser();

    private final Map<String, Expression> compiledRules = new ConcurrentHashMap<>();

    private final ConcurrentMap<String, ExecutionMonitor> executions = new ConcurrentHashMap<>();

    private final Deque<String> finished = new ConcurrentLinkedDeque<>();

    public MonitoringAggregator(MonitoringSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        for (AlertRule rule : settings.getAlertRules()) {
            compile(rule);
        }
    }

    @Override
    public void onEvent(Event event) {
        if (event.getExecutionId() == null || event.getType() == null) {
            return;
        }
        ExecutionMonitor monitor = executions.computeIfAbsent(event.getExecutionId(),
                id -> new ExecutionMonitor(id, event.getPipelineName()));
        boolean becameTerminal = false;
        synchronized (monitor) {
            switch (event.getType()) {
                case ExecutionEvents.STATE_CHANGED:
                    monitor.state = ExecutionState.valueOf(String.valueOf(event.getPayload().get(ExecutionEvents.KEY_TO)));
                    becameTerminal = monitor.state.isTerminal();
                    break;
                case ExecutionEvents.NODE_STATUS:
                    monitor.node(event.getNodeId(), event.getTime()).state =
                            NodeState.valueOf(String.valueOf(event.getPayload().get(ExecutionEvents.KEY_STATUS)));
                    break;
                case ExecutionEvents.NODE_HEARTBEAT:
                    monitor.node(event.getNodeId(), event.getTime()).record(UtilizationSample.builder()
                            .at(event.getTime())
                            .cpu(number(event, ExecutionEvents.KEY_CPU))
                            .memory(number(event, ExecutionEvents.KEY_MEMORY))
                            .io(number(event, ExecutionEvents.KEY_IO))
                            .build(), settings.getWindowSize());
                    break;
                case ExecutionEvents.NODE_LOG:
                    monitor.node(event.getNodeId(), event.getTime())
                            .log(String.valueOf(event.getPayload().get(ExecutionEvents.KEY_LINE)), settings.getLogLines());
                    break;
                default:
                    break;
            }
        }
        if (becameTerminal) {
            retire(event.getExecutionId());
        }
    }

    /**
     * 当前聚合状态
     *
     * @throws NotFoundException 尚未收到该执行的任何事件
     */
    public MonitoringFrame snapshot(String executionId) {
        ExecutionMonitor monitor = executions.get(executionId);
        if (monitor == null) {
            throw new NotFoundException("execution:" + executionId, "No monitoring data for execution " + executionId);
        }
        MonitoringFrame frame;
        synchronized (monitor) {
            frame = monitor.frame(clock.instant());
        }
        frame.getAlerts().addAll(evaluateAlerts(frame));
        return frame;
    }

    /**
     * 按给定节奏产生监控帧，直到终态或取消
     */
    public MonitoringStream stream(String executionId, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new ValidationException("monitor-interval", "Monitoring interval must be positive");
        }
        snapshot(executionId);
        return new MonitoringStream(() -> snapshot(executionId), interval);
    }

    /**
     * 注册告警规则，表达式不合法时抛出校验异常
     */
    public void addAlertRule(AlertRule rule) {
        compile(rule);
        settings.getAlertRules().add(rule);
    }

    private void compile(AlertRule rule) {
        try {
            compiledRules.put(rule.getName(), parser.parseExpression(rule.getCondition()));
        } catch (ParseException e) {
            throw new ValidationException("alert-rule:" + rule.getName(),
                    "Alert rule '" + rule.getName() + "' has an invalid condition: " + e.getMessage(), e);
        }
    }

    private List<String> evaluateAlerts(MonitoringFrame frame) {
        List<String> alerts = new ArrayList<>();
        for (NodeFrame node : frame.getNodes()) {
            if (node.getHealth() == NodeHealth.UNRESPONSIVE) {
                alerts.add("node " + node.getNodeId() + " is unresponsive");
            }
            for (AlertRule rule : settings.getAlertRules()) {
                Expression expression = compiledRules.get(rule.getName());
                StandardEvaluationContext context = new StandardEvaluationContext(node);
                context.setVariable("frame", frame);
                try {
                    if (Boolean.TRUE.equals(expression.getValue(context, Boolean.class))) {
                        String message = rule.getMessage() == null ? rule.getName() : rule.getMessage();
                        alerts.add("[" + rule.getName() + "] "
                                + message.replace("{node}", String.valueOf(node.getNodeId())));
                    }
                } catch (EvaluationException e) {
                    log.warn("Alert rule '{}' could not be evaluated on node {}: {}", rule.getName(),
                            node.getNodeId(), e.getMessage());
                }
            }
        }
        return alerts;
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

    private static double number(Event event, String key) {
        Object value = event.getPayload().get(key);
        return value instanceof Number ? ((Number) value).doubleValue() : 0.0;
    }

    private final class ExecutionMonitor {

        private final String executionId;

        private final String pipelineName;

        private ExecutionState state = ExecutionState.CREATED;

        private final Map<Integer, NodeMonitor> nodes = new TreeMap<>();

        ExecutionMonitor(String executionId, String pipelineName) {
            this.executionId = executionId;
            this.pipelineName = pipelineName;
        }

        NodeMonitor node(Integer nodeId, Instant seenAt) {
            int id = nodeId == null ? 0 : nodeId;
            return nodes.computeIfAbsent(id, key -> new NodeMonitor(key, seenAt));
        }

        MonitoringFrame frame(Instant now) {
            MonitoringFrame frame = MonitoringFrame.builder()
                    .executionId(executionId)
                    .pipelineName(pipelineName)
                    .state(state)
                    .at(now)
                    .build();
            for (NodeMonitor node : nodes.values()) {
                frame.getNodes().add(node.frame(now, state));
            }
            return frame;
        }
    }

    private final class NodeMonitor {

        private final int nodeId;

        private final Instant firstSeen;

        private NodeState state = NodeState.PENDING;

        private Instant lastHeartbeat;

        private final Deque<UtilizationSample> window = new ArrayDeque<>();

        private final Deque<String> logs = new ArrayDeque<>();

        NodeMonitor(int nodeId, Instant firstSeen) {
            this.nodeId = nodeId;
            this.firstSeen = firstSeen;
        }

        void record(UtilizationSample sample, int windowSize) {
            window.addLast(sample);
            while (window.size() > windowSize) {
                window.removeFirst();
            }
            lastHeartbeat = sample.getAt();
        }

        void log(String line, int limit) {
            logs.addLast(line);
            while (logs.size() > limit) {
                logs.removeFirst();
            }
        }

        NodeFrame frame(Instant now, ExecutionState executionState) {
            List<UtilizationSample> samples = new ArrayList<>(window);
            NodeFrame frame = NodeFrame.builder()
                    .nodeId(nodeId)
                    .state(state)
                    .health(health(now, executionState))
                    .lastHeartbeat(lastHeartbeat)
                    .latest(samples.isEmpty() ? null : samples.get(samples.size() - 1))
                    .averageCpu(average(samples, UtilizationSample::getCpu))
                    .averageMemory(average(samples, UtilizationSample::getMemory))
                    .averageIo(average(samples, UtilizationSample::getIo))
                    .recentLogs(new ArrayList<>(logs))
                    .build();
            frame.getTrends().put("cpu", trend(samples, UtilizationSample::getCpu));
            frame.getTrends().put("memory", trend(samples, UtilizationSample::getMemory));
            frame.getTrends().put("io", trend(samples, UtilizationSample::getIo));
            return frame;
        }

        private NodeHealth health(Instant now, ExecutionState executionState) {
            if (state.isFinished() || executionState.isTerminal()) {
                return NodeHealth.FINISHED;
            }
            Instant reference = lastHeartbeat != null ? lastHeartbeat : firstSeen;
            boolean expectingHeartbeats = lastHeartbeat != null || state == NodeState.RUNNING;
            if (expectingHeartbeats && reference.plus(settings.getHeartbeatTimeout()).isBefore(now)) {
                return NodeHealth.UNRESPONSIVE;
            }
            return lastHeartbeat == null ? NodeHealth.PENDING : NodeHealth.HEALTHY;
        }
    }

    private static double average(List<UtilizationSample> samples, ToDoubleFunction<UtilizationSample> metric) {
        return samples.stream().mapToDouble(metric).average().orElse(0.0);
    }

    private Trend trend(List<UtilizationSample> samples, ToDoubleFunction<UtilizationSample> metric) {
        if (samples.size() < 4) {
            return Trend.STABLE;
        }
        int half = samples.size() / 2;
        double earlier = average(samples.subList(0, half), metric);
        double later = average(samples.subList(samples.size() - half, samples.size()), metric);
        if (later - earlier > settings.getTrendThreshold()) {
            return Trend.RISING;
        }
        if (earlier - later > settings.getTrendThreshold()) {
            return Trend.FALLING;
        }
        return Trend.STABLE;
    }
}
