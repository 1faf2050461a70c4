package com.tencent.hpcflow.domain.execution.launcher;

import com.tencent.hpcflow.domain.execution.ExecutionMethod;
import com.tencent.hpcflow.domain.execution.ExecutionMethodConfig;
import com.tencent.hpcflow.domain.schedule.NodeAssignment;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 可编排的节点启动器
 * <p>
 * 每个节点的行为由 {@link NodeScript} 描述：就绪延迟、包耗时、失败的包、停止确认延迟。
 * 所有会话都被保留，便于断言。
 * </p>
 */
public class FakeNodeLauncher implements NodeLauncher {

    private final ExecutionMethod method;

    private final NodeScript defaults = new NodeScript();

    private final Map<Integer, NodeScript> scripts = new ConcurrentHashMap<>();

    private final List<FakeNodeSession> sessions = new CopyOnWriteArrayList<>();

    private final List<String> cleaned = new CopyOnWriteArrayList<>();

    public FakeNodeLauncher(ExecutionMethod method) {
        this.method = method;
    }

    @Override
    public ExecutionMethod method() {
        return method;
    }

    @Override
    public NodeSession launch(NodeLaunchRequest request) {
        NodeScript script = scripts.getOrDefault(request.getAssignment().getNodeId(), defaults);
        FakeNodeSession session = new FakeNodeSession(request, script);
        sessions.add(session);
        return session;
    }

    @Override
    public void clean(String executionId, NodeAssignment assignment, ExecutionMethodConfig methodConfig,
                      boolean preserveLogs, boolean preserveOutputs) {
        cleaned.add(executionId + "@" + assignment.getHost());
    }

    // ==================== 测试辅助方法 ====================

    /**
     * 未单独编排的节点使用的行为
     */
    public NodeScript defaults() {
        return defaults;
    }

    public NodeScript script(int nodeId) {
        return scripts.computeIfAbsent(nodeId, id -> new NodeScript());
    }

    public List<FakeNodeSession> sessions() {
        return sessions;
    }

    public List<FakeNodeSession> sessionsOf(String executionId) {
        return sessions.stream()
                .filter(s -> s.request().getExecutionId().equals(executionId))
                .collect(Collectors.toList());
    }

    public FakeNodeSession session(String executionId, int nodeId) {
        return sessionsOf(executionId).stream()
                .filter(s -> s.nodeId() == nodeId)
                .findFirst()
                .orElseThrow(() -> new AssertionError("node " + nodeId + " was never launched"));
    }

    public int launchCount() {
        return sessions.size();
    }

    public List<String> cleaned() {
        return cleaned;
    }

    /**
     * 单个节点的行为
     */
    public static class NodeScript {

        private volatile Duration readyDelay = Duration.ZERO;

        private volatile boolean neverReady;

        private volatile Duration packageDuration = Duration.ZERO;

        private final Map<String, Duration> packageDurations = new HashMap<>();

        private final Set<String> failOn = new HashSet<>();

        private volatile Duration stopAckDelay = Duration.ZERO;

        private volatile boolean silent;

        public NodeScript readyAfter(Duration delay) {
            this.readyDelay = delay;
            return this;
        }

        public NodeScript neverReady() {
            this.neverReady = true;
            return this;
        }

        public NodeScript eachPackageTakes(Duration duration) {
            this.packageDuration = duration;
            return this;
        }

        public synchronized NodeScript packageTakes(String packageName, Duration duration) {
            packageDurations.put(packageName, duration);
            return this;
        }

        public synchronized NodeScript failOn(String packageName) {
            failOn.add(packageName);
            return this;
        }

        /**
         * 清除所有预设的失败
         */
        public synchronized NodeScript recover() {
            failOn.clear();
            return this;
        }

        public NodeScript acknowledgeStopAfter(Duration delay) {
            this.stopAckDelay = delay;
            return this;
        }

        public NodeScript silent() {
            this.silent = true;
            return this;
        }

        Duration readyDelay() {
            return readyDelay;
        }

        boolean isNeverReady() {
            return neverReady;
        }

        synchronized Duration durationOf(String packageName) {
            return packageDurations.getOrDefault(packageName, packageDuration);
        }

        synchronized boolean fails(String packageName) {
            return failOn.contains(packageName);
        }

        Duration stopAckDelay() {
            return stopAckDelay;
        }

        boolean isSilent() {
            return silent;
        }
    }
}
