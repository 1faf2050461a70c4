package com.tencent.hpcflow.domain.event;

/**
 * ExecutionEvents - 执行相关的事件类型与负载键
 */
public final class ExecutionEvents {

    public static final String STATE_CHANGED = "execution.state.changed";

    public static final String NODE_STATUS = "execution.node.status";

    public static final String NODE_HEARTBEAT = "execution.node.heartbeat";

    public static final String NODE_LOG = "execution.node.log";

    public static final String PACKAGE_COMPLETED = "execution.package.completed";

    public static final String KEY_FROM = "from";

    public static final String KEY_TO = "to";

    public static final String KEY_STATUS = "status";

    public static final String KEY_CPU = "cpu";

    public static final String KEY_MEMORY = "memory";

    public static final String KEY_IO = "io";

    public static final String KEY_LINE = "line";

    public static final String KEY_PACKAGE = "package";

    public static final String KEY_INDEX = "index";

    private ExecutionEvents() {
    }

    public static String executionSource(String executionId) {
        return "/executions/" + executionId;
    }

    public static String nodeSource(String executionId, int nodeId) {
        return "/executions/" + executionId + "/nodes/" + nodeId;
    }
}
