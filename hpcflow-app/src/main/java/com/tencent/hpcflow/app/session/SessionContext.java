package com.tencent.hpcflow.app.session;

import lombok.Getter;

import java.time.Instant;
import java.util.Optional;

/**
 * SessionContext - 一个操作会话
 * <p>
 * 记录会话当前聚焦的流水线，不同会话互不影响。
 * </p>
 */
@Getter
public class SessionContext {

    private final String id;

    private final Instant openedAt;

    private volatile String focusedPipeline;

    public SessionContext(String id, Instant openedAt) {
        this.id = id;
        this.openedAt = openedAt;
    }

    public Optional<String> focused() {
        return Optional.ofNullable(focusedPipeline);
    }

    void focus(String pipelineName) {
        this.focusedPipeline = pipelineName;
    }

    void clear() {
        this.focusedPipeline = null;
    }
}
