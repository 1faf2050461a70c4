package com.tencent.hpcflow.app.session;

import com.tencent.hpcflow.domain.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * SessionRegistry - 打开的会话及其聚焦的流水线
 */
@Slf4j
@Component
public class SessionRegistry {

    private final Map<String, SessionContext> sessions = new ConcurrentHashMap<>();

    private final Clock clock;

    public SessionRegistry(Clock clock) {
        this.clock = clock;
    }

    public SessionContext open() {
        SessionContext session = new SessionContext(UUID.randomUUID().toString(), clock.instant());
        sessions.put(session.getId(), session);
        log.info("Opened session {}", session.getId());
        return session;
    }

    public SessionContext get(String sessionId) {
        SessionContext session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new NotFoundException("session:" + sessionId, "Session not found: " + sessionId);
        }
        return session;
    }

    public void close(String sessionId) {
        if (sessions.remove(sessionId) == null) {
            throw new NotFoundException("session:" + sessionId, "Session not found: " + sessionId);
        }
        log.info("Closed session {}", sessionId);
    }

    public void focus(String sessionId, String pipelineName) {
        get(sessionId).focus(pipelineName);
        log.debug("Session {} focused pipeline [{}]", sessionId, pipelineName);
    }

    /**
     * 聚焦了该流水线的其他会话，sessionId 为空时视所有会话为其他会话
     */
    public List<String> focusedElsewhere(String pipelineName, String sessionId) {
        return sessions.values().stream()
                .filter(s -> !s.getId().equals(sessionId))
                .filter(s -> pipelineName.equals(s.getFocusedPipeline()))
                .map(SessionContext::getId)
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * 流水线删除后清除所有会话上的聚焦
     */
    public void release(String pipelineName) {
        sessions.values().stream()
                .filter(s -> pipelineName.equals(s.getFocusedPipeline()))
                .forEach(SessionContext::clear);
    }

    public Optional<String> focused(String sessionId) {
        return get(sessionId).focused();
    }
}
