package com.tencent.hpcflow.domain.event;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * SimpleEventBus - 进程内事件总线
 * <p>
 * 事件在给定的 {@link Executor} 上分发给各监听器，发布方不会被监听器阻塞。
 * 测试中传入同步 Executor 即可按顺序断言。
 * </p>
 */
@Slf4j
public class SimpleEventBus implements EventPublisher {

    private final List<EventListener> listeners = new CopyOnWriteArrayList<>();

    private final Executor dispatcher;

    public SimpleEventBus(Executor dispatcher) {
        this.dispatcher = dispatcher;
    }

    public void subscribe(EventListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(EventListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void publish(Event event) {
        for (EventListener listener : listeners) {
            try {
                dispatcher.execute(() -> deliver(listener, event));
            } catch (RejectedExecutionException e) {
                log.warn("Dropped event {} for {}: dispatcher rejected it", event.getType(), listener, e);
            }
        }
    }

    private void deliver(EventListener listener, Event event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.error("Listener {} failed on event {}", listener, event.getType(), e);
        }
    }
}
