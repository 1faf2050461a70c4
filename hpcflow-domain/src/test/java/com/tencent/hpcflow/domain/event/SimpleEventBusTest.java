package com.tencent.hpcflow.domain.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SimpleEventBusTest {

    @Test
    void testFailingListenerDoesNotBlockOthers() {
        SimpleEventBus bus = new SimpleEventBus(Runnable::run);
        List<String> received = new ArrayList<>();
        bus.subscribe(event -> {
            throw new IllegalStateException("listener bug");
        });
        bus.subscribe(event -> received.add(event.getType()));

        bus.publish(Event.builder().type(ExecutionEvents.NODE_LOG).build());

        assertEquals(List.of(ExecutionEvents.NODE_LOG), received);
    }

    @Test
    void testUnsubscribedListenerStopsReceiving() {
        SimpleEventBus bus = new SimpleEventBus(Runnable::run);
        List<Event> received = new ArrayList<>();
        EventListener listener = received::add;
        bus.subscribe(listener);
        bus.publish(Event.builder().type(ExecutionEvents.STATE_CHANGED).build());

        bus.unsubscribe(listener);
        bus.publish(Event.builder().type(ExecutionEvents.STATE_CHANGED).build());

        assertEquals(1, received.size());
    }
}
