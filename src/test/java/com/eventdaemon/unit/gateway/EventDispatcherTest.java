package com.eventdaemon.unit.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.eventdaemon.gateway.EventDispatcher;
import com.eventdaemon.gateway.EventPayload;
import com.eventdaemon.gateway.EventSubscriber;
import com.eventdaemon.gateway.GatewayEvent;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EventDispatcherTest {

    private EventDispatcher eventDispatcher;
    private GatewayEvent event;

    @BeforeEach
    void setUp() {
        eventDispatcher = new EventDispatcher();
        event = new GatewayEvent("orderStatusEvent", eventDispatcher);
    }

    @Test
    @DisplayName("subscribers run in order before any sink")
    void subscribersBeforeSinks() {
        List<String> calls = new ArrayList<>();
        event.connect(payload -> calls.add("first"));
        event.connect(payload -> calls.add("second"));
        eventDispatcher.addSink((e, payload) -> calls.add("sink"));

        event.emit("filled");

        assertThat(calls).containsExactly("first", "second", "sink");
    }

    @Test
    @DisplayName("a failing subscriber does not stop later subscribers or sinks")
    void failingSubscriberIsolated() {
        List<String> calls = new ArrayList<>();
        event.connect(payload -> {
            throw new IllegalStateException("handler bug");
        });
        event.connect(payload -> calls.add("second"));
        eventDispatcher.addSink((e, payload) -> calls.add("sink"));

        assertThatCode(() -> event.emit("filled")).doesNotThrowAnyException();
        assertThat(calls).containsExactly("second", "sink");
    }

    @Test
    @DisplayName("a failing sink never reaches the emitter")
    void failingSinkIsolated() {
        eventDispatcher.addSink((e, payload) -> {
            throw new IllegalStateException("sink bug");
        });

        assertThatCode(() -> event.emit(EventPayload.empty())).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("the same subscriber connected twice runs twice")
    void duplicateSubscriber() {
        List<EventPayload> seen = new ArrayList<>();
        EventSubscriber subscriber = seen::add;
        event.connect(subscriber);
        event.connect(subscriber);

        event.emit("filled");

        assertThat(seen).hasSize(2);
        assertThat(event.disconnect(subscriber)).isTrue();
        assertThat(event.getSubscriberCount()).isEqualTo(1);
    }
}
