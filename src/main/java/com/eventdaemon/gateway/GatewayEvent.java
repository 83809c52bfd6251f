package com.eventdaemon.gateway;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A named notification channel on a {@link GatewayConnection}. Subscribers are kept in
 * subscription order and are not de-duplicated: connecting the same subscriber twice makes
 * it run twice per emission.
 */
public class GatewayEvent {

    private final String name;
    private final EventDispatcher dispatcher;
    private final List<EventSubscriber> subscribers = new CopyOnWriteArrayList<>();

    public GatewayEvent(String name, EventDispatcher dispatcher) {
        this.name = Objects.requireNonNull(name, "name");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    public String getName() {
        return name;
    }

    public void connect(EventSubscriber subscriber) {
        subscribers.add(Objects.requireNonNull(subscriber, "subscriber"));
    }

    public boolean disconnect(EventSubscriber subscriber) {
        return subscribers.remove(subscriber);
    }

    public List<EventSubscriber> getSubscribers() {
        return Collections.unmodifiableList(subscribers);
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }

    public void emit(EventPayload payload) {
        dispatcher.dispatch(this, payload);
    }

    public void emit(Object... args) {
        emit(EventPayload.of(args));
    }

    @Override
    public String toString() {
        return "GatewayEvent{" + name + ", subscribers=" + subscribers.size() + "}";
    }
}
