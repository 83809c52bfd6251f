package com.eventdaemon.bridge;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

/** Process-wide namespace of {@link SignalChannel}s. Looking up a name creates its channel. */
@Component
public class SignalRegistry {

    private final ConcurrentMap<String, SignalChannel> channels = new ConcurrentHashMap<>();

    public SignalChannel signal(String name) {
        return channels.computeIfAbsent(name, SignalChannel::new);
    }

    public Set<String> getSignalNames() {
        return Set.copyOf(channels.keySet());
    }
}
