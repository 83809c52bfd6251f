package com.eventdaemon.gateway;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;

/**
 * Payload of a single event emission: the positional arguments in order plus any named
 * attributes. Immutable; the same instance is handed to primary subscribers and to mirror
 * sinks so both observe identical data.
 *
 * <p>Positional arguments may be {@code null} (gateway callbacks sometimes report missing
 * fields that way), which is why the lists are copied rather than built with {@code List.of}.
 */
@EqualsAndHashCode
public final class EventPayload {

    private static final EventPayload EMPTY = new EventPayload(List.of(), Map.of());

    private final List<Object> args;
    private final Map<String, Object> attributes;

    private EventPayload(List<?> args, Map<String, ?> attributes) {
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static EventPayload empty() {
        return EMPTY;
    }

    public static EventPayload of(Object... args) {
        if (args == null || args.length == 0) {
            return EMPTY;
        }
        return new EventPayload(Arrays.asList(args), Map.of());
    }

    public static EventPayload of(List<?> args, Map<String, ?> attributes) {
        return new EventPayload(
                args != null ? args : List.of(), attributes != null ? attributes : Map.of());
    }

    /** Returns a copy of this payload with one more named attribute. */
    public EventPayload withAttribute(String name, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(attributes);
        merged.put(name, value);
        return new EventPayload(args, merged);
    }

    public List<Object> getArgs() {
        return args;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public int size() {
        return args.size();
    }

    public Object arg(int index) {
        return args.get(index);
    }

    /**
     * Typed access to a positional argument.
     *
     * @throws ClassCastException if the argument is not an instance of {@code type}
     */
    public <T> T arg(int index, Class<T> type) {
        return type.cast(args.get(index));
    }

    public Object attribute(String name) {
        return attributes.get(name);
    }

    @Override
    public String toString() {
        return "EventPayload{args=" + args + ", attributes=" + attributes + "}";
    }
}
