package com.questrail.statechart.runtime;

import com.questrail.statechart.api.EventSink;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps machine names to the sinks that accept their events, for
 * {@code send} between instances. Thread-safe.
 */
public final class InstanceRegistry
{
    private final ConcurrentHashMap<String, EventSink> sinks = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if another sink is already registered under the name
     */
    public void register(String machineName, EventSink sink) {
        Objects.requireNonNull(machineName, "machineName");
        Objects.requireNonNull(sink, "sink");
        EventSink previous = sinks.putIfAbsent(machineName, sink);
        if (previous != null && previous != sink) {
            throw new IllegalStateException("Machine already registered: " + machineName);
        }
    }

    public void unregister(String machineName) {
        sinks.remove(machineName);
    }

    public Optional<EventSink> lookup(String machineName) {
        return Optional.ofNullable(sinks.get(machineName));
    }

    public Set<String> names() {
        return Set.copyOf(sinks.keySet());
    }
}
