package com.questrail.statechart.model;

import com.questrail.statechart.mapping.ArrayHandleIndex;
import com.questrail.statechart.mapping.HandleIndex;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Machine
 * -----------------------------------------------------------------------------
 * Name-resolved semantic model of one state machine: topology only.
 *
 * <h2>Role in the architecture</h2>
 * A {@code Machine} is produced once by {@link MachineBuilder} and is never
 * mutated afterwards. It is the common input of the compile-time analyzer and
 * of the runtime dispatcher. All computation (guards, actions) is referenced
 * by extern name and bound to functions only when an instance is created.
 *
 * <h2>Root</h2>
 * Handle {@code 0} is always the synthetic root vertex named after the
 * machine. It is a composite (one top-level region) or a parallel state
 * (several top-level regions) and is never the source or target of a
 * transition.
 */
public final class Machine
{
    public static final int ROOT = 0;

    private final String name;
    private final TargetConfig config;
    private final List<FieldDecl> contextFields;
    private final List<EventDecl> events;
    private final List<Vertex> vertices;
    private final List<Region> regions;
    private final List<Transition> transitions;
    private final List<String> externGuards;
    private final List<String> externActions;
    private final int timerSlots;

    private final HandleIndex<String> eventIndex;
    private final HandleIndex<String> contextIndex;
    private final HandleIndex<String> vertexUids;
    private final HandleIndex<String> transitionUids;
    private final HandleIndex<String> regionUids;

    Machine(String name,
            TargetConfig config,
            List<FieldDecl> contextFields,
            List<EventDecl> events,
            List<Vertex> vertices,
            List<Region> regions,
            List<Transition> transitions,
            List<String> externGuards,
            List<String> externActions) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = Objects.requireNonNull(config, "config");
        this.contextFields = List.copyOf(contextFields);
        this.events = List.copyOf(events);
        this.vertices = List.copyOf(vertices);
        this.regions = List.copyOf(regions);
        this.transitions = List.copyOf(transitions);
        this.externGuards = List.copyOf(externGuards);
        this.externActions = List.copyOf(externActions);
        this.timerSlots = (int) this.transitions.stream().filter(t -> t.timerSlot() >= 0).count();

        this.eventIndex = new ArrayHandleIndex<>(this.events.stream().map(EventDecl::name).toList());
        this.contextIndex = new ArrayHandleIndex<>(this.contextFields.stream().map(FieldDecl::name).toList());
        this.vertexUids = new ArrayHandleIndex<>(this.vertices.stream().map(Vertex::uid).toList());
        this.transitionUids = new ArrayHandleIndex<>(this.transitions.stream().map(Transition::uid).toList());
        this.regionUids = new ArrayHandleIndex<>(this.regions.stream().map(Region::uid).toList());
    }

    public String name() {
        return name;
    }

    public TargetConfig config() {
        return config;
    }

    public List<FieldDecl> contextFields() {
        return contextFields;
    }

    public List<EventDecl> events() {
        return events;
    }

    public List<Vertex> vertices() {
        return vertices;
    }

    public List<Region> regions() {
        return regions;
    }

    public List<Transition> transitions() {
        return transitions;
    }

    public Vertex vertex(int handle) {
        return vertices.get(handle);
    }

    public Region region(int handle) {
        return regions.get(handle);
    }

    public Transition transition(int handle) {
        return transitions.get(handle);
    }

    public EventDecl event(int handle) {
        return events.get(handle);
    }

    public Vertex root() {
        return vertices.get(ROOT);
    }

    /** Extern guard names in slot order. */
    public List<String> externGuards() {
        return externGuards;
    }

    /** Extern action names in slot order. */
    public List<String> externActions() {
        return externActions;
    }

    /** Number of timer slots, one per timed transition. */
    public int timerSlots() {
        return timerSlots;
    }

    /** Widest payload among all declared events. */
    public int maxPayloadWidth() {
        int w = 0;
        for (EventDecl e : events) {
            w = Math.max(w, e.width());
        }
        return w;
    }

    public Optional<EventDecl> findEvent(String eventName) {
        Objects.requireNonNull(eventName, "eventName");
        var handle = eventIndex.find(eventName);
        return handle.isPresent() ? Optional.of(events.get(handle.getAsInt())) : Optional.empty();
    }

    public EventDecl event(String eventName) {
        return findEvent(eventName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown event " + eventName + " in machine " + name));
    }

    /**
     * Handle of the named event.
     *
     * @throws IllegalArgumentException if the machine declares no such event
     */
    public int eventHandle(String eventName) {
        return eventIndex.handleOf(eventName);
    }

    public Optional<FieldDecl> findContextField(String fieldName) {
        var handle = contextIndex.find(fieldName);
        return handle.isPresent() ? Optional.of(contextFields.get(handle.getAsInt())) : Optional.empty();
    }

    public HandleIndex<String> vertexUids() {
        return vertexUids;
    }

    public HandleIndex<String> transitionUids() {
        return transitionUids;
    }

    /** Looks up a vertex by stable identifier. */
    public Vertex vertex(String uid) {
        return vertices.get(vertexUids.handleOf(uid));
    }

    /** Looks up a region by stable identifier. */
    public Region region(String uid) {
        return regions.get(regionUids.handleOf(uid));
    }

    /** Looks up a transition by stable identifier. */
    public Transition transition(String uid) {
        return transitions.get(transitionUids.handleOf(uid));
    }

    @Override
    public String toString() {
        return "Machine[" + name + ", vertices=" + vertices.size()
                + ", regions=" + regions.size()
                + ", transitions=" + transitions.size() + "]";
    }
}
