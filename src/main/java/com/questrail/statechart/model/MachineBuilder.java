package com.questrail.statechart.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * MachineBuilder
 * -----------------------------------------------------------------------------
 * Programmatic front end producing a name-resolved {@link Machine}.
 *
 * <h2>Role in the architecture</h2>
 * The builder stands in for the parser and name resolver of the DSL. It
 * assembles the region tree, interns extern names into dense slots and
 * resolves every field, event and extern reference to a handle. It performs
 * <em>no</em> semantic validation beyond name resolution: duplicate names,
 * missing initials, nondeterministic guards and the like are left in the model
 * for the analyzer to report.
 *
 * <h2>Containment</h2>
 * States added to a composite without naming a region go into the composite's
 * single implicit region ({@value #DEFAULT_REGION}). Parallel states always
 * require explicitly named regions.
 *
 * <pre>
 *   MachineBuilder b = MachineBuilder.machine("Motor");
 *   b.event("START", FieldDecl.of("speed", FieldType.range(0, 100)));
 *   VertexRef idle = b.state("Idle");
 *   VertexRef running = b.state("Running");
 *   b.initial(b.root(), idle);
 *   b.transition(idle, running).on("START").when(Guards.gt(Guards.payload("speed"), 0));
 *   Machine m = b.build();
 * </pre>
 */
public final class MachineBuilder
{
    public static final String DEFAULT_REGION = "main";

    private final String name;
    private TargetConfig config = TargetConfig.defaults();
    private final List<FieldDecl> contextFields = new ArrayList<>();
    private final List<EventDecl> events = new ArrayList<>();
    private final List<VertexSpec> vertices = new ArrayList<>();
    private final List<RegionSpec> regions = new ArrayList<>();
    private final List<TransitionSpec> transitions = new ArrayList<>();

    public MachineBuilder(String name) {
        this.name = Objects.requireNonNull(name, "name");
        vertices.add(new VertexSpec(Machine.ROOT, name, VertexKind.COMPOSITE, -1, name));
    }

    public static MachineBuilder machine(String name) {
        return new MachineBuilder(name);
    }

    public MachineBuilder config(TargetConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        return this;
    }

    public VertexRef root() {
        return ref(Machine.ROOT);
    }

    // ---------------------------------------------------------------------
    // Declarations
    // ---------------------------------------------------------------------

    public MachineBuilder context(String fieldName, FieldType type) {
        Objects.requireNonNull(fieldName, "fieldName");
        for (FieldDecl f : contextFields) {
            if (f.name().equals(fieldName)) {
                throw new IllegalArgumentException("Duplicate context field: " + fieldName);
            }
        }
        contextFields.add(new FieldDecl(fieldName, type, contextFields.size()));
        return this;
    }

    public MachineBuilder event(String eventName, FieldDecl... payload) {
        Objects.requireNonNull(eventName, "eventName");
        for (EventDecl e : events) {
            if (e.name().equals(eventName)) {
                throw new IllegalArgumentException("Duplicate event: " + eventName);
            }
        }
        List<FieldDecl> fields = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (FieldDecl f : payload) {
            if (!seen.add(f.name())) {
                throw new IllegalArgumentException("Duplicate payload field " + f.name() + " in event " + eventName);
            }
            fields.add(f.at(fields.size()));
        }
        events.add(new EventDecl(eventName, events.size(), fields));
        return this;
    }

    // ---------------------------------------------------------------------
    // Containment
    // ---------------------------------------------------------------------

    /** Adds a named region to a composite, parallel or root state. */
    public RegionRef region(VertexRef owner, String regionName) {
        VertexSpec o = spec(owner);
        if (o.kind.isPseudostate()) {
            throw new IllegalArgumentException("Pseudostate " + o.name + " cannot own regions");
        }
        int r = newRegion(o.index, regionName);
        return new RegionRef(r, regionName);
    }

    /** Adds a simple state to the root's implicit region. */
    public VertexRef state(String stateName) {
        return state(root(), stateName);
    }

    public VertexRef state(VertexRef parent, String stateName) {
        return ref(addVertex(implicitRegion(parent.handle()), stateName, VertexKind.SIMPLE));
    }

    public VertexRef state(RegionRef region, String stateName) {
        return ref(addVertex(region.handle(), stateName, VertexKind.SIMPLE));
    }

    public VertexRef parallel(String stateName) {
        return parallel(root(), stateName);
    }

    public VertexRef parallel(VertexRef parent, String stateName) {
        return ref(addVertex(implicitRegion(parent.handle()), stateName, VertexKind.PARALLEL));
    }

    public VertexRef parallel(RegionRef region, String stateName) {
        return ref(addVertex(region.handle(), stateName, VertexKind.PARALLEL));
    }

    /**
     * Declares the initial pseudostate of a state's implicit region together
     * with its (single) outgoing transition.
     */
    public TransitionSpec initial(VertexRef parent, VertexRef target) {
        int region = implicitRegion(parent.handle());
        return initialIn(region, target);
    }

    public TransitionSpec initial(RegionRef region, VertexRef target) {
        return initialIn(region.handle(), target);
    }

    private TransitionSpec initialIn(int region, VertexRef target) {
        int v = addVertex(region, "initial", VertexKind.INITIAL);
        return newTransition(TransitionKind.EXTERNAL, v, target.handle());
    }

    public VertexRef finalState(VertexRef parent, String finalName) {
        return ref(addVertex(implicitRegion(parent.handle()), finalName, VertexKind.FINAL));
    }

    public VertexRef finalState(RegionRef region, String finalName) {
        return ref(addVertex(region.handle(), finalName, VertexKind.FINAL));
    }

    public VertexRef choice(VertexRef parent, String choiceName) {
        return pseudo(parent, choiceName, VertexKind.CHOICE);
    }

    public VertexRef choice(RegionRef region, String choiceName) {
        return ref(addVertex(region.handle(), choiceName, VertexKind.CHOICE));
    }

    public VertexRef junction(VertexRef parent, String junctionName) {
        return pseudo(parent, junctionName, VertexKind.JUNCTION);
    }

    public VertexRef junction(RegionRef region, String junctionName) {
        return ref(addVertex(region.handle(), junctionName, VertexKind.JUNCTION));
    }

    public VertexRef fork(VertexRef parent, String forkName) {
        return pseudo(parent, forkName, VertexKind.FORK);
    }

    public VertexRef fork(RegionRef region, String forkName) {
        return ref(addVertex(region.handle(), forkName, VertexKind.FORK));
    }

    public VertexRef join(VertexRef parent, String joinName) {
        return pseudo(parent, joinName, VertexKind.JOIN);
    }

    public VertexRef join(RegionRef region, String joinName) {
        return ref(addVertex(region.handle(), joinName, VertexKind.JOIN));
    }

    public VertexRef shallowHistory(VertexRef parent) {
        return pseudo(parent, "H", VertexKind.HISTORY_SHALLOW);
    }

    public VertexRef shallowHistory(RegionRef region) {
        return ref(addVertex(region.handle(), "H", VertexKind.HISTORY_SHALLOW));
    }

    public VertexRef deepHistory(VertexRef parent) {
        return pseudo(parent, "H*", VertexKind.HISTORY_DEEP);
    }

    public VertexRef deepHistory(RegionRef region) {
        return ref(addVertex(region.handle(), "H*", VertexKind.HISTORY_DEEP));
    }

    /**
     * Declares an entry point of a composite. It is placed in the composite's
     * first region; transitions into it continue along its outgoing transition.
     */
    public VertexRef entryPoint(VertexRef composite, String pointName) {
        return ref(addVertex(firstRegion(composite.handle()), pointName, VertexKind.ENTRY_POINT));
    }

    /**
     * Declares an exit point of a composite. Transitions from inside the
     * composite into it continue along its outgoing transition.
     */
    public VertexRef exitPoint(VertexRef composite, String pointName) {
        return ref(addVertex(firstRegion(composite.handle()), pointName, VertexKind.EXIT_POINT));
    }

    private VertexRef pseudo(VertexRef parent, String pseudoName, VertexKind kind) {
        return ref(addVertex(implicitRegion(parent.handle()), pseudoName, kind));
    }

    // ---------------------------------------------------------------------
    // State behavior
    // ---------------------------------------------------------------------

    public MachineBuilder onEntry(VertexRef state, Action... actions) {
        spec(state).entry.addAll(Arrays.asList(actions));
        return this;
    }

    public MachineBuilder onExit(VertexRef state, Action... actions) {
        spec(state).exit.addAll(Arrays.asList(actions));
        return this;
    }

    public MachineBuilder defer(VertexRef state, String... eventNames) {
        spec(state).deferred.addAll(Arrays.asList(eventNames));
        return this;
    }

    /** Overrides the stable identifier of a vertex (defaults to its qualified path). */
    public MachineBuilder uid(VertexRef vertex, String uid) {
        spec(vertex).uid = Objects.requireNonNull(uid, "uid");
        return this;
    }

    // ---------------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------------

    public TransitionSpec transition(VertexRef source, VertexRef target) {
        return newTransition(TransitionKind.EXTERNAL, source.handle(), target.handle());
    }

    public TransitionSpec local(VertexRef source, VertexRef target) {
        return newTransition(TransitionKind.LOCAL, source.handle(), target.handle());
    }

    public TransitionSpec internal(VertexRef source) {
        return newTransition(TransitionKind.INTERNAL, source.handle(), -1);
    }

    public TransitionSpec completion(VertexRef source, VertexRef target) {
        return newTransition(TransitionKind.COMPLETION, source.handle(), target.handle());
    }

    /** One-shot timed transition, armed on entry to {@code source}. */
    public TransitionSpec after(VertexRef source, long delayMillis, VertexRef target) {
        TransitionSpec t = newTransition(TransitionKind.TIMED_ONE_SHOT, source.handle(), target.handle());
        t.delayMillis = delayMillis;
        return t;
    }

    /** Periodic targetless timed transition. */
    public TransitionSpec every(VertexRef source, long periodMillis) {
        TransitionSpec t = newTransition(TransitionKind.TIMED_PERIODIC, source.handle(), -1);
        t.delayMillis = periodMillis;
        return t;
    }

    /** Periodic timed transition with a target. */
    public TransitionSpec every(VertexRef source, long periodMillis, VertexRef target) {
        TransitionSpec t = newTransition(TransitionKind.TIMED_PERIODIC, source.handle(), target.handle());
        t.delayMillis = periodMillis;
        return t;
    }

    private TransitionSpec newTransition(TransitionKind kind, int source, int target) {
        checkHandle(source);
        if (target >= 0) {
            checkHandle(target);
        }
        TransitionSpec t = new TransitionSpec(transitions.size(), kind, source, target);
        transitions.add(t);
        return t;
    }

    /**
     * Fluent description of one transition.
     */
    public static final class TransitionSpec
    {
        private final int index;
        private final TransitionKind kind;
        private final int source;
        private final int target;
        private String trigger;
        private Guard guard = Guard.TRUE;
        private final List<Action> actions = new ArrayList<>();
        private int priority = Transition.DEFAULT_PRIORITY;
        private boolean explicitPriority;
        private long delayMillis;
        private String uid;

        private TransitionSpec(int index, TransitionKind kind, int source, int target) {
            this.index = index;
            this.kind = kind;
            this.source = source;
            this.target = target;
        }

        public TransitionSpec on(String event) {
            this.trigger = Objects.requireNonNull(event, "event");
            return this;
        }

        public TransitionSpec when(Guard guard) {
            this.guard = Objects.requireNonNull(guard, "guard");
            return this;
        }

        public TransitionSpec then(Action... effects) {
            actions.addAll(Arrays.asList(effects));
            return this;
        }

        public TransitionSpec priority(int priority) {
            this.priority = priority;
            this.explicitPriority = true;
            return this;
        }

        public TransitionSpec uid(String uid) {
            this.uid = Objects.requireNonNull(uid, "uid");
            return this;
        }

        /** Handle of the transition in the built machine. */
        public int handle() {
            return index;
        }
    }

    // ---------------------------------------------------------------------
    // Build
    // ---------------------------------------------------------------------

    /**
     * Resolves all names and produces the immutable model.
     *
     * @throws IllegalArgumentException if a field, event or extern cannot be resolved
     * @throws IllegalStateException    if the machine has no top-level region
     */
    public Machine build() {
        VertexSpec rootSpec = vertices.get(Machine.ROOT);
        if (rootSpec.regions.isEmpty()) {
            throw new IllegalStateException("Machine " + name + " declares no states");
        }

        Map<String, Integer> eventsByName = new HashMap<>();
        for (EventDecl e : events) {
            eventsByName.put(e.name(), e.index());
        }
        Map<String, FieldDecl> contextByName = new HashMap<>();
        for (FieldDecl f : contextFields) {
            contextByName.put(f.name(), f);
        }
        Resolver resolver = new Resolver(eventsByName, contextByName);

        // Outgoing / incoming adjacency in declaration order.
        List<List<Integer>> outgoing = new ArrayList<>();
        List<List<Integer>> incoming = new ArrayList<>();
        for (int i = 0; i < vertices.size(); i++) {
            outgoing.add(new ArrayList<>());
            incoming.add(new ArrayList<>());
        }
        for (TransitionSpec t : transitions) {
            outgoing.get(t.source).add(t.index);
            if (t.target >= 0) {
                incoming.get(t.target).add(t.index);
            }
        }

        List<String> vertexUids = uniqueUids(vertices.stream().map(v -> v.uid != null ? v.uid : v.path).toList());

        List<Vertex> builtVertices = new ArrayList<>(vertices.size());
        for (VertexSpec v : vertices) {
            VertexKind kind = v.kind;
            if (v.index == Machine.ROOT) {
                kind = v.regions.size() > 1 ? VertexKind.PARALLEL : VertexKind.COMPOSITE;
            } else if (kind == VertexKind.SIMPLE && !v.regions.isEmpty()) {
                kind = VertexKind.COMPOSITE;
            }

            int[] ownedRegions = v.regions.stream()
                    .sorted((a, b) -> regions.get(a).name.compareTo(regions.get(b).name))
                    .mapToInt(Integer::intValue)
                    .toArray();

            int[] deferred = v.deferred.stream().mapToInt(resolver::event).distinct().toArray();

            builtVertices.add(new Vertex(
                    v.index,
                    v.name,
                    vertexUids.get(v.index),
                    kind,
                    v.parentRegion,
                    ownedRegions,
                    toArray(outgoing.get(v.index)),
                    toArray(incoming.get(v.index)),
                    v.entry.stream().map(a -> resolver.action(a, null)).toList(),
                    v.exit.stream().map(a -> resolver.action(a, null)).toList(),
                    deferred));
        }

        List<Region> builtRegions = new ArrayList<>(regions.size());
        List<String> regionUids = uniqueUids(regions.stream().map(r -> r.path).toList());
        for (RegionSpec r : regions) {
            int[] initials = r.members.stream()
                    .filter(m -> vertices.get(m).kind == VertexKind.INITIAL)
                    .mapToInt(Integer::intValue)
                    .toArray();
            builtRegions.add(new Region(r.index, r.name, regionUids.get(r.index), r.owner, toArray(r.members), initials));
        }

        Map<Integer, Integer> perSourceOrdinal = new HashMap<>();
        List<String> defaultTransitionUids = new ArrayList<>();
        for (TransitionSpec t : transitions) {
            int ordinal = perSourceOrdinal.merge(t.source, 1, Integer::sum);
            defaultTransitionUids.add(t.uid != null ? t.uid : vertices.get(t.source).path + "#" + ordinal);
        }
        List<String> transitionUids = uniqueUids(defaultTransitionUids);

        List<Transition> builtTransitions = new ArrayList<>(transitions.size());
        int timerSlot = 0;
        for (TransitionSpec t : transitions) {
            int trigger = t.trigger == null ? -1 : resolver.event(t.trigger);
            EventDecl payloadScope = trigger >= 0 ? events.get(trigger) : null;
            int slot = t.kind.isTimed() ? timerSlot++ : -1;
            builtTransitions.add(new Transition(
                    t.index,
                    transitionUids.get(t.index),
                    t.kind,
                    t.source,
                    t.target,
                    trigger,
                    resolver.guard(t.guard, payloadScope),
                    t.actions.stream().map(a -> resolver.action(a, payloadScope)).toList(),
                    t.priority,
                    t.explicitPriority,
                    t.delayMillis,
                    slot));
        }

        return new Machine(
                name,
                config,
                contextFields,
                events,
                builtVertices,
                builtRegions,
                builtTransitions,
                List.copyOf(resolver.guardSlots.keySet()),
                List.copyOf(resolver.actionSlots.keySet()));
    }

    // ---------------------------------------------------------------------
    // Name resolution
    // ---------------------------------------------------------------------

    private final class Resolver
    {
        private final Map<String, Integer> eventsByName;
        private final Map<String, FieldDecl> contextByName;
        private final Map<String, Integer> guardSlots = new LinkedHashMap<>();
        private final Map<String, Integer> actionSlots = new LinkedHashMap<>();

        private Resolver(Map<String, Integer> eventsByName, Map<String, FieldDecl> contextByName) {
            this.eventsByName = eventsByName;
            this.contextByName = contextByName;
        }

        int event(String eventName) {
            Integer e = eventsByName.get(eventName);
            if (e == null) {
                throw new IllegalArgumentException("Unknown event " + eventName + " in machine " + name);
            }
            return e;
        }

        FieldRef field(FieldRef ref, EventDecl payloadScope) {
            if (ref.scope() == FieldRef.Scope.CONTEXT) {
                FieldDecl decl = contextByName.get(ref.name());
                if (decl == null) {
                    throw new IllegalArgumentException("Unknown context field " + ref.name());
                }
                return ref.resolve(decl);
            }
            if (payloadScope == null) {
                throw new IllegalArgumentException(
                        "Payload field " + ref.name() + " referenced where no triggering event is in scope");
            }
            FieldDecl decl = payloadScope.field(ref.name())
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Event " + payloadScope.name() + " has no payload field " + ref.name()));
            return ref.resolve(decl);
        }

        Guard guard(Guard g, EventDecl payloadScope) {
            if (g instanceof Guard.Constant) {
                return g;
            }
            if (g instanceof Guard.ExternRef e) {
                int slot = guardSlots.computeIfAbsent(e.name(), k -> guardSlots.size());
                return new Guard.ExternRef(e.name(), slot);
            }
            if (g instanceof Guard.Not n) {
                return new Guard.Not(guard(n.operand(), payloadScope));
            }
            if (g instanceof Guard.And a) {
                return new Guard.And(guard(a.left(), payloadScope), guard(a.right(), payloadScope));
            }
            if (g instanceof Guard.Or o) {
                return new Guard.Or(guard(o.left(), payloadScope), guard(o.right(), payloadScope));
            }
            Guard.Compare c = (Guard.Compare) g;
            FieldRef field = field(c.field(), payloadScope);
            Literal literal = c.literal();
            if (literal instanceof Literal.EnumLiteral el) {
                int ordinal = field.type() instanceof FieldType.Enumeration en ? en.ordinalOf(el.variant()) : -1;
                literal = new Literal.EnumLiteral(el.variant(), ordinal);
            }
            return new Guard.Compare(field, c.op(), literal);
        }

        ValueExpr value(ValueExpr v, EventDecl payloadScope) {
            if (v instanceof ValueExpr.Ref r) {
                return new ValueExpr.Ref(field(r.field(), payloadScope));
            }
            if (v instanceof ValueExpr.Binary b) {
                return new ValueExpr.Binary(b.op(), value(b.left(), payloadScope), value(b.right(), payloadScope));
            }
            return v;
        }

        Action action(Action a, EventDecl payloadScope) {
            if (a instanceof Action.Call c) {
                int slot = actionSlots.computeIfAbsent(c.name(), k -> actionSlots.size());
                return new Action.Call(c.name(), slot);
            }
            if (a instanceof Action.Raise r) {
                return new Action.Raise(r.event(), event(r.event()), values(r.args(), payloadScope));
            }
            if (a instanceof Action.Send s) {
                return new Action.Send(s.machine(), s.event(), values(s.args(), payloadScope));
            }
            if (a instanceof Action.Defer d) {
                return new Action.Defer(d.event(), event(d.event()));
            }
            Action.Assign as = (Action.Assign) a;
            if (as.target().scope() != FieldRef.Scope.CONTEXT) {
                throw new IllegalArgumentException("Event payload is read-only: " + as.target());
            }
            return new Action.Assign(field(as.target(), payloadScope), value(as.value(), payloadScope));
        }

        private List<ValueExpr> values(List<ValueExpr> args, EventDecl payloadScope) {
            return args.stream().map(v -> value(v, payloadScope)).toList();
        }
    }

    // ---------------------------------------------------------------------
    // Internal assembly helpers
    // ---------------------------------------------------------------------

    private static final class VertexSpec
    {
        private final int index;
        private final String name;
        private final VertexKind kind;
        private final int parentRegion;
        private final String path;
        private final List<Integer> regions = new ArrayList<>();
        private final List<Action> entry = new ArrayList<>();
        private final List<Action> exit = new ArrayList<>();
        private final List<String> deferred = new ArrayList<>();
        private String uid;

        private VertexSpec(int index, String name, VertexKind kind, int parentRegion, String path) {
            this.index = index;
            this.name = name;
            this.kind = kind;
            this.parentRegion = parentRegion;
            this.path = path;
        }
    }

    private static final class RegionSpec
    {
        private final int index;
        private final String name;
        private final int owner;
        private final String path;
        private final List<Integer> members = new ArrayList<>();

        private RegionSpec(int index, String name, int owner, String path) {
            this.index = index;
            this.name = name;
            this.owner = owner;
            this.path = path;
        }
    }

    private int addVertex(int region, String vertexName, VertexKind kind) {
        Objects.requireNonNull(vertexName, "name");
        RegionSpec r = regions.get(region);
        VertexSpec owner = vertices.get(r.owner);
        String prefix = DEFAULT_REGION.equals(r.name) ? owner.path + "." : owner.path + "." + r.name + ".";
        VertexSpec v = new VertexSpec(vertices.size(), vertexName, kind, region, prefix + vertexName);
        vertices.add(v);
        r.members.add(v.index);
        return v.index;
    }

    private int newRegion(int owner, String regionName) {
        Objects.requireNonNull(regionName, "regionName");
        VertexSpec o = vertices.get(owner);
        RegionSpec r = new RegionSpec(regions.size(), regionName, owner, o.path + "/" + regionName);
        regions.add(r);
        o.regions.add(r.index);
        return r.index;
    }

    private int implicitRegion(int owner) {
        checkHandle(owner);
        VertexSpec o = vertices.get(owner);
        if (o.kind.isPseudostate()) {
            throw new IllegalArgumentException("Pseudostate " + o.name + " cannot contain vertices");
        }
        if (o.kind == VertexKind.PARALLEL) {
            throw new IllegalArgumentException("Parallel state " + o.name + " requires an explicit region");
        }
        if (o.regions.isEmpty()) {
            return newRegion(owner, DEFAULT_REGION);
        }
        if (o.regions.size() == 1) {
            return o.regions.get(0);
        }
        throw new IllegalArgumentException("State " + o.name + " has several regions; name one explicitly");
    }

    private int firstRegion(int owner) {
        checkHandle(owner);
        VertexSpec o = vertices.get(owner);
        if (o.regions.isEmpty()) {
            return implicitRegion(owner);
        }
        return o.regions.stream()
                .min((a, b) -> regions.get(a).name.compareTo(regions.get(b).name))
                .orElseThrow();
    }

    private VertexSpec spec(VertexRef ref) {
        checkHandle(ref.handle());
        return vertices.get(ref.handle());
    }

    private VertexRef ref(int handle) {
        return new VertexRef(handle, vertices.get(handle).name);
    }

    private void checkHandle(int handle) {
        if (handle < 0 || handle >= vertices.size()) {
            throw new IllegalArgumentException("Unknown vertex handle " + handle);
        }
    }

    private static int[] toArray(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Keeps identifiers stable while guaranteeing uniqueness; collisions (which
     * the analyzer reports as duplicate names) get a positional suffix.
     */
    private static List<String> uniqueUids(List<String> candidates) {
        Set<String> seen = new HashSet<>();
        List<String> out = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            String uid = candidates.get(i);
            if (!seen.add(uid)) {
                uid = uid + "~" + i;
                seen.add(uid);
            }
            out.add(uid);
        }
        return out;
    }
}
