package com.questrail.statechart.runtime;

import com.questrail.statechart.analysis.HierarchyResolver;
import com.questrail.statechart.analysis.TransitionTable;
import com.questrail.statechart.analysis.ValidatedMachine;
import com.questrail.statechart.api.DispatchResult;
import com.questrail.statechart.api.EnqueueOutcome;
import com.questrail.statechart.api.Event;
import com.questrail.statechart.api.EventSink;
import com.questrail.statechart.api.FatalFaultException;
import com.questrail.statechart.api.Fault;
import com.questrail.statechart.api.FaultKind;
import com.questrail.statechart.api.StatechartInstance;
import com.questrail.statechart.model.Action;
import com.questrail.statechart.model.EventDecl;
import com.questrail.statechart.model.FieldDecl;
import com.questrail.statechart.model.FieldRef;
import com.questrail.statechart.model.Guard;
import com.questrail.statechart.model.Machine;
import com.questrail.statechart.model.Region;
import com.questrail.statechart.model.TargetConfig;
import com.questrail.statechart.model.TimerDelivery;
import com.questrail.statechart.model.Transition;
import com.questrail.statechart.model.TransitionKind;
import com.questrail.statechart.model.ValueExpr;
import com.questrail.statechart.model.Vertex;
import com.questrail.statechart.model.VertexKind;
import com.questrail.statechart.observability.NullTraceSink;
import com.questrail.statechart.observability.TraceRecord;
import com.questrail.statechart.observability.TraceSink;
import com.questrail.statechart.time.TimerAdapter;
import com.questrail.statechart.time.TimerHandles;
import com.questrail.statechart.time.VirtualTimerAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * DispatchEngine
 * =============================================================================
 * Run-to-completion interpreter for one instance of a validated machine.
 *
 * <h2>Step</h2>
 * One call to {@link #processNext()} takes one event (or timer expiry) from
 * the queue and runs it to completion:
 * <ol>
 *   <li>{@code SELECTING}: every active leaf, in lexicographic order of region
 *       path, contributes the first enabled candidate after hierarchical
 *       override. Junction, entry-point and exit-point chains are resolved
 *       here, so a chain with no enabled branch does not enable its
 *       transition. Of two selected transitions whose exits overlap, the one
 *       with the deeper source fires.</li>
 *   <li>{@code EXECUTING}: per selected transition, exits innermost first up
 *       to the transition's scope, then transition actions in segment order,
 *       then entries outermost first. Choice branches are evaluated after the
 *       preceding segment's actions ran.</li>
 *   <li>{@code RESOLVING_COMPLETIONS}: completion events synthesized during
 *       the step are processed in FIFO order before the step ends.</li>
 * </ol>
 * When nothing fires and an active state defers the event, it is held and
 * re-inserted at the front of the queue, oldest first, after the first step
 * that leaves it undeferred.
 *
 * <h2>Ordering across regions</h2>
 * Regions of a state are visited in lexicographic order of their names, for
 * exits, entries and fork branches alike.
 *
 * <h2>Faults</h2>
 * Non-fatal faults (queue rejection, unknown {@code send} target) are
 * reported in the {@link DispatchResult} and to the {@link TraceSink}. Fatal
 * faults throw {@link FatalFaultException} and halt the instance; every later
 * call except introspection throws {@link IllegalStateException}.
 *
 * <h2>Storage</h2>
 * Configuration, history, join arrivals, completions, the queue, the deferral
 * buffer, timer slots and selection scratch are all sized here, at creation.
 * The step itself allocates only for results and, when a trace sink is
 * installed, for trace records.
 *
 * <h2>Threading</h2>
 * Not thread-safe apart from {@link #enqueue(Event)} and timer expiries
 * delivered by a real-time adapter, which only touch the queue.
 */
public final class DispatchEngine implements StatechartInstance
{
    private static final Logger log = LoggerFactory.getLogger(DispatchEngine.class);

    /** Completion events processed in one step before the chain is declared runaway. */
    public static final int MAX_COMPLETIONS = 100;

    private static final int HOLD = -2;
    private static final long[] NO_PAYLOAD = new long[0];

    private final ValidatedMachine validated;
    private final Machine machine;
    private final HierarchyResolver hierarchy;
    private final TransitionTable table;
    private final TargetConfig config;
    private final GuardFunction[] guards;
    private final ActionProcedure[] procedures;
    private final TimerAdapter timerAdapter;
    private final InstanceRegistry registry;
    private final TraceSink trace;
    private final boolean tracing;

    private final Context context;
    private final Payload payload = new Payload();
    private final ActiveConfiguration active;
    private final BoundedEventQueue queue;
    private final TimerTable timers;

    // precomputed per vertex / transition
    private final int[][] timedSlots;
    private final int[][] joinFeeds;
    private final int[] joinPosition;
    private final int[] joinArity;
    private final int[][] regionHistories;
    private final int[][] forkBranches;

    private final QueuedEvent[] held;
    private final boolean[] released;
    private int heldCount;

    // step scratch
    private final QueuedEvent current;
    private final int[] leaves;
    private final int[] selected;
    private final int[] selectedEnd;
    private final int[] selectedLength;
    private final int[][] routes;
    private final int[] chain;
    private final long[] raiseArgs;
    private int routeEnd;

    private final List<String> fired = new ArrayList<>();
    private final List<String> executed = new ArrayList<>();
    private List<String> before = List.of();
    private long[] stepPayload = NO_PAYLOAD;
    private String stepLabel;
    private Fault stepFault;
    private boolean deferCurrent;

    private DispatchPhase phase = DispatchPhase.IDLE;
    private boolean initialized;
    private volatile boolean halted;
    private boolean inTick;
    private List<DispatchResult> tickResults;
    private int completions;
    private long sequence;

    private DispatchEngine(Builder b) {
        this.validated = b.machine;
        this.machine = validated.machine();
        this.hierarchy = validated.hierarchy();
        this.table = validated.table();
        this.config = machine.config();
        this.guards = b.capabilities.guardSlots(machine);
        this.procedures = b.capabilities.actionSlots(machine);
        this.timerAdapter = b.timers;
        this.registry = b.registry;
        this.trace = b.trace;
        this.tracing = !(trace instanceof NullTraceSink);

        int vertices = machine.vertices().size();
        int regions = machine.regions().size();
        int transitions = machine.transitions().size();
        int width = machine.maxPayloadWidth();

        this.context = new Context(machine);
        this.active = new ActiveConfiguration(machine);
        this.queue = new BoundedEventQueue(machine.name(), config.queueCapacity(), config.overflowPolicy(), width);
        this.timers = new TimerTable(machine);

        this.timedSlots = new int[vertices][];
        this.joinFeeds = new int[vertices][];
        this.joinArity = new int[vertices];
        this.forkBranches = new int[vertices][];
        this.joinPosition = new int[transitions];
        Arrays.fill(joinPosition, -1);
        for (Vertex v : machine.vertices()) {
            int[] out = v.outgoing();
            timedSlots[v.index()] = Arrays.stream(out)
                    .filter(t -> machine.transition(t).timerSlot() >= 0)
                    .map(t -> machine.transition(t).timerSlot())
                    .toArray();
            joinFeeds[v.index()] = Arrays.stream(out)
                    .filter(t -> isJoin(machine.transition(t).target()))
                    .toArray();
            if (v.kind() == VertexKind.JOIN) {
                int[] in = v.incoming();
                joinArity[v.index()] = in.length;
                for (int i = 0; i < in.length; i++) {
                    joinPosition[in[i]] = i;
                }
            } else if (v.kind() == VertexKind.FORK) {
                forkBranches[v.index()] = Arrays.stream(out)
                        .boxed()
                        .sorted(Comparator.comparing((Integer t) -> regionOrderKey(machine.transition(t).target())))
                        .mapToInt(Integer::intValue)
                        .toArray();
            }
        }
        this.regionHistories = new int[regions][];
        for (Region r : machine.regions()) {
            regionHistories[r.index()] = Arrays.stream(r.members())
                    .filter(m -> machine.vertex(m).kind().isHistory())
                    .toArray();
        }

        int capacity = config.queueCapacity();
        this.held = new QueuedEvent[capacity];
        for (int i = 0; i < capacity; i++) {
            held[i] = new QueuedEvent(width);
        }
        this.released = new boolean[capacity];

        this.current = new QueuedEvent(width);
        this.leaves = new int[regions];
        this.selected = new int[regions];
        this.selectedEnd = new int[regions];
        this.selectedLength = new int[regions];
        this.routes = new int[Math.max(1, regions)][transitions + 1];
        this.chain = new int[transitions + 1];
        this.raiseArgs = new long[width];

        timerAdapter.attach(this::onExpiry, machine.timerSlots());
        registry.register(machine.name(), this);
    }

    private boolean isJoin(int vertex) {
        return vertex >= 0 && machine.vertex(vertex).kind() == VertexKind.JOIN;
    }

    /** Sort key placing a fork target by the name path of the regions above it. */
    private String regionOrderKey(int vertex) {
        StringBuilder sb = new StringBuilder();
        for (int v : hierarchy.path(vertex)) {
            int r = machine.vertex(v).parentRegion();
            if (r >= 0) {
                sb.append(machine.region(r).name()).append('\u0000');
            }
        }
        return sb.toString();
    }

    public static Builder builder(ValidatedMachine machine) {
        return new Builder(machine);
    }

    // ---------------------------------------------------------------------
    // StatechartInstance
    // ---------------------------------------------------------------------

    @Override
    public String machineName() {
        return machine.name();
    }

    @Override
    public EnqueueOutcome enqueue(Event event) {
        Objects.requireNonNull(event, "event");
        if (halted) {
            throw new IllegalStateException(machine.name() + " is halted");
        }
        int index = machine.eventHandle(event.name());
        EventDecl decl = machine.event(index);
        if (event.width() != decl.width()) {
            throw new IllegalArgumentException("Event " + decl.name() + " carries " + decl.width()
                    + " field(s), got " + event.width());
        }
        for (FieldDecl f : decl.fields()) {
            if (!f.type().contains(event.arg(f.index()))) {
                throw new IllegalArgumentException("Value " + event.arg(f.index()) + " outside " + f.type()
                        + " of " + decl.name() + "." + f.name());
            }
        }
        try {
            return queue.offer(index, event);
        } catch (FatalFaultException ex) {
            halt(ex.fault());
            throw ex;
        }
    }

    @Override
    public DispatchResult dispatch(Event event) {
        ensureRunnable();
        EnqueueOutcome outcome = enqueue(event);
        if (outcome == EnqueueOutcome.REJECTED) {
            Fault fault = new Fault(FaultKind.QUEUE_OVERFLOW, machine.name(),
                    "Queue full; rejected " + event.name());
            trace.onFault(machine.name(), fault);
            return DispatchResult.rejected(event.name(), fault);
        }
        return processNext();
    }

    @Override
    public DispatchResult init() {
        if (initialized) {
            throw new IllegalStateException(machine.name() + " is already initialized");
        }
        if (halted) {
            throw new IllegalStateException(machine.name() + " is halted");
        }
        initialized = true;
        beginStep("init");
        try {
            phase = DispatchPhase.EXECUTING;
            Vertex root = machine.root();
            for (int i = 0; i < root.regionCount(); i++) {
                enterRegion(root.region(i));
            }
            phase = DispatchPhase.RESOLVING_COMPLETIONS;
            resolveCompletions();
            DispatchResult result = endStep(true);
            log.info("{} initialized in {}", machine.name(), activeLeaves());
            return result;
        } catch (FatalFaultException ex) {
            halt(ex.fault());
            throw ex;
        } finally {
            phase = DispatchPhase.IDLE;
            payload.clear();
        }
    }

    @Override
    public DispatchResult processNext() {
        ensureRunnable();
        if (!queue.poll(current)) {
            return DispatchResult.idle();
        }
        return step(current);
    }

    @Override
    public int drain() {
        int steps = 0;
        while (!queue.isEmpty()) {
            processNext();
            steps++;
        }
        return steps;
    }

    @Override
    public List<DispatchResult> tick(long elapsedMillis) {
        ensureRunnable();
        if (!(timerAdapter instanceof VirtualTimerAdapter virtual)) {
            throw new IllegalStateException(machine.name() + " is not driven by a virtual clock");
        }
        List<DispatchResult> results = new ArrayList<>();
        tickResults = results;
        inTick = true;
        try {
            virtual.advance(elapsedMillis);
        } finally {
            inTick = false;
            tickResults = null;
        }
        return List.copyOf(results);
    }

    private void ensureRunnable() {
        if (halted) {
            throw new IllegalStateException(machine.name() + " is halted");
        }
        if (!initialized) {
            throw new IllegalStateException(machine.name() + " is not initialized");
        }
        if (phase != DispatchPhase.IDLE) {
            throw new IllegalStateException(machine.name() + " is already processing (" + phase + ")");
        }
    }

    // ---------------------------------------------------------------------
    // Step
    // ---------------------------------------------------------------------

    private DispatchResult step(QueuedEvent ev) {
        beginStep(null);
        try {
            boolean consumed = ev.isTimer() ? timerStep(ev) : eventStep(ev);
            phase = DispatchPhase.RESOLVING_COMPLETIONS;
            resolveCompletions();
            releaseDeferred();
            return endStep(consumed);
        } catch (FatalFaultException ex) {
            halt(ex.fault());
            throw ex;
        } finally {
            phase = DispatchPhase.IDLE;
            payload.clear();
        }
    }

    private void beginStep(String label) {
        fired.clear();
        executed.clear();
        stepFault = null;
        stepLabel = label;
        stepPayload = NO_PAYLOAD;
        completions = 0;
        deferCurrent = false;
        active.clearCompletions();
        if (tracing) {
            before = activeLeaves();
        }
    }

    private DispatchResult endStep(boolean consumed) {
        sequence++;
        DispatchResult result = new DispatchResult(stepLabel, consumed, fired, Optional.ofNullable(stepFault));
        if (tracing) {
            trace.onStep(new TraceRecord(sequence, machine.name(), stepLabel, stepPayload,
                    before, activeLeaves(), fired, executed));
        }
        return result;
    }

    private boolean eventStep(QueuedEvent ev) {
        EventDecl decl = machine.event(ev.event);
        payload.bind(decl, ev.args);
        stepLabel = decl.name();
        if (tracing) {
            stepPayload = payload.snapshot();
        }

        phase = DispatchPhase.SELECTING;
        int n = select(ev.event);
        if (n == 0) {
            if (deferredByActive(ev.event)) {
                hold(ev);
                return false;
            }
            return true;
        }

        phase = DispatchPhase.EXECUTING;
        for (int k = 0; k < n; k++) {
            if (active.isActive(machine.transition(selected[k]).source())) {
                execute(routes[k], selectedLength[k], selectedEnd[k]);
            }
        }
        if (deferCurrent) {
            hold(ev);
            return false;
        }
        return true;
    }

    private boolean timerStep(QueuedEvent ev) {
        long handle = ev.timerHandle;
        int slot = TimerHandles.slot(handle);
        if (!timers.isCurrent(handle)) {
            stepLabel = "timer(stale)";
            return false;
        }
        Transition t = machine.transition(timers.transition(slot));
        stepLabel = "timer(" + t.uid() + ")";
        if (!ev.rearmed) {
            rearmOrExpire(slot, t);
        }
        if (!active.isActive(t.source())) {
            return true;
        }

        phase = DispatchPhase.SELECTING;
        if (!guardHolds(t)) {
            return true;
        }
        int len = resolveRoute(t.index(), routes[0]);
        if (len < 0) {
            return true;
        }
        phase = DispatchPhase.EXECUTING;
        execute(routes[0], len, routeEnd);
        return true;
    }

    // ---------------------------------------------------------------------
    // Selection
    // ---------------------------------------------------------------------

    private int select(int event) {
        int count = active.leaves(leaves);
        int n = 0;
        for (int i = 0; i < count; i++) {
            int[] candidates = table.candidates(leaves[i], event);
            for (int t : candidates) {
                if (contains(selected, n, t)) {
                    break;
                }
                Transition tr = machine.transition(t);
                if (!guardHolds(tr)) {
                    continue;
                }
                int len = resolveRoute(t, routes[n]);
                if (len < 0) {
                    continue;
                }
                n = admit(n, t, len);
                break;
            }
        }
        return n;
    }

    /**
     * Adds a selected transition unless it conflicts with one already
     * selected. Of two conflicting transitions the one with the deeper source
     * is kept; at equal depth the earlier region wins.
     */
    private int admit(int n, int t, int len) {
        int end = routeEnd;
        Transition tr = machine.transition(t);
        for (int k = 0; k < n; k++) {
            Transition other = machine.transition(selected[k]);
            if (!conflicts(tr, end, len, other, selectedEnd[k], selectedLength[k])) {
                continue;
            }
            if (hierarchy.depth(tr.source()) <= hierarchy.depth(other.source())) {
                return n;
            }
            // replace the shallower transition, keeping region order
            System.arraycopy(routes[n], 0, routes[k], 0, len);
            selected[k] = t;
            selectedEnd[k] = end;
            selectedLength[k] = len;
            return n;
        }
        selected[n] = t;
        selectedEnd[n] = end;
        selectedLength[n] = len;
        return n + 1;
    }

    private boolean conflicts(Transition a, int aEnd, int aLen, Transition b, int bEnd, int bLen) {
        int ra = exitedRegion(a, aEnd, aLen);
        int rb = exitedRegion(b, bEnd, bLen);
        return (ra >= 0 && inRegion(ra, b.source())) || (rb >= 0 && inRegion(rb, a.source()));
    }

    /** Region whose content a transition exits, or {@code -1} if it exits nothing. */
    private int exitedRegion(Transition t, int end, int len) {
        if (!t.hasTarget() || t.kind() == TransitionKind.INTERNAL || end < 0 || isJoin(end)) {
            return -1;
        }
        int scope = scopeOf(t, end, len);
        return hierarchy.regionContaining(scope, scope == t.source() ? end : t.source());
    }

    private boolean inRegion(int region, int vertex) {
        int owner = machine.region(region).owner();
        return hierarchy.regionContaining(owner, vertex) == region;
    }

    private static boolean contains(int[] values, int n, int value) {
        for (int i = 0; i < n; i++) {
            if (values[i] == value) {
                return true;
            }
        }
        return false;
    }

    /**
     * Follows junction, entry-point and exit-point segments from transition
     * {@code t}, choosing the first enabled branch at each, and writes the
     * segments into {@code route}. The final vertex is left in
     * {@link #routeEnd}.
     *
     * @return the number of segments, or {@code -1} if some pseudostate on the
     *         chain has no enabled branch
     */
    private int resolveRoute(int t, int[] route) {
        int len = 0;
        int segment = t;
        while (true) {
            if (len == route.length) {
                return -1;
            }
            route[len++] = segment;
            Transition tr = machine.transition(segment);
            if (!tr.hasTarget()) {
                routeEnd = -1;
                return len;
            }
            Vertex target = machine.vertex(tr.target());
            if (!target.kind().isStaticChain()) {
                routeEnd = target.index();
                return len;
            }
            segment = firstEnabled(table.branches(target.index()));
            if (segment < 0) {
                return -1;
            }
        }
    }

    private int firstEnabled(int[] branches) {
        for (int b : branches) {
            if (guardHolds(machine.transition(b))) {
                return b;
            }
        }
        return -1;
    }

    // ---------------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------------

    private void execute(int[] route, int len, int end) {
        Transition first = machine.transition(route[0]);
        for (int i = 0; i < len; i++) {
            fired.add(machine.transition(route[i]).uid());
        }
        if (!first.hasTarget() || first.kind() == TransitionKind.INTERNAL) {
            runActions(first.actions(), first.uid());
            return;
        }
        if (isJoin(end)) {
            arrive(route, len, end);
            return;
        }
        int source = first.source();
        int scope = scopeOf(first, end, len);
        int exited = hierarchy.regionContaining(scope, scope == source ? end : source);
        exitRegion(exited);
        runRoute(route, len);
        continueFrom(scope, exited, end);
    }

    /**
     * State whose region the compound transition exits and re-enters. A
     * single local segment keeps its own scope; any other transition uses the
     * lowest state that holds the source and every final target in one
     * region.
     */
    private int scopeOf(Transition first, int end, int len) {
        int source = first.source();
        Vertex e = machine.vertex(end);
        if (len == 1 && e.kind() != VertexKind.FORK) {
            return hierarchy.scope(first);
        }
        int scope = hierarchy.lca(source, end);
        if (e.kind() == VertexKind.FORK) {
            for (int b : forkBranches[end]) {
                scope = widen(scope, source, machine.transition(b).target());
            }
        }
        return scope;
    }

    /** Raises {@code scope} until {@code a} and {@code b} lie below it in one region. */
    private int widen(int scope, int a, int b) {
        int s = scope;
        while (!hierarchy.isAncestor(s, b)
                || hierarchy.regionContaining(s, a) != hierarchy.regionContaining(s, b)) {
            s = hierarchy.parent(s);
        }
        return s;
    }

    private void runRoute(int[] route, int len) {
        for (int i = 0; i < len; i++) {
            Transition tr = machine.transition(route[i]);
            runActions(tr.actions(), tr.uid());
        }
    }

    private void continueFrom(int scope, int exitedRegion, int end) {
        Vertex e = machine.vertex(end);
        if (end == scope) {
            enterRegion(exitedRegion);
        } else if (e.kind() == VertexKind.CHOICE) {
            enterTowards(scope, end);
            resolveChoice(end);
        } else if (e.kind() == VertexKind.FORK) {
            enterFork(scope, end);
        } else {
            enter(scope, end);
        }
    }

    private void resolveChoice(int choice) {
        int c = choice;
        while (true) {
            int b = firstEnabled(table.branches(c));
            int len = b < 0 ? -1 : resolveRoute(b, chain);
            if (len < 0) {
                throw fatal(FaultKind.NO_ENABLED_BRANCH, machine.vertex(c).uid(),
                        "No branch of choice is enabled", null);
            }
            int end = routeEnd;
            for (int i = 0; i < len; i++) {
                fired.add(machine.transition(chain[i]).uid());
            }
            int scope = scopeOf(machine.transition(b), end, 2);
            int exited = hierarchy.regionContaining(scope, c);
            exitRegion(exited);
            runRoute(chain, len);
            if (machine.vertex(end).kind() == VertexKind.CHOICE) {
                enterTowards(scope, end);
                c = end;
                continue;
            }
            continueFrom(scope, exited, end);
            return;
        }
    }

    private void arrive(int[] route, int len, int join) {
        BitSet arrivals = active.arrivals[join];
        int last = route[len - 1];
        if (joinPosition[last] >= 0) {
            arrivals.set(joinPosition[last]);
        }
        runRoute(route, len);
        if (arrivals.cardinality() == joinArity[join]) {
            fireJoin(join, machine.transition(route[0]).source());
        }
    }

    private void fireJoin(int join, int anySource) {
        int b = firstEnabled(table.branches(join));
        int len = b < 0 ? -1 : resolveRoute(b, chain);
        if (len < 0) {
            return;
        }
        int end = routeEnd;
        for (int i = 0; i < len; i++) {
            fired.add(machine.transition(chain[i]).uid());
        }
        int scope = widen(hierarchy.lca(anySource, end), anySource, end);
        int exited = hierarchy.regionContaining(scope, anySource);
        exitRegion(exited);
        active.arrivals[join].clear();
        runRoute(chain, len);
        continueFrom(scope, exited, end);
    }

    // ---------------------------------------------------------------------
    // Exit
    // ---------------------------------------------------------------------

    private void exitRegion(int region) {
        if (region < 0) {
            return;
        }
        int c = active.cursor[region];
        if (c < 0) {
            return;
        }
        if (machine.vertex(c).isState()) {
            exitState(c);
        } else {
            active.cursor[region] = -1;
        }
    }

    private void exitState(int state) {
        Vertex v = machine.vertex(state);
        for (int i = 0; i < v.regionCount(); i++) {
            for (int h : regionHistories[v.region(i)]) {
                active.recordHistory(h);
            }
        }
        for (int i = 0; i < v.regionCount(); i++) {
            exitRegion(v.region(i));
        }
        runActions(v.exitActions(), v.uid());
        cancelTimers(state);
        for (int t : joinFeeds[state]) {
            active.arrivals[machine.transition(t).target()].clear(joinPosition[t]);
        }
        active.cursor[v.parentRegion()] = -1;
    }

    // ---------------------------------------------------------------------
    // Entry
    // ---------------------------------------------------------------------

    /** Enters {@code target} from {@code scope}, which must be a proper ancestor. */
    private void enter(int scope, int target) {
        int top = direct(scope, target);
        enterRegion(machine.vertex(top).parentRegion());
    }

    /** Enters the states between {@code scope} and a choice, leaving the choice's region inactive. */
    private void enterTowards(int scope, int choice) {
        int top = direct(scope, choice);
        active.directive[machine.vertex(choice).parentRegion()] = HOLD;
        enterRegion(machine.vertex(top).parentRegion());
    }

    private void enterFork(int scope, int fork) {
        int[] branches = forkBranches[fork];
        for (int b : branches) {
            Transition tr = machine.transition(b);
            fired.add(tr.uid());
            runActions(tr.actions(), tr.uid());
        }
        int top = -1;
        for (int b : branches) {
            top = direct(scope, machine.transition(b).target());
        }
        enterRegion(machine.vertex(top).parentRegion());
    }

    /**
     * Sets entry directives on every region from {@code target} up to the
     * region of {@code scope} and returns the child of {@code scope} on the path.
     */
    private int direct(int scope, int target) {
        int v = target;
        while (true) {
            Vertex vx = machine.vertex(v);
            active.directive[vx.parentRegion()] = v;
            int parent = hierarchy.parent(v);
            if (parent == scope) {
                return v;
            }
            v = parent;
        }
    }

    private void enterRegion(int region) {
        int d = active.directive[region];
        active.directive[region] = -1;
        if (d == HOLD) {
            return;
        }
        if (d < 0) {
            Region r = machine.region(region);
            Transition init = machine.transition(machine.vertex(r.initial()).outgoing(0));
            runActions(init.actions(), init.uid());
            d = directWithin(region, init.target());
        }
        enterVertex(region, d);
    }

    /** Like {@link #direct} but bounded by a region; returns the member of the region on the path. */
    private int directWithin(int region, int target) {
        int v = target;
        while (machine.vertex(v).parentRegion() != region) {
            active.directive[machine.vertex(v).parentRegion()] = v;
            v = hierarchy.parent(v);
        }
        return v;
    }

    private void enterVertex(int region, int vertex) {
        Vertex v = machine.vertex(vertex);
        VertexKind kind = v.kind();
        if (kind.isState()) {
            enterState(vertex);
        } else if (kind == VertexKind.FINAL) {
            active.cursor[region] = vertex;
            regionFinished(region);
        } else if (kind.isHistory()) {
            enterHistory(region, vertex);
        } else {
            // pseudostate reached by a default transition; stays inside the region
            int b = firstEnabled(table.branches(vertex));
            if (b < 0) {
                throw fatal(FaultKind.NO_ENABLED_BRANCH, v.uid(), "No branch of " + kind + " is enabled", null);
            }
            Transition tr = machine.transition(b);
            runActions(tr.actions(), tr.uid());
            enterVertex(region, directWithin(region, tr.target()));
        }
    }

    private void enterState(int state) {
        Vertex v = machine.vertex(state);
        active.cursor[v.parentRegion()] = state;
        runActions(v.entryActions(), v.uid());
        armTimers(state);
        for (int i = 0; i < v.regionCount(); i++) {
            enterRegion(v.region(i));
        }
        if (v.regionCount() == 0 && table.completions(state).length > 0) {
            queueCompletion(state);
        }
    }

    private void enterHistory(int region, int history) {
        Vertex h = machine.vertex(history);
        if (!active.hasHistory(history)) {
            if (h.outgoingCount() > 0) {
                Transition tr = machine.transition(h.outgoing(0));
                runActions(tr.actions(), tr.uid());
                enterVertex(region, directWithin(region, tr.target()));
            } else {
                enterRegion(region);
            }
            return;
        }
        if (h.kind() == VertexKind.HISTORY_DEEP) {
            active.restoreDirectives(history);
            enterRegion(region);
            return;
        }
        int child = active.shallowHistory(history);
        if (child < 0) {
            enterRegion(region);
        } else {
            enterVertex(region, child);
        }
    }

    private void regionFinished(int region) {
        int owner = machine.region(region).owner();
        if (!active.allRegionsFinal(owner)) {
            return;
        }
        if (owner == Machine.ROOT) {
            log.info("{} terminated", machine.name());
            return;
        }
        if (table.completions(owner).length > 0) {
            queueCompletion(owner);
        }
    }

    // ---------------------------------------------------------------------
    // Completions
    // ---------------------------------------------------------------------

    private void queueCompletion(int state) {
        if (active.offerCompletion(state) && ++completions > MAX_COMPLETIONS) {
            throw fatal(FaultKind.COMPLETION_OVERFLOW, machine.vertex(state).uid(),
                    "More than " + MAX_COMPLETIONS + " chained completion events", null);
        }
    }

    private void resolveCompletions() {
        payload.clear();
        int s;
        while ((s = active.pollCompletion()) >= 0) {
            if (!active.isActive(s)) {
                continue;
            }
            if (machine.vertex(s).regionCount() > 0 && !active.allRegionsFinal(s)) {
                continue;
            }
            for (int t : table.completions(s)) {
                if (!guardHolds(machine.transition(t))) {
                    continue;
                }
                int len = resolveRoute(t, routes[0]);
                if (len >= 0) {
                    execute(routes[0], len, routeEnd);
                    break;
                }
            }
        }
    }

    // ---------------------------------------------------------------------
    // Deferral
    // ---------------------------------------------------------------------

    private boolean deferredByActive(int event) {
        int n = active.leaves(leaves);
        for (int i = 0; i < n; i++) {
            for (int v = leaves[i]; v >= 0; v = hierarchy.parent(v)) {
                if (machine.vertex(v).defers(event)) {
                    return true;
                }
            }
        }
        return false;
    }

    private void hold(QueuedEvent ev) {
        if (heldCount == held.length) {
            switch (config.overflowPolicy()) {
                case DROP_OLDEST:
                    for (int i = 1; i < heldCount; i++) {
                        held[i - 1].copyFrom(held[i]);
                    }
                    heldCount--;
                    break;
                case DROP_NEWEST:
                    return;
                case ERROR:
                    noteFault(new Fault(FaultKind.QUEUE_OVERFLOW, machine.name(), "Deferral buffer full"));
                    return;
                default:
                    throw fatal(FaultKind.QUEUE_ASSERTION, machine.name(), "Deferral buffer full", null);
            }
        }
        held[heldCount++].copyFrom(ev);
    }

    private void releaseDeferred() {
        if (heldCount == 0) {
            return;
        }
        for (int i = heldCount - 1; i >= 0; i--) {
            released[i] = false;
            if (deferredByActive(held[i].event)) {
                continue;
            }
            EnqueueOutcome outcome = queue.pushFront(held[i]);
            if (outcome == EnqueueOutcome.REJECTED) {
                noteFault(new Fault(FaultKind.QUEUE_OVERFLOW, machine.name(),
                        "Queue full; deferred " + machine.event(held[i].event).name() + " stays held"));
                continue;
            }
            released[i] = true;
        }
        int kept = 0;
        for (int i = 0; i < heldCount; i++) {
            if (!released[i]) {
                if (kept != i) {
                    held[kept].copyFrom(held[i]);
                }
                kept++;
            }
        }
        heldCount = kept;
    }

    // ---------------------------------------------------------------------
    // Timers
    // ---------------------------------------------------------------------

    private void armTimers(int state) {
        for (int slot : timedSlots[state]) {
            Transition t = machine.transition(timers.transition(slot));
            long handle = timers.arm(slot);
            timerAdapter.start(handle, t.delayMillis());
        }
    }

    private void cancelTimers(int state) {
        for (int slot : timedSlots[state]) {
            if (timers.isArmed(slot)) {
                timerAdapter.cancel(timers.handle(slot));
            }
            timers.cancel(slot);
        }
    }

    private void rearmOrExpire(int slot, Transition t) {
        if (t.kind() == TransitionKind.TIMED_PERIODIC) {
            long handle = timers.arm(slot);
            timerAdapter.start(handle, t.delayMillis());
        } else {
            timers.expired(slot);
        }
    }

    /**
     * Expiry callback. With a virtual clock it runs inside {@link #tick} on
     * the owning thread; otherwise it may run on any thread and only queues
     * the expiry.
     */
    private void onExpiry(long handle, long deadlineMillis) {
        if (halted) {
            return;
        }
        if (!inTick) {
            EnqueueOutcome outcome;
            try {
                outcome = queue.offerTimer(handle, false);
            } catch (FatalFaultException ex) {
                halt(ex.fault());
                return;
            }
            if (!outcome.stored()) {
                log.warn("{} timer expiry {} not queued: {}", machine.name(), handle, outcome);
            }
            return;
        }
        if (!timers.isCurrent(handle)) {
            return;
        }
        int slot = TimerHandles.slot(handle);
        Transition t = machine.transition(timers.transition(slot));
        rearmOrExpire(slot, t);
        if (config.timerDelivery() == TimerDelivery.DIRECT) {
            current.setTimer(handle, true);
            tickResults.add(step(current));
            return;
        }
        EnqueueOutcome outcome = queue.offerTimer(handle, true);
        if (outcome == EnqueueOutcome.REJECTED) {
            Fault fault = new Fault(FaultKind.QUEUE_OVERFLOW, machine.name(),
                    "Queue full; timer expiry at " + deadlineMillis + " rejected");
            trace.onFault(machine.name(), fault);
            tickResults.add(DispatchResult.rejected("timer(" + t.uid() + ")", fault));
        }
    }

    // ---------------------------------------------------------------------
    // Guards and actions
    // ---------------------------------------------------------------------

    private boolean guardHolds(Transition t) {
        return evaluate(t.guard());
    }

    private boolean evaluate(Guard g) {
        if (g instanceof Guard.Constant c) {
            return c.value();
        }
        if (g instanceof Guard.Compare c) {
            return c.op().test(read(c.field()), c.literal().encoded());
        }
        if (g instanceof Guard.And a) {
            return evaluate(a.left()) && evaluate(a.right());
        }
        if (g instanceof Guard.Or o) {
            return evaluate(o.left()) || evaluate(o.right());
        }
        if (g instanceof Guard.Not n) {
            return !evaluate(n.operand());
        }
        Guard.ExternRef e = (Guard.ExternRef) g;
        try {
            return guards[e.slot()].test(context, payload);
        } catch (RuntimeException ex) {
            throw fatal(FaultKind.EXTERN_FAILURE, e.name(), "Extern guard failed: " + ex, ex);
        }
    }

    private long read(FieldRef f) {
        return f.scope() == FieldRef.Scope.CONTEXT ? context.get(f.index()) : payload.get(f.index());
    }

    private long value(ValueExpr expr, String owner) {
        if (expr instanceof ValueExpr.Const c) {
            return c.value();
        }
        if (expr instanceof ValueExpr.Ref r) {
            return read(r.field());
        }
        ValueExpr.Binary b = (ValueExpr.Binary) expr;
        long left = value(b.left(), owner);
        long right = value(b.right(), owner);
        try {
            return b.op().apply(left, right);
        } catch (ArithmeticException ex) {
            throw fatal(FaultKind.ARITHMETIC, owner, b + ": " + ex.getMessage(), ex);
        }
    }

    private void runActions(List<Action> actions, String owner) {
        for (int i = 0; i < actions.size(); i++) {
            Action a = actions.get(i);
            if (tracing) {
                executed.add(owner + ": " + a.describe());
            }
            perform(a, owner);
        }
    }

    private void perform(Action a, String owner) {
        if (a instanceof Action.Call c) {
            try {
                procedures[c.slot()].run(context, payload);
            } catch (RuntimeException ex) {
                throw fatal(FaultKind.EXTERN_FAILURE, owner, "Extern action " + c.name() + " failed: " + ex, ex);
            }
        } else if (a instanceof Action.Assign as) {
            long v = value(as.value(), owner);
            int field = as.target().index();
            if (!context.accepts(field, v)) {
                throw fatal(FaultKind.DOMAIN_VIOLATION, owner,
                        "Value " + v + " outside " + context.decl(field).type() + " of " + as.target(), null);
            }
            context.set(field, v);
        } else if (a instanceof Action.Raise r) {
            raise(r, owner);
        } else if (a instanceof Action.Send s) {
            send(s, owner);
        } else if (a instanceof Action.Defer d) {
            if (current.event == d.eventIndex() && !current.isTimer()) {
                deferCurrent = true;
            }
        }
    }

    private void raise(Action.Raise r, String owner) {
        EventDecl decl = machine.event(r.eventIndex());
        for (int i = 0; i < decl.width(); i++) {
            long v = value(r.args().get(i), owner);
            if (!decl.fields().get(i).type().contains(v)) {
                throw fatal(FaultKind.DOMAIN_VIOLATION, owner,
                        "Value " + v + " outside " + decl.fields().get(i).type() + " of " + decl.name(), null);
            }
            raiseArgs[i] = v;
        }
        EnqueueOutcome outcome = queue.offer(r.eventIndex(), raiseArgs, decl.width());
        if (outcome == EnqueueOutcome.REJECTED) {
            noteFault(new Fault(FaultKind.QUEUE_OVERFLOW, owner, "Queue full; raise " + decl.name() + " rejected"));
        }
    }

    private void send(Action.Send s, String owner) {
        Optional<EventSink> target = registry.lookup(s.machine());
        if (target.isEmpty()) {
            noteFault(new Fault(FaultKind.UNKNOWN_MACHINE, owner, "No instance registered as " + s.machine()));
            return;
        }
        long[] args = new long[s.args().size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = value(s.args().get(i), owner);
        }
        EnqueueOutcome outcome;
        try {
            outcome = target.get().enqueue(Event.of(s.event(), args));
        } catch (RuntimeException ex) {
            throw fatal(FaultKind.EXTERN_FAILURE, owner, "send to " + s.machine() + " failed: " + ex, ex);
        }
        if (outcome == EnqueueOutcome.REJECTED) {
            noteFault(new Fault(FaultKind.QUEUE_OVERFLOW, owner,
                    "Queue of " + s.machine() + " full; send " + s.event() + " rejected"));
        }
    }

    // ---------------------------------------------------------------------
    // Faults
    // ---------------------------------------------------------------------

    private FatalFaultException fatal(FaultKind kind, String subject, String message, Throwable cause) {
        Fault fault = new Fault(kind, subject, message);
        return cause == null ? new FatalFaultException(fault) : new FatalFaultException(fault, cause);
    }

    private void noteFault(Fault fault) {
        if (stepFault == null) {
            stepFault = fault;
        }
        trace.onFault(machine.name(), fault);
    }

    private void halt(Fault fault) {
        if (halted) {
            return;
        }
        halted = true;
        for (int slot = 0; slot < timers.slots(); slot++) {
            if (timers.isArmed(slot)) {
                timerAdapter.cancel(timers.handle(slot));
            }
        }
        log.error("{} halted: {}", machine.name(), fault);
        trace.onFault(machine.name(), fault);
    }

    // ---------------------------------------------------------------------
    // Introspection
    // ---------------------------------------------------------------------

    public ValidatedMachine validatedMachine() {
        return validated;
    }

    public Context context() {
        return context;
    }

    public ActiveConfiguration configuration() {
        return active;
    }

    public DispatchPhase phase() {
        return phase;
    }

    public BoundedEventQueue queue() {
        return queue;
    }

    public TimerAdapter timerAdapter() {
        return timerAdapter;
    }

    @Override
    public Optional<String> activeChild(String regionUid) {
        int c = active.activeChild(machine.region(regionUid).index());
        return c < 0 ? Optional.empty() : Optional.of(machine.vertex(c).uid());
    }

    @Override
    public List<String> activeLeaves() {
        int[] buf = new int[machine.regions().size()];
        int n = active.leaves(buf);
        return uids(buf, n);
    }

    @Override
    public List<String> activeStates() {
        int[] buf = new int[machine.vertices().size()];
        int n = active.states(buf);
        return uids(buf, n);
    }

    private List<String> uids(int[] handles, int n) {
        List<String> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(machine.vertex(handles[i]).uid());
        }
        return out;
    }

    @Override
    public boolean isActive(String vertexUid) {
        return active.isActive(machine.vertex(vertexUid).index());
    }

    @Override
    public List<String> history(String historyUid) {
        Vertex h = machine.vertex(historyUid);
        if (!h.kind().isHistory()) {
            throw new IllegalArgumentException(historyUid + " is not a history pseudostate");
        }
        if (!active.hasHistory(h.index())) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        if (h.kind() == VertexKind.HISTORY_SHALLOW) {
            int child = active.shallowHistory(h.index());
            if (child >= 0) {
                out.add(machine.vertex(child).uid());
            }
        } else {
            collectDeepHistory(h.index(), h.parentRegion(), out);
        }
        return out;
    }

    private void collectDeepHistory(int history, int region, List<String> out) {
        int c = active.deepHistory(history, region);
        if (c < 0) {
            return;
        }
        Vertex v = machine.vertex(c);
        if (v.regionCount() == 0) {
            out.add(v.uid());
            return;
        }
        for (int i = 0; i < v.regionCount(); i++) {
            collectDeepHistory(history, v.region(i), out);
        }
    }

    @Override
    public int queueOccupancy() {
        return queue.size();
    }

    @Override
    public int deferredCount() {
        return heldCount;
    }

    @Override
    public List<String> armedTimers() {
        return IntStream.range(0, timers.slots())
                .filter(timers::isArmed)
                .mapToObj(slot -> machine.transition(timers.transition(slot)).uid())
                .toList();
    }

    @Override
    public boolean isTerminated() {
        return active.allRegionsFinal(Machine.ROOT);
    }

    public boolean isInitialized() {
        return initialized;
    }

    @Override
    public boolean isHalted() {
        return halted;
    }

    @Override
    public String toString() {
        return "DispatchEngine[" + machine.name() + ", phase=" + phase
                + (halted ? ", halted" : "") + ", queue=" + queue.size() + "/" + queue.capacity() + "]";
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder
    {
        private final ValidatedMachine machine;
        private CapabilityTable capabilities = CapabilityTable.empty();
        private TimerAdapter timers;
        private InstanceRegistry registry;
        private TraceSink trace = NullTraceSink.INSTANCE;

        private Builder(ValidatedMachine machine) {
            this.machine = Objects.requireNonNull(machine, "machine");
        }

        public Builder withCapabilities(CapabilityTable capabilities) {
            this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
            return this;
        }

        /** Defaults to a fresh {@link VirtualTimerAdapter}. */
        public Builder withTimers(TimerAdapter timers) {
            this.timers = Objects.requireNonNull(timers, "timers");
            return this;
        }

        /** Registry the instance joins under its machine name; defaults to a private one. */
        public Builder withRegistry(InstanceRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry");
            return this;
        }

        public Builder withTrace(TraceSink trace) {
            this.trace = Objects.requireNonNull(trace, "trace");
            return this;
        }

        public DispatchEngine build() {
            if (timers == null) {
                timers = new VirtualTimerAdapter();
            }
            if (registry == null) {
                registry = new InstanceRegistry();
            }
            return new DispatchEngine(this);
        }
    }
}
