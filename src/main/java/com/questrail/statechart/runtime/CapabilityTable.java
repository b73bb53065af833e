package com.questrail.statechart.runtime;

import com.questrail.statechart.model.Machine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CapabilityTable
 * -----------------------------------------------------------------------------
 * Binds extern guard and action names to host implementations.
 *
 * A machine refers to externs by name; the compiler interns each name into a
 * dense slot. When an instance is created, {@link #guardSlots(Machine)} and
 * {@link #actionSlots(Machine)} turn the bindings into arrays indexed by slot,
 * so the engine never looks a name up while dispatching. Every extern the
 * machine references must be bound; unused bindings are allowed.
 */
public final class CapabilityTable
{
    private static final CapabilityTable EMPTY = new CapabilityTable(Map.of(), Map.of());

    private final Map<String, GuardFunction> guards;
    private final Map<String, ActionProcedure> actions;

    private CapabilityTable(Map<String, GuardFunction> guards, Map<String, ActionProcedure> actions) {
        this.guards = Collections.unmodifiableMap(new LinkedHashMap<>(guards));
        this.actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions));
    }

    public static CapabilityTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public GuardFunction[] guardSlots(Machine machine) {
        List<String> names = machine.externGuards();
        GuardFunction[] slots = new GuardFunction[names.size()];
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < slots.length; i++) {
            slots[i] = guards.get(names.get(i));
            if (slots[i] == null) {
                missing.add(names.get(i));
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Unbound extern guard(s) for " + machine.name() + ": " + missing);
        }
        return slots;
    }

    public ActionProcedure[] actionSlots(Machine machine) {
        List<String> names = machine.externActions();
        ActionProcedure[] slots = new ActionProcedure[names.size()];
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < slots.length; i++) {
            slots[i] = actions.get(names.get(i));
            if (slots[i] == null) {
                missing.add(names.get(i));
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Unbound extern action(s) for " + machine.name() + ": " + missing);
        }
        return slots;
    }

    @Override
    public String toString() {
        return "CapabilityTable[guards=" + guards.keySet() + ", actions=" + actions.keySet() + "]";
    }

    public static final class Builder
    {
        private final Map<String, GuardFunction> guards = new LinkedHashMap<>();
        private final Map<String, ActionProcedure> actions = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder withGuard(String name, GuardFunction guard) {
            guards.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(guard, "guard"));
            return this;
        }

        public Builder withAction(String name, ActionProcedure action) {
            actions.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(action, "action"));
            return this;
        }

        public CapabilityTable build() {
            return new CapabilityTable(guards, actions);
        }
    }
}
