package com.questrail.statechart.simulation;

import com.questrail.statechart.api.Event;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Named, immutable script of {@link ScenarioStep}s run against a freshly
 * initialized instance.
 */
public final class Scenario
{
    private final String name;
    private final List<ScenarioStep> steps;

    private Scenario(String name, List<ScenarioStep> steps) {
        this.name = name;
        this.steps = List.copyOf(steps);
    }

    public static Builder named(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<ScenarioStep> steps() {
        return steps;
    }

    @Override
    public String toString() {
        return "Scenario[" + name + ", " + steps.size() + " steps]";
    }

    public static final class Builder
    {
        private final String name;
        private final List<ScenarioStep> steps = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder dispatch(String event, long... args) {
            steps.add(new ScenarioStep.Dispatch(Event.of(event, args)));
            return this;
        }

        public Builder enqueue(String event, long... args) {
            steps.add(new ScenarioStep.Enqueue(Event.of(event, args)));
            return this;
        }

        public Builder processNext() {
            steps.add(new ScenarioStep.ProcessNext());
            return this;
        }

        public Builder drain() {
            steps.add(new ScenarioStep.Drain());
            return this;
        }

        public Builder tick(long elapsedMillis) {
            steps.add(new ScenarioStep.Tick(elapsedMillis));
            return this;
        }

        public Builder step(ScenarioStep step) {
            steps.add(Objects.requireNonNull(step, "step"));
            return this;
        }

        public Scenario build() {
            return new Scenario(name, steps);
        }
    }
}
