package org.dfasim.automata.simulation;

import lombok.Getter;
import org.dfasim.automata.base.State;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 一次求值的完整轨迹，只读。
 * 长度恒为输入长度 + 1，第一步是初始状态。
 */
public final class Trace {

    @Getter
    private final List<TraceStep> steps;

    Trace(List<TraceStep> steps) {
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("A trace always starts with the start state");
        }
        this.steps = List.copyOf(steps);
    }

    public int size() {
        return steps.size();
    }

    public State getFinalState() {
        return steps.get(steps.size() - 1).getState();
    }

    /**
     * 依次访问过的状态，包括初始状态。
     */
    public List<State> getStates() {
        return steps.stream().map(TraceStep::getState).collect(Collectors.toUnmodifiableList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return steps.equals(((Trace) o).steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }

    @Override
    public String toString() {
        return steps.stream().map(TraceStep::toString).collect(Collectors.joining(" "));
    }
}
