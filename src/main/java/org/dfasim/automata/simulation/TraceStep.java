package org.dfasim.automata.simulation;

import lombok.Getter;
import org.dfasim.automata.base.State;
import org.dfasim.automata.base.Symbol;

import java.util.Objects;
import java.util.Optional;

/**
 * 轨迹中的一步：读入符号之后所处的状态。第一步没有读入符号。
 */
public final class TraceStep {

    @Getter
    private final State state;
    private final Symbol consumed;

    TraceStep(State state, Symbol consumed) {
        this.state = Objects.requireNonNull(state, "State cannot be null.");
        this.consumed = consumed;
    }

    public Optional<Symbol> getConsumed() {
        return Optional.ofNullable(consumed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TraceStep that = (TraceStep) o;
        return state.equals(that.state) && Objects.equals(consumed, that.consumed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, consumed);
    }

    @Override
    public String toString() {
        return consumed == null ? "(" + state + ")" : "-" + consumed + "-> (" + state + ")";
    }
}
