package org.dfasim.automata.simulation;

import org.dfasim.automata.base.State;

import java.util.Objects;
import java.util.Optional;

/**
 * 求值结果。成功时携带接受/拒绝判定和完整轨迹；
 * 输入含未知符号时只携带 {@link UnknownSymbol}，没有轨迹。
 */
public final class EvaluationResult {

    private final boolean accepted;
    private final Trace trace;
    private final UnknownSymbol unknownSymbol;

    private EvaluationResult(boolean accepted, Trace trace, UnknownSymbol unknownSymbol) {
        this.accepted = accepted;
        this.trace = trace;
        this.unknownSymbol = unknownSymbol;
    }

    static EvaluationResult completed(boolean accepted, Trace trace) {
        return new EvaluationResult(accepted, Objects.requireNonNull(trace, "Trace cannot be null."), null);
    }

    static EvaluationResult aborted(UnknownSymbol unknownSymbol) {
        return new EvaluationResult(false, null, Objects.requireNonNull(unknownSymbol, "UnknownSymbol cannot be null."));
    }

    /**
     * @return 输入是否全部由字母表符号组成、求值是否跑完。
     */
    public boolean isCompleted() {
        return trace != null;
    }

    /**
     * 仅当求值跑完且终止状态为接受状态时为 true。
     */
    public boolean isAccepted() {
        return accepted;
    }

    public Optional<Trace> getTrace() {
        return Optional.ofNullable(trace);
    }

    public Optional<UnknownSymbol> getUnknownSymbol() {
        return Optional.ofNullable(unknownSymbol);
    }

    public Optional<State> getFinalState() {
        return getTrace().map(Trace::getFinalState);
    }

    @Override
    public String toString() {
        if (!isCompleted()) {
            return "EvaluationResult(" + unknownSymbol + ")";
        }
        return "EvaluationResult(" + (accepted ? "ACCEPTED" : "REJECTED") + ", " + trace + ")";
    }
}
