package org.dfasim.automata.models;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.dfasim.automata.base.Alphabet;
import org.dfasim.automata.base.State;
import org.dfasim.automata.base.Symbol;
import org.dfasim.automata.base.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 代表一个确定有限自动机 (Deterministic Finite Automaton, DFA) 的五元组 (Q, Σ, q₀, F, δ)。
 * 此类是不可变的：一旦创建，任何求值或枚举都不会修改它。编辑定义应产生新的实例。
 * <p>
 * 迁移函数 δ 是全函数：对 Q × Σ 中的每一对都有且只有一个目标状态。
 * 用户输入应先经过 {@link org.dfasim.automata.validation.Validator}，它会收集全部错误；
 * 此处的检查只用于拦截编程错误。
 */
public final class AutomatonDefinition {

    private static final Logger logger = LoggerFactory.getLogger(AutomatonDefinition.class);

    @Getter
    private final Set<State> states;              // Q，保留声明顺序
    @Getter
    private final Alphabet alphabet;              // Σ
    @Getter
    private final State start;                    // q₀
    @Getter
    private final Set<State> accepting;           // F
    private final Map<Pair<State, Symbol>, State> delta; // δ

    private final int hashCode;

    private AutomatonDefinition(Set<State> states, Alphabet alphabet, State start, Set<State> accepting,
                                Map<Pair<State, Symbol>, State> delta) {
        this.states = states;
        this.alphabet = alphabet;
        this.start = start;
        this.accepting = accepting;
        this.delta = delta;
        this.hashCode = Objects.hash(Set.copyOf(states), alphabet, start, Set.copyOf(accepting), delta);
    }

    /**
     * 构造一个 DFA。
     *
     * @param states      状态集合（按迭代顺序作为声明顺序）。
     * @param alphabet    字母表。
     * @param start       初始状态。
     * @param accepting   接受状态集合。
     * @param transitions 迁移集合，必须覆盖 Q × Σ 的每一对且不冲突。
     * @return 新的 AutomatonDefinition 实例。
     * @throws IllegalArgumentException 如果违反任一不变量。
     */
    public static AutomatonDefinition of(Collection<State> states, Alphabet alphabet, State start,
                                         Collection<State> accepting, Collection<Transition> transitions) {
        Objects.requireNonNull(states, "States cannot be null.");
        Objects.requireNonNull(alphabet, "Alphabet cannot be null.");
        Objects.requireNonNull(start, "Start state cannot be null.");
        Objects.requireNonNull(accepting, "Accepting states cannot be null.");
        Objects.requireNonNull(transitions, "Transitions cannot be null.");

        Set<State> stateSet = new LinkedHashSet<>(states);
        if (stateSet.size() != states.size()) {
            throw new IllegalArgumentException("Duplicate state labels.");
        }
        if (stateSet.isEmpty()) {
            throw new IllegalArgumentException("A DFA needs at least one state.");
        }
        if (alphabet.size() == 0) {
            throw new IllegalArgumentException("A DFA needs at least one symbol.");
        }
        if (!stateSet.contains(start)) {
            throw new IllegalArgumentException("Start state " + start + " is not in Q.");
        }
        Set<State> acceptingSet = new LinkedHashSet<>(accepting);
        if (!stateSet.containsAll(acceptingSet)) {
            throw new IllegalArgumentException("Accepting states must be a subset of Q.");
        }

        Map<Pair<State, Symbol>, State> delta = new HashMap<>();
        for (Transition t : transitions) {
            if (!stateSet.contains(t.getSource()) || !stateSet.contains(t.getTarget())) {
                throw new IllegalArgumentException("Transition " + t + " refers to a state outside Q.");
            }
            if (!alphabet.contains(t.getSymbol())) {
                throw new IllegalArgumentException("Transition " + t + " reads a symbol outside Σ.");
            }
            State previous = delta.putIfAbsent(Pair.of(t.getSource(), t.getSymbol()), t.getTarget());
            if (previous != null && !previous.equals(t.getTarget())) {
                throw new IllegalArgumentException("Conflicting transitions for (" + t.getSource() + ", " + t.getSymbol() + ").");
            }
        }
        if (delta.size() != stateSet.size() * alphabet.size()) {
            throw new IllegalArgumentException("Transition function is not total: "
                    + delta.size() + " of " + stateSet.size() * alphabet.size() + " pairs defined.");
        }

        AutomatonDefinition definition = new AutomatonDefinition(
                Collections.unmodifiableSet(stateSet),
                alphabet,
                start,
                Collections.unmodifiableSet(acceptingSet),
                Collections.unmodifiableMap(delta));
        logger.info("创建 DFA: {} 个状态, {} 个符号, 初始状态 {}", stateSet.size(), alphabet.size(), start);
        return definition;
    }

    /**
     * δ(state, symbol)。由于迁移函数是全函数，对合法的参数总能得到结果。
     * @throws IllegalArgumentException 如果 state 不在 Q 中或 symbol 不在 Σ 中。
     */
    public State next(State state, Symbol symbol) {
        State target = delta.get(Pair.of(state, symbol));
        if (target == null) {
            throw new IllegalArgumentException("No transition for (" + state + ", " + symbol + ")");
        }
        return target;
    }

    public boolean isAccepting(State state) {
        return accepting.contains(state);
    }

    /**
     * 以状态声明顺序、字母表声明顺序列出全部迁移。
     * @return 长度为 |Q| × |Σ| 的不可修改列表。
     */
    public List<Transition> getTransitions() {
        List<Transition> result = new ArrayList<>(delta.size());
        for (State state : states) {
            for (Symbol symbol : alphabet.getSymbols()) {
                result.add(new Transition(state, symbol, next(state, symbol)));
            }
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AutomatonDefinition that = (AutomatonDefinition) o;
        // Set.equals 与迭代顺序无关
        return states.equals(that.states) &&
                alphabet.equals(that.alphabet) &&
                start.equals(that.start) &&
                accepting.equals(that.accepting) &&
                delta.equals(that.delta);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "DFA(states=" + states + ", alphabet=" + alphabet + ", start=" + start.getLabel()
                + ", accepting=" + accepting + ")";
    }
}
