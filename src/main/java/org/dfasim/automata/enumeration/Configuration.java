package org.dfasim.automata.enumeration;

import lombok.Getter;
import org.dfasim.automata.base.State;
import org.dfasim.automata.base.Symbol;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 广度优先搜索中的一个格局 (q, w)：读完串 w 后到达状态 q。
 * 此类是不可变的。
 */
@Getter
final class Configuration {

    private final State state;  // q
    private final List<Symbol> word;  // w

    private final int hashCode;

    Configuration(State state, List<Symbol> word) {
        this.state = Objects.requireNonNull(state, "State cannot be null.");
        this.word = List.copyOf(Objects.requireNonNull(word, "Word cannot be null."));
        this.hashCode = Objects.hash(state, this.word);
    }

    static Configuration initial(State start) {
        return new Configuration(start, List.of());
    }

    /**
     * 读入一个符号后得到的后继格局。
     */
    Configuration extend(Symbol symbol, State target) {
        List<Symbol> extended = new ArrayList<>(word.size() + 1);
        extended.addAll(word);
        extended.add(symbol);
        return new Configuration(target, extended);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Configuration that = (Configuration) o;
        return state.equals(that.state) &&
                word.equals(that.word);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "(" + state.getLabel() + ", \"" + Symbol.join(word) + "\")";
    }
}
