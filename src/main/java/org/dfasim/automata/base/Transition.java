package org.dfasim.automata.base;

import lombok.Getter;
import java.util.Objects;

/**
 * 一条显式的迁移三元组 (q, a, q')。
 */
@Getter
public final class Transition {

    private final State source;
    private final Symbol symbol;
    private final State target;

    private final int hashCode;

    /**
     * @param source 源状态 (q)
     * @param symbol 读入的符号 (a)
     * @param target 目标状态 (q')
     */
    public Transition(State source, Symbol symbol, State target) {
        this.source = Objects.requireNonNull(source, "Source state cannot be null.");
        this.symbol = Objects.requireNonNull(symbol, "Symbol cannot be null.");
        this.target = Objects.requireNonNull(target, "Target state cannot be null.");
        this.hashCode = Objects.hash(source, symbol, target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Transition that = (Transition) o;
        return source.equals(that.source) &&
                symbol.equals(that.symbol) &&
                target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return String.format("%s --[%s]--> %s",
                source.getLabel(),
                symbol,
                target.getLabel());
    }
}
