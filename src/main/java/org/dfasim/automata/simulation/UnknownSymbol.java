package org.dfasim.automata.simulation;

import lombok.Getter;

import java.util.Objects;

/**
 * 输入中出现了字母表之外的符号。这是用户输入错误，不是引擎故障。
 */
@Getter
public final class UnknownSymbol {

    private final String symbol;
    // 以码点计的 0 起始位置
    private final int position;

    UnknownSymbol(String symbol, int position) {
        this.symbol = Objects.requireNonNull(symbol, "Symbol cannot be null.");
        this.position = position;
    }

    public String getMessage() {
        return "Symbol '" + symbol + "' at position " + (position + 1) + " is not in the alphabet.";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        UnknownSymbol that = (UnknownSymbol) o;
        return position == that.position && symbol.equals(that.symbol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, position);
    }

    @Override
    public String toString() {
        return "UnknownSymbol('" + symbol + "' @ " + position + ")";
    }
}
