package org.dfasim.automata.enumeration;

import lombok.Getter;
import org.dfasim.automata.base.Symbol;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 被接受的串，按（长度，字母表声明顺序下的字典序）排列。
 */
public final class EnumerationResult {

    @Getter
    private final List<List<Symbol>> words;
    private final LimitNotReached limitNotReached;

    EnumerationResult(List<List<Symbol>> words, LimitNotReached limitNotReached) {
        this.words = words.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
        this.limitNotReached = limitNotReached;
    }

    /**
     * 以字符串形式给出的结果，空串表示为 {@code ""}。
     */
    public List<String> getStrings() {
        return words.stream().map(Symbol::join).collect(Collectors.toUnmodifiableList());
    }

    public int size() {
        return words.size();
    }

    public boolean isLimitReached() {
        return limitNotReached == null;
    }

    public Optional<LimitNotReached> getLimitNotReached() {
        return Optional.ofNullable(limitNotReached);
    }

    @Override
    public String toString() {
        return "EnumerationResult(" + getStrings() + (limitNotReached == null ? "" : ", " + limitNotReached) + ")";
    }
}
