package org.dfasim.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 代表 DFA 的有限字母表。
 * Alphabet 是不可变对象，保留符号的声明顺序，该顺序即枚举时的字典序。
 * 相等性只比较符号集合，与声明顺序无关。
 */
public final class Alphabet {

    private static final Logger logger = LoggerFactory.getLogger(Alphabet.class);

    @Getter
    private final List<Symbol> symbols;
    private final Map<Symbol, Integer> indexBySymbol;
    private final Set<Symbol> symbolSet;
    private final int hashCode;

    /**
     * 私有构造函数，通过有序符号列表创建 Alphabet。
     * @param symbols 按声明顺序排列的符号，不得重复。
     */
    private Alphabet(List<Symbol> symbols) {
        Objects.requireNonNull(symbols, "Symbols list cannot be null");

        this.symbols = List.copyOf(symbols);
        Map<Symbol, Integer> index = new HashMap<>();
        for (int i = 0; i < this.symbols.size(); i++) {
            if (index.putIfAbsent(this.symbols.get(i), i) != null) {
                logger.warn("Alphabet 包含重复的符号: {}", this.symbols.get(i));
                throw new IllegalArgumentException("Alphabet contains duplicate symbol '" + this.symbols.get(i) + "'");
            }
        }
        this.indexBySymbol = Collections.unmodifiableMap(index);
        this.symbolSet = Set.copyOf(this.symbols);
        this.hashCode = Objects.hash(symbolSet);
        logger.debug("创建 Alphabet，包含 {} 个符号。详情：{}", this.symbols.size(), this.symbols);
    }

    /**
     * 工厂方法：从有序符号列表创建 Alphabet 实例。
     */
    public static Alphabet of(List<Symbol> symbols) {
        return new Alphabet(symbols);
    }

    /**
     * 工厂方法：从一系列单字符文本创建 Alphabet 实例。
     * @param texts 每个元素恰好一个字符。
     * @return Alphabet 实例。
     */
    public static Alphabet of(String... texts) {
        return new Alphabet(Arrays.stream(texts).map(Symbol::of).collect(Collectors.toList()));
    }

    public boolean contains(Symbol symbol) {
        return indexBySymbol.containsKey(symbol);
    }

    /**
     * 符号在声明顺序中的位置。
     * @return 0 起始的下标，若符号不在字母表中则返回 -1。
     */
    public int indexOf(Symbol symbol) {
        return indexBySymbol.getOrDefault(symbol, -1);
    }

    public int size() {
        return symbols.size();
    }

    /**
     * 按（长度，声明顺序下的字典序）比较两个符号串。
     * 只对完全由本字母表符号组成的串有定义。
     */
    public Comparator<List<Symbol>> shortlexOrder() {
        return (a, b) -> {
            if (a.size() != b.size()) {
                return Integer.compare(a.size(), b.size());
            }
            for (int i = 0; i < a.size(); i++) {
                int cmp = Integer.compare(indexOf(a.get(i)), indexOf(b.get(i)));
                if (cmp != 0) {
                    return cmp;
                }
            }
            return 0;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Alphabet alphabet = (Alphabet) o;
        return symbolSet.equals(alphabet.symbolSet);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "Alphabet{" +
                symbols.stream()
                        .map(Symbol::toString)
                        .collect(Collectors.joining(", ")) +
                '}';
    }
}
