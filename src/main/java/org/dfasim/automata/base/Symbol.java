package org.dfasim.automata.base;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 字母表中的一个符号，恰好对应一个 Unicode 码点。
 * 输入串按码点逐个拆分为符号，因此多字符的符号永远无法被匹配。
 * 空白字符不能作为符号，它在表格与文件中与空单元格无法区分。
 */
@Getter
public final class Symbol {

    private final int codePoint;

    private Symbol(int codePoint) {
        this.codePoint = codePoint;
    }

    public static Symbol of(int codePoint) {
        if (!Character.isValidCodePoint(codePoint)) {
            throw new IllegalArgumentException("Invalid code point: " + codePoint);
        }
        if (Character.isWhitespace(codePoint)) {
            throw new IllegalArgumentException("Symbol cannot be whitespace: U+" + Integer.toHexString(codePoint).toUpperCase());
        }
        return new Symbol(codePoint);
    }

    /**
     * 工厂方法：从文本创建符号。
     * @param text 恰好包含一个码点的文本。
     * @return 对应的 Symbol 实例。
     * @throws IllegalArgumentException 如果文本不是恰好一个码点，或该码点是空白字符。
     */
    public static Symbol of(String text) {
        Objects.requireNonNull(text, "Symbol text cannot be null");
        if (!isSingleCodePoint(text)) {
            throw new IllegalArgumentException("Symbol must be exactly one character: '" + text + "'");
        }
        return of(text.codePointAt(0));
    }

    public static boolean isSingleCodePoint(String text) {
        return !text.isEmpty() && text.codePointCount(0, text.length()) == 1;
    }

    /**
     * 将输入串按码点拆分为符号序列。
     */
    public static List<Symbol> split(String input) {
        Objects.requireNonNull(input, "Input cannot be null");
        List<Symbol> symbols = new ArrayList<>(input.length());
        input.codePoints().forEach(cp -> symbols.add(new Symbol(cp)));
        return symbols;
    }

    /**
     * 将符号序列拼接为字符串。
     */
    public static String join(List<Symbol> word) {
        StringBuilder sb = new StringBuilder(word.size());
        for (Symbol symbol : word) {
            sb.appendCodePoint(symbol.codePoint);
        }
        return sb.toString();
    }

    public String getText() {
        return new String(Character.toChars(codePoint));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return codePoint == ((Symbol) o).codePoint;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(codePoint);
    }

    @Override
    public String toString() {
        return getText();
    }
}
