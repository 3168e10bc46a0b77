package org.dfasim.automata.base;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AlphabetTest {

    @Nested
    @DisplayName("构造 (Construction)")
    class ConstructionTests {

        @Test
        @DisplayName("保留声明顺序")
        void testDeclaredOrderIsKept() {
            Alphabet alphabet = Alphabet.of("b", "a", "c");

            assertAll("Declared order",
                    () -> assertEquals(List.of(Symbol.of("b"), Symbol.of("a"), Symbol.of("c")), alphabet.getSymbols()),
                    () -> assertEquals(0, alphabet.indexOf(Symbol.of("b"))),
                    () -> assertEquals(2, alphabet.indexOf(Symbol.of("c"))),
                    () -> assertEquals(-1, alphabet.indexOf(Symbol.of("z"))),
                    () -> assertEquals(3, alphabet.size())
            );
        }

        @Test
        @DisplayName("重复符号应抛出异常")
        void testDuplicateSymbolsAreRejected() {
            assertThrows(IllegalArgumentException.class, () -> Alphabet.of("a", "b", "a"));
        }

        @Test
        @DisplayName("多字符符号应抛出异常")
        void testMultiCharacterSymbolIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> Alphabet.of("ab"));
        }

        @Test
        @DisplayName("空白字符不能作为符号")
        void testWhitespaceSymbolIsRejected() {
            assertAll("Whitespace symbols",
                    () -> assertThrows(IllegalArgumentException.class, () -> Symbol.of(" ")),
                    () -> assertThrows(IllegalArgumentException.class, () -> Symbol.of("\t")),
                    () -> assertThrows(IllegalArgumentException.class, () -> Symbol.of('\n')),
                    () -> assertThrows(IllegalArgumentException.class, () -> Alphabet.of(" ", "a"))
            );
        }

        @Test
        @DisplayName("输入中的空白仍按码点拆分，由求值器报告为未知符号")
        void testWhitespaceInInputStillSplits() {
            List<Symbol> word = Symbol.split("a b");

            assertEquals(3, word.size());
            assertEquals("a b", Symbol.join(word));
        }

        @Test
        @DisplayName("相等性与声明顺序无关")
        void testEqualityIgnoresOrder() {
            Alphabet ab = Alphabet.of("a", "b");
            Alphabet ba = Alphabet.of("b", "a");

            assertEquals(ab, ba);
            assertEquals(ab.hashCode(), ba.hashCode());
            assertNotEquals(ab, Alphabet.of("a", "c"));
        }
    }

    @Nested
    @DisplayName("长度优先字典序 (Shortlex order)")
    class ShortlexTests {

        @Test
        @DisplayName("短串排在长串之前，同长度按声明顺序比较")
        void testShortlexFollowsDeclaredOrder() {
            Alphabet alphabet = Alphabet.of("1", "0");
            List<List<Symbol>> words = new ArrayList<>(List.of(
                    Symbol.split("00"),
                    Symbol.split("1"),
                    Symbol.split(""),
                    Symbol.split("10"),
                    Symbol.split("0")));

            words.sort(alphabet.shortlexOrder());

            assertEquals(List.of(
                    Symbol.split(""),
                    Symbol.split("1"),
                    Symbol.split("0"),
                    Symbol.split("10"),
                    Symbol.split("00")), words);
        }
    }

    @Test
    @DisplayName("符号按码点拆分和拼接")
    void testSymbolSplitAndJoin() {
        List<Symbol> word = Symbol.split("aλ😀");

        assertAll("Code point handling",
                () -> assertEquals(3, word.size()),
                () -> assertEquals("😀", word.get(2).getText()),
                () -> assertEquals("aλ😀", Symbol.join(word)),
                () -> assertTrue(Symbol.isSingleCodePoint("😀")),
                () -> assertFalse(Symbol.isSingleCodePoint("")),
                () -> assertFalse(Symbol.isSingleCodePoint("ab"))
        );
    }

    @Test
    @DisplayName("状态标签去除首尾空白，空白标签非法")
    void testStateLabels() {
        assertEquals(State.of("q0"), State.of("  q0 "));
        assertThrows(IllegalArgumentException.class, () -> State.of("   "));
    }
}
