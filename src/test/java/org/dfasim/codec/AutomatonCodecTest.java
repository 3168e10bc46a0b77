package org.dfasim.codec;

import org.dfasim.automata.SampleAutomata;
import org.dfasim.automata.base.Alphabet;
import org.dfasim.automata.base.State;
import org.dfasim.automata.base.Symbol;
import org.dfasim.automata.base.Transition;
import org.dfasim.automata.models.AutomatonDefinition;
import org.dfasim.automata.models.DefinitionDraft;
import org.dfasim.automata.validation.ValidationError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AutomatonCodecTest {

    private final AutomatonCodec codec = new AutomatonCodec();

    private static final String PARITY_JSON = """
            {
              "states": ["S0", "S1"],
              "alphabet": ["0", "1"],
              "start": "S0",
              "accepting": ["S0"],
              "transitions": [
                {"state": "S0", "symbol": "0", "next_state": "S0"},
                {"state": "S0", "symbol": "1", "next_state": "S1"},
                {"state": "S1", "symbol": "0", "next_state": "S1"},
                {"state": "S1", "symbol": "1", "next_state": "S0"}
              ]
            }
            """;

    @Nested
    @DisplayName("往返 (Round trip)")
    class RoundTripTests {

        @Test
        @DisplayName("解码编码结果得到结构相等的定义")
        void testRoundTrip() {
            for (AutomatonDefinition dfa : List.of(
                    SampleAutomata.parity(),
                    SampleAutomata.endsIn01(),
                    SampleAutomata.finiteAOrAb(),
                    SampleAutomata.emptyLanguage())) {
                DecodeResult result = codec.decode(codec.encode(dfa));

                assertTrue(result.isSuccess(), () -> "Round trip failed: " + result);
                assertEquals(dfa, result.orElseThrow());
            }
        }

        @Test
        @DisplayName("字母表声明顺序和非 ASCII 符号被保留")
        void testDeclaredOrderAndUnicode() {
            AutomatonDefinition dfa = new DefinitionDraft()
                    .states("α")
                    .symbols("λ", "a")
                    .start("α")
                    .accepting("α")
                    .transition("α", "λ", "α")
                    .transition("α", "a", "α")
                    .validate().orElseThrow();

            AutomatonDefinition decoded = codec.decode(codec.encode(dfa)).orElseThrow();

            assertEquals(List.of(Symbol.of("λ"), Symbol.of("a")), decoded.getAlphabet().getSymbols());
        }

        @Test
        @DisplayName("含有空白符号的字母表无法构造，表格中的空白单元格被当作空")
        void testWhitespaceSymbolCannotEnterARoundTrip() {
            assertThrows(IllegalArgumentException.class, () -> AutomatonDefinition.of(
                    List.of(State.of("q")), Alphabet.of(" ", "a"), State.of("q"), List.of(State.of("q")),
                    List.of(new Transition(State.of("q"), Symbol.of(" "), State.of("q")))));

            DefinitionDraft draft = new DefinitionDraft()
                    .states("q")
                    .symbols(" ", "a")
                    .start("q")
                    .accepting("q")
                    .transition("q", "a", "q");
            AutomatonDefinition dfa = draft.validate().orElseThrow();

            assertAll("Blank symbol entry is skipped",
                    () -> assertEquals(List.of(Symbol.of("a")), dfa.getAlphabet().getSymbols()),
                    () -> assertEquals(dfa, codec.decode(codec.encode(dfa)).orElseThrow()),
                    () -> assertEquals(dfa, DefinitionDraft.from(dfa).validate().orElseThrow())
            );
        }

        @Test
        @DisplayName("解码规范布局")
        void testDecodeCanonicalLayout() {
            assertEquals(SampleAutomata.parity(), codec.decode(PARITY_JSON).orElseThrow());
        }

        @Test
        @DisplayName("未知字段被忽略")
        void testUnknownFieldsAreIgnored() {
            String text = PARITY_JSON.replaceFirst("\\{", "{\"name\": \"Parity\", \"layout\": {\"x\": 1},");

            assertEquals(SampleAutomata.parity(), codec.decode(text).orElseThrow());
        }

        @Test
        @DisplayName("旧版模拟器的文件布局同样可以解码")
        void testLegacyLayout() {
            String legacy = """
                    {"states": ["S0", "S1"], "alphabet": ["0","1"], "initial_state":"S0",
                     "accepting_states":["S0"],
                     "transitions": {"S0":{"0":"S0","1":"S1"}, "S1":{"0":"S1","1":"S0"}} }
                    """;

            assertEquals(SampleAutomata.parity(), codec.decode(legacy).orElseThrow());
        }
    }

    @Nested
    @DisplayName("解码错误 (Decode errors)")
    class DecodeErrorTests {

        @Test
        @DisplayName("缺失 start 字段时报告 start，而不是填充默认值")
        void testMissingStart() {
            String text = PARITY_JSON.replace("\"start\": \"S0\",", "");

            DecodeResult result = codec.decode(text);

            DecodeError error = result.getDecodeError().orElseThrow();
            assertAll("Missing start",
                    () -> assertFalse(result.isSuccess()),
                    () -> assertTrue(result.getDefinition().isEmpty()),
                    () -> assertEquals(DecodeError.Kind.MISSING_FIELD, error.getKind()),
                    () -> assertEquals(Optional.of("start"), error.getField())
            );
        }

        @Test
        @DisplayName("缺失 transitions 字段")
        void testMissingTransitions() {
            String text = """
                    {"states": ["S0"], "alphabet": ["0"], "start": "S0", "accepting": []}
                    """;

            assertEquals(Optional.of("transitions"),
                    codec.decode(text).getDecodeError().orElseThrow().getField());
        }

        @Test
        @DisplayName("迁移条目缺失子字段时报告完整路径")
        void testMissingTransitionField() {
            String text = PARITY_JSON.replace("{\"state\": \"S0\", \"symbol\": \"1\", \"next_state\": \"S1\"}",
                    "{\"state\": \"S0\", \"next_state\": \"S1\"}");

            DecodeError error = codec.decode(text).getDecodeError().orElseThrow();

            assertEquals(DecodeError.Kind.MISSING_FIELD, error.getKind());
            assertEquals(Optional.of("transitions[1].symbol"), error.getField());
        }

        @Test
        @DisplayName("字段类型错误")
        void testInvalidFieldType() {
            String text = PARITY_JSON.replace("\"states\": [\"S0\", \"S1\"]", "\"states\": \"S0,S1\"");

            DecodeError error = codec.decode(text).getDecodeError().orElseThrow();

            assertEquals(DecodeError.Kind.INVALID_FIELD, error.getKind());
            assertEquals(Optional.of("states"), error.getField());
        }

        @Test
        @DisplayName("不是合法的 JSON 或根节点不是对象")
        void testMalformedDocument() {
            assertEquals(DecodeError.Kind.MALFORMED_DOCUMENT,
                    codec.decode("{not json").getDecodeError().orElseThrow().getKind());
            assertEquals(DecodeError.Kind.MALFORMED_DOCUMENT,
                    codec.decode("[1, 2]").getDecodeError().orElseThrow().getKind());
            assertEquals(DecodeError.Kind.MALFORMED_DOCUMENT,
                    codec.decode("").getDecodeError().orElseThrow().getKind());
        }

        @Test
        @DisplayName("结构完好但不完整的定义以校验错误报告")
        void testSemanticErrorsUseValidationTaxonomy() {
            String text = PARITY_JSON.replace(",\n    {\"state\": \"S1\", \"symbol\": \"1\", \"next_state\": \"S0\"}", "");

            DecodeResult result = codec.decode(text);

            assertAll("Non-total transition function",
                    () -> assertFalse(result.isSuccess()),
                    () -> assertTrue(result.getDecodeError().isEmpty()),
                    () -> assertEquals(1, result.getValidationErrors().size()),
                    () -> assertEquals(ValidationError.Kind.MISSING_TRANSITION, result.getValidationErrors().get(0).getKind()),
                    () -> assertThrows(IllegalStateException.class, result::orElseThrow)
            );
        }
    }

    @Nested
    @DisplayName("文件 (Files)")
    class FileTests {

        @Test
        @DisplayName("写入后读回得到相等的定义")
        void testWriteAndRead(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("ends-in-01.json");
            AutomatonDefinition dfa = SampleAutomata.endsIn01();

            codec.write(file, dfa);

            assertEquals(dfa, codec.read(file).orElseThrow());
        }

        @Test
        @DisplayName("读取不存在的文件抛出 IOException")
        void testMissingFile(@TempDir Path dir) {
            assertThrows(IOException.class, () -> codec.read(dir.resolve("missing.json")));
        }
    }
}
