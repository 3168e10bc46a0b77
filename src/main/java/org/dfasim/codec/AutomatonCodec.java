package org.dfasim.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dfasim.automata.base.Transition;
import org.dfasim.automata.models.AutomatonDefinition;
import org.dfasim.automata.models.DefinitionDraft;
import org.dfasim.automata.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DFA 与 JSON 交换格式之间的编解码。
 * <pre>
 * {
 *   "states": ["q0", "q1"],
 *   "alphabet": ["0", "1"],
 *   "start": "q0",
 *   "accepting": ["q0"],
 *   "transitions": [{"state": "q0", "symbol": "0", "next_state": "q0"}, ...]
 * }
 * </pre>
 * 解码时同样接受旧版桌面模拟器保存的布局（{@code initial_state}、{@code accepting_states}，
 * 以及 {@code {"q0": {"0": "q1"}}} 形式的嵌套迁移表），编码始终输出上面的规范布局。
 * 未知字段会被忽略。解码后的定义经过与界面输入相同的 {@link org.dfasim.automata.validation.Validator}。
 */
public final class AutomatonCodec {

    private static final Logger logger = LoggerFactory.getLogger(AutomatonCodec.class);

    public static final String STATES = "states";
    public static final String ALPHABET = "alphabet";
    public static final String START = "start";
    public static final String ACCEPTING = "accepting";
    public static final String TRANSITIONS = "transitions";
    public static final String STATE = "state";
    public static final String SYMBOL = "symbol";
    public static final String NEXT_STATE = "next_state";

    private static final String LEGACY_START = "initial_state";
    private static final String LEGACY_ACCEPTING = "accepting_states";

    private final ObjectMapper mapper;

    public AutomatonCodec() {
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * 把定义编码为带缩进的 JSON 文本，字段顺序遵循声明顺序。
     */
    public String encode(AutomatonDefinition definition) {
        Objects.requireNonNull(definition, "Definition cannot be null");
        ObjectNode root = mapper.createObjectNode();
        ArrayNode states = root.putArray(STATES);
        definition.getStates().forEach(s -> states.add(s.getLabel()));
        ArrayNode alphabet = root.putArray(ALPHABET);
        definition.getAlphabet().getSymbols().forEach(a -> alphabet.add(a.getText()));
        root.put(START, definition.getStart().getLabel());
        ArrayNode accepting = root.putArray(ACCEPTING);
        definition.getAccepting().forEach(s -> accepting.add(s.getLabel()));
        ArrayNode transitions = root.putArray(TRANSITIONS);
        for (Transition t : definition.getTransitions()) {
            transitions.addObject()
                    .put(STATE, t.getSource().getLabel())
                    .put(SYMBOL, t.getSymbol().getText())
                    .put(NEXT_STATE, t.getTarget().getLabel());
        }
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            // 只包含字符串的树不会序列化失败
            throw new UncheckedIOException("Failed to encode " + definition, e);
        }
    }

    /**
     * 解码 JSON 文本。格式错误、缺失字段和校验错误都以结果值返回，不会抛出异常。
     */
    public DecodeResult decode(String text) {
        Objects.requireNonNull(text, "Text cannot be null");
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            logger.warn("无法解析 JSON 文档: {}", e.getOriginalMessage());
            return DecodeResult.failed(DecodeError.malformed(e.getOriginalMessage()));
        }
        if (root == null || !root.isObject()) {
            logger.warn("JSON 文档的根节点不是对象");
            return DecodeResult.failed(DecodeError.malformed("the root must be an object"));
        }

        DefinitionDraft draft = new DefinitionDraft();
        try {
            readStringList(root, STATES, STATES).forEach(draft::state);
            readStringList(root, ALPHABET, ALPHABET).forEach(draft::symbol);
            draft.start(readString(root, START, LEGACY_START));
            readStringList(root, ACCEPTING, LEGACY_ACCEPTING).forEach(label -> draft.accepting(label));
            readTransitions(root, draft);
        } catch (FieldException e) {
            logger.warn("JSON 文档结构错误: {}", e.getError());
            return DecodeResult.failed(e.getError());
        }

        ValidationResult validation = draft.validate();
        if (!validation.isValid()) {
            return DecodeResult.invalid(validation.getErrors());
        }
        return DecodeResult.decoded(validation.orElseThrow());
    }

    /**
     * 以 UTF-8 把定义写入文件，覆盖已有内容。
     */
    public void write(Path path, AutomatonDefinition definition) throws IOException {
        Files.writeString(path, encode(definition), StandardCharsets.UTF_8);
        logger.info("已将 DFA 保存到 {}", path);
    }

    /**
     * 读取并解码文件。只有真正的 I/O 故障才会抛出异常。
     */
    public DecodeResult read(Path path) throws IOException {
        String text = Files.readString(path, StandardCharsets.UTF_8);
        logger.info("从 {} 读取 DFA", path);
        return decode(text);
    }

    private static JsonNode field(JsonNode root, String name, String legacyName) {
        JsonNode node = root.get(name);
        if ((node == null || node.isNull()) && !name.equals(legacyName)) {
            node = root.get(legacyName);
        }
        return node == null || node.isNull() ? null : node;
    }

    private static String readString(JsonNode root, String name, String legacyName) throws FieldException {
        JsonNode node = field(root, name, legacyName);
        if (node == null) {
            throw new FieldException(DecodeError.missingField(name));
        }
        if (!node.isTextual()) {
            throw new FieldException(DecodeError.invalidField(name, "a string"));
        }
        return node.asText();
    }

    private static List<String> readStringList(JsonNode root, String name, String legacyName) throws FieldException {
        JsonNode node = field(root, name, legacyName);
        if (node == null) {
            throw new FieldException(DecodeError.missingField(name));
        }
        if (!node.isArray()) {
            throw new FieldException(DecodeError.invalidField(name, "a list of strings"));
        }
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new FieldException(DecodeError.invalidField(name, "a list of strings"));
            }
            values.add(element.asText());
        }
        return values;
    }

    private static void readTransitions(JsonNode root, DefinitionDraft draft) throws FieldException {
        JsonNode node = field(root, TRANSITIONS, TRANSITIONS);
        if (node == null) {
            throw new FieldException(DecodeError.missingField(TRANSITIONS));
        }
        if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                JsonNode entry = node.get(i);
                String path = TRANSITIONS + "[" + i + "]";
                if (!entry.isObject()) {
                    throw new FieldException(DecodeError.invalidField(path, "an object"));
                }
                draft.transition(
                        readString(entry, STATE, STATE, path),
                        readString(entry, SYMBOL, SYMBOL, path),
                        readString(entry, NEXT_STATE, NEXT_STATE, path));
            }
        } else if (node.isObject()) {
            // 旧版布局：{"q0": {"0": "q1", "1": "q0"}, ...}
            Iterator<Map.Entry<String, JsonNode>> sources = node.fields();
            while (sources.hasNext()) {
                Map.Entry<String, JsonNode> source = sources.next();
                String path = TRANSITIONS + "." + source.getKey();
                if (!source.getValue().isObject()) {
                    throw new FieldException(DecodeError.invalidField(path, "an object of symbol to state"));
                }
                Iterator<Map.Entry<String, JsonNode>> targets = source.getValue().fields();
                while (targets.hasNext()) {
                    Map.Entry<String, JsonNode> target = targets.next();
                    if (!target.getValue().isTextual()) {
                        throw new FieldException(DecodeError.invalidField(path + "." + target.getKey(), "a string"));
                    }
                    draft.transition(source.getKey(), target.getKey(), target.getValue().asText());
                }
            }
        } else {
            throw new FieldException(DecodeError.invalidField(TRANSITIONS, "a list of transition entries"));
        }
    }

    private static String readString(JsonNode entry, String name, String legacyName, String path) throws FieldException {
        try {
            return readString(entry, name, legacyName);
        } catch (FieldException e) {
            String field = path + "." + name;
            throw new FieldException(e.getError().getKind() == DecodeError.Kind.MISSING_FIELD
                    ? DecodeError.missingField(field)
                    : DecodeError.invalidField(field, "a string"));
        }
    }

    /**
     * 解析过程中用于提前退出的内部异常，最终总会被转换为 {@link DecodeResult}。
     */
    private static final class FieldException extends Exception {

        private final DecodeError error;

        FieldException(DecodeError error) {
            super(error.getMessage());
            this.error = error;
        }

        DecodeError getError() {
            return error;
        }
    }
}
