package org.dfasim.examples;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dfasim.automata.models.AutomatonDefinition;
import org.dfasim.codec.AutomatonCodec;
import org.dfasim.codec.DecodeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 随库附带的命名示例。示例以交换格式存放在类路径 {@code examples/} 下，
 * 由 {@code examples/index.json} 列出，并通过与用户文件相同的 {@link AutomatonCodec} 加载。
 */
public final class ExampleLibrary {

    private static final Logger logger = LoggerFactory.getLogger(ExampleLibrary.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String BASE = "examples/";
    private static final String INDEX = BASE + "index.json";

    private final Map<String, AutomatonDefinition> examples;

    public ExampleLibrary() {
        this(new AutomatonCodec());
    }

    /**
     * @throws IllegalStateException 如果目录或某个示例缺失或无法解码，这属于打包错误。
     */
    public ExampleLibrary(AutomatonCodec codec) {
        Map<String, AutomatonDefinition> loaded = new LinkedHashMap<>();
        JsonNode index = readIndex();
        for (JsonNode entry : index) {
            String name = entry.path("name").asText();
            String resource = entry.path("resource").asText();
            DecodeResult result = codec.decode(readResource(BASE + resource));
            if (!result.isSuccess()) {
                throw new IllegalStateException("Bundled example '" + name + "' is invalid: " + result);
            }
            loaded.put(name, result.orElseThrow());
            logger.info("加载示例: {}", name);
        }
        this.examples = Collections.unmodifiableMap(loaded);
    }

    /**
     * 示例名称，按目录顺序排列。
     */
    public List<String> names() {
        return List.copyOf(examples.keySet());
    }

    public Optional<AutomatonDefinition> load(String name) {
        return Optional.ofNullable(examples.get(name));
    }

    private static JsonNode readIndex() {
        try {
            JsonNode index = MAPPER.readTree(readResource(INDEX));
            if (!index.isArray()) {
                throw new IllegalStateException(INDEX + " must be a JSON array");
            }
            return index;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot parse " + INDEX, e);
        }
    }

    private static String readResource(String name) {
        try (InputStream in = ExampleLibrary.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled resource " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read bundled resource " + name, e);
        }
    }
}
