package org.dfasim.config;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * 引擎设置：枚举的默认上限、最大探索长度和前沿规模上限。
 * 此类是不可变的，{@code with*} 方法返回新实例。
 */
@Getter
public final class EngineSettings {

    private static final Logger logger = LoggerFactory.getLogger(EngineSettings.class);

    public static final String RESOURCE = "dfasim.properties";
    public static final String LIMIT_KEY = "dfasim.enumeration.limit";
    public static final String MAX_LENGTH_KEY = "dfasim.enumeration.max-length";
    public static final String MAX_FRONTIER_KEY = "dfasim.enumeration.max-frontier";

    public static final int DEFAULT_LIMIT = 10;
    public static final int DEFAULT_MAX_LENGTH = 20;
    public static final int DEFAULT_MAX_FRONTIER = 100_000;

    private static final EngineSettings DEFAULTS =
            new EngineSettings(DEFAULT_LIMIT, DEFAULT_MAX_LENGTH, DEFAULT_MAX_FRONTIER);

    private final int enumerationLimit;
    private final int maxWordLength;
    private final int maxFrontierSize;

    private EngineSettings(int enumerationLimit, int maxWordLength, int maxFrontierSize) {
        if (enumerationLimit <= 0) {
            throw new IllegalArgumentException("Enumeration limit must be positive: " + enumerationLimit);
        }
        if (maxWordLength < 0) {
            throw new IllegalArgumentException("Maximum word length cannot be negative: " + maxWordLength);
        }
        if (maxFrontierSize <= 0) {
            throw new IllegalArgumentException("Maximum frontier size must be positive: " + maxFrontierSize);
        }
        this.enumerationLimit = enumerationLimit;
        this.maxWordLength = maxWordLength;
        this.maxFrontierSize = maxFrontierSize;
    }

    public static EngineSettings defaults() {
        return DEFAULTS;
    }

    /**
     * 从类路径上的 {@value #RESOURCE} 读取设置，文件不存在时使用默认值。
     */
    public static EngineSettings load() {
        try (InputStream in = EngineSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                logger.debug("未找到 {}，使用默认设置", RESOURCE);
                return DEFAULTS;
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    /**
     * 缺失的键保留默认值。
     * @throws IllegalArgumentException 如果某个值不是合法的整数或超出范围。
     */
    public static EngineSettings fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "Properties cannot be null");
        EngineSettings settings = new EngineSettings(
                readInt(properties, LIMIT_KEY, DEFAULT_LIMIT),
                readInt(properties, MAX_LENGTH_KEY, DEFAULT_MAX_LENGTH),
                readInt(properties, MAX_FRONTIER_KEY, DEFAULT_MAX_FRONTIER));
        logger.info("加载引擎设置: {}", settings);
        return settings;
    }

    private static int readInt(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting '" + key + "' is not an integer: " + value, e);
        }
    }

    public EngineSettings withEnumerationLimit(int limit) {
        return new EngineSettings(limit, maxWordLength, maxFrontierSize);
    }

    public EngineSettings withMaxWordLength(int length) {
        return new EngineSettings(enumerationLimit, length, maxFrontierSize);
    }

    public EngineSettings withMaxFrontierSize(int size) {
        return new EngineSettings(enumerationLimit, maxWordLength, size);
    }

    @Override
    public String toString() {
        return "EngineSettings(limit=" + enumerationLimit + ", maxLength=" + maxWordLength
                + ", maxFrontier=" + maxFrontierSize + ")";
    }
}
