package com.mimecast.mimetree.config;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * MIME parser configuration.
 *
 * <p>This class provides type safe access to parser settings:
 * <ul>
 *     <li><b>maxDepth</b>: deepest multipart nesting accepted, default 32.</li>
 *     <li><b>bufferSize</b>: line reader pushback buffer in bytes, default 1024.</li>
 *     <li><b>repairContentTypeParameters</b>: lift Content-Type parameters into header fields, default true.</li>
 *     <li><b>charsetAliases</b>: charset names mapped to Java charset names.</li>
 * </ul>
 */
public class ParserConfig extends ConfigFoundation {

    /**
     * Default nesting limit.
     */
    public static final int DEFAULT_MAX_DEPTH = 32;

    /**
     * Default pushback buffer size.
     */
    public static final int DEFAULT_BUFFER_SIZE = 1024;

    /**
     * Largest line reader pushback buffer size.
     */
    public static final int MAX_BUFFER_SIZE = 1 << 20;

    /**
     * Constructs a new ParserConfig instance with defaults.
     */
    public ParserConfig() {
        super();
    }

    /**
     * Constructs a new ParserConfig instance.
     *
     * @param map Configuration map.
     */
    public ParserConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ParserConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ParserConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets maximum multipart nesting depth.
     *
     * @return Integer, at least 1.
     */
    public int getMaxDepth() {
        return clamp(getLongProperty("maxDepth", (long) DEFAULT_MAX_DEPTH), 1L, Integer.MAX_VALUE);
    }

    /**
     * Gets line reader pushback buffer size.
     *
     * @return Integer, between 64 and {@link #MAX_BUFFER_SIZE}.
     */
    public int getBufferSize() {
        return clamp(getLongProperty("bufferSize", (long) DEFAULT_BUFFER_SIZE), 64L, MAX_BUFFER_SIZE);
    }

    /**
     * Bounds a configured number before narrowing it to int.
     *
     * @param value Configured value.
     * @param min   Lowest value returned.
     * @param max   Highest value returned.
     * @return Integer.
     */
    private static int clamp(long value, long min, long max) {
        return (int) Math.min(max, Math.max(min, value));
    }

    /**
     * Is Content-Type parameter repair enabled.
     *
     * @return Boolean.
     */
    public boolean isRepairContentTypeParameters() {
        return getBooleanProperty("repairContentTypeParameters", true);
    }

    /**
     * Gets charset aliases.
     *
     * @return Map of alias to Java charset name.
     */
    public Map<String, String> getCharsetAliases() {
        Map<String, String> aliases = new HashMap<>();
        getMapProperty("charsetAliases").forEach((alias, name) -> aliases.put(alias, String.valueOf(name)));
        return aliases;
    }
}
