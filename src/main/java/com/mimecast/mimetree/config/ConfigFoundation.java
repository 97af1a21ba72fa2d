package com.mimecast.mimetree.config;

import com.google.gson.Gson;
import com.google.gson.JsonSyntaxException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration loaded from a JSON5 file.
 *
 * <p>Gson reads the file leniently so comments, unquoted keys and single quotes are accepted.
 */
public class ConfigFoundation extends BasicConfig {
    private static final Logger log = LogManager.getLogger(ConfigFoundation.class);

    /**
     * Constructs a new empty ConfigFoundation instance.
     */
    public ConfigFoundation() {
        super(new HashMap<>());
    }

    /**
     * Constructs a new ConfigFoundation instance.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read or parse file.
     */
    public ConfigFoundation(String path) throws IOException {
        super(load(path));
    }

    /**
     * Reads JSON5 file into a map.
     *
     * @param path File path.
     * @return Map of String, Object.
     * @throws IOException Unable to read or parse file.
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> load(String path) throws IOException {
        String content = new String(Files.readAllBytes(Paths.get(path)), StandardCharsets.UTF_8);

        try {
            Map<String, Object> map = new Gson().fromJson(content, Map.class);
            log.debug("Loaded configuration file: {}", path);
            return map != null ? map : new HashMap<>();

        } catch (JsonSyntaxException e) {
            throw new IOException("Invalid configuration file: " + path, e);
        }
    }
}
