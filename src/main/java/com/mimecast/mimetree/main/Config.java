package com.mimecast.mimetree.main;

import com.mimecast.mimetree.config.ParserConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Master configuration container.
 *
 * <p>Holds the parser configuration used by parsers built without an explicit one.
 * <p>Defaults apply until {@link #initParser(String)} loads a file.
 *
 * @see ParserConfig
 */
public class Config {
    private static final Logger log = LogManager.getLogger(Config.class);

    /**
     * Private constructor.
     */
    private Config() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Parser configuration.
     */
    private static volatile ParserConfig parser = new ParserConfig();

    /**
     * Gets parser config.
     *
     * @return ParserConfig.
     */
    public static ParserConfig getParser() {
        return parser;
    }

    /**
     * Init parser config.
     *
     * @param path File path.
     * @throws IOException Unable to read file.
     */
    public static void initParser(String path) throws IOException {
        parser = new ParserConfig(path);
        log.info("Loaded parser config: {}", path);
    }

    /**
     * Resets parser config to defaults.
     */
    public static void reset() {
        parser = new ParserConfig();
    }
}
