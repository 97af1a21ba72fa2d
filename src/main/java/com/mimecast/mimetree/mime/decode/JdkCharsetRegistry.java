package com.mimecast.mimetree.mime.decode;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Charset registry backed by the JVM charset providers.
 *
 * <p>Names seen in the wild that the JVM does not know can be mapped to a Java charset name
 * <br>through the aliases map, e.g. {@code ks_c_5601-1987 -> EUC-KR}.
 */
public class JdkCharsetRegistry implements CharsetRegistry {
    private static final Logger log = LogManager.getLogger(JdkCharsetRegistry.class);

    /**
     * Lower-case alias to Java charset name.
     */
    private final Map<String, String> aliases;

    /**
     * Constructs a new JdkCharsetRegistry instance without aliases.
     */
    public JdkCharsetRegistry() {
        this(Collections.emptyMap());
    }

    /**
     * Constructs a new JdkCharsetRegistry instance.
     *
     * @param aliases Map of alias to Java charset name.
     */
    public JdkCharsetRegistry(Map<String, String> aliases) {
        Map<String, String> map = new HashMap<>();
        aliases.forEach((alias, name) -> map.put(alias.toLowerCase(Locale.ROOT), name));
        this.aliases = Collections.unmodifiableMap(map);
    }

    @Override
    public Optional<Charset> lookup(String name) {
        String clean = StringUtils.strip(StringUtils.trimToEmpty(name), "\"'");
        if (clean.isEmpty()) {
            return Optional.empty();
        }

        clean = aliases.getOrDefault(clean.toLowerCase(Locale.ROOT), clean);

        try {
            return Optional.of(Charset.forName(clean));
        } catch (IllegalCharsetNameException | java.nio.charset.UnsupportedCharsetException e) {
            log.debug("Unknown charset: {}", name);
            return Optional.empty();
        }
    }
}
