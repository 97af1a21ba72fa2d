package com.mimecast.mimetree.mime.headers;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.mail.internet.MimeUtility;
import java.io.UnsupportedEncodingException;

/**
 * RFC 2047 encoded-word decoder for header parameter values.
 *
 * <p>Values without encoded words are returned as they are.
 * <br>Words in a charset the JVM does not know are left encoded.
 */
public final class HeaderWordDecoder {
    private static final Logger log = LogManager.getLogger(HeaderWordDecoder.class);

    /**
     * Private constructor.
     */
    private HeaderWordDecoder() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Decodes encoded words.
     *
     * @param value Header value, may be null.
     * @return Decoded value or empty string for null.
     */
    public static String decode(String value) {
        if (StringUtils.isEmpty(value) || !value.contains("=?")) {
            return StringUtils.defaultString(value);
        }

        try {
            return MimeUtility.decodeText(value);
        } catch (UnsupportedEncodingException e) {
            log.warn("Unable to decode header value \"{}\": {}", value, e.getMessage());
            return value;
        }
    }
}
