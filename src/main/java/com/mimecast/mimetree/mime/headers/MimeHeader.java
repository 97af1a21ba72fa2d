package com.mimecast.mimetree.mime.headers;

import java.util.Objects;

/**
 * Single MIME header field.
 *
 * <p>Holds the name with its original casing and the unfolded raw value.
 */
public class MimeHeader {

    /**
     * Header name.
     */
    private final String name;

    /**
     * Header value.
     */
    private final String value;

    /**
     * Constructs a new MimeHeader instance.
     *
     * @param name  Header name.
     * @param value Header value.
     */
    public MimeHeader(String name, String value) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = value != null ? value : "";
    }

    /**
     * Gets header name.
     *
     * @return Header name.
     */
    public String getName() {
        return name;
    }

    /**
     * Gets header value.
     *
     * @return Header value.
     */
    public String getValue() {
        return value;
    }

    /**
     * Gets header as a CRLF terminated line.
     *
     * @return String.
     */
    @Override
    public String toString() {
        return name + ": " + value + "\r\n";
    }
}
