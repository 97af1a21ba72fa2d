package com.mimecast.mimetree.mime.exceptions;

/**
 * Header value failing the media type grammar.
 */
public class MediaTypeParseException extends MimeException {

    /**
     * Offending header value.
     */
    private final String value;

    /**
     * Constructs a new MediaTypeParseException instance.
     *
     * @param value Header value.
     * @param cause Cause.
     */
    public MediaTypeParseException(String value, Throwable cause) {
        super("Invalid media type: \"" + value + "\"", cause);
        this.value = value;
    }

    /**
     * Constructs a new MediaTypeParseException instance.
     *
     * @param value   Header value.
     * @param message Error message.
     */
    public MediaTypeParseException(String value, String message) {
        super(message + ": \"" + value + "\"");
        this.value = value;
    }

    /**
     * Gets the offending value.
     *
     * @return String.
     */
    public String getValue() {
        return value;
    }
}
