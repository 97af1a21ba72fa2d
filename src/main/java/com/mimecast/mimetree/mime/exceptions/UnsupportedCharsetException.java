package com.mimecast.mimetree.mime.exceptions;

/**
 * Charset name the registry cannot resolve.
 */
public class UnsupportedCharsetException extends MimeException {
    private final String charset;

    /**
     * Constructs a new UnsupportedCharsetException instance.
     *
     * @param charset Charset name.
     */
    public UnsupportedCharsetException(String charset) {
        super("Unsupported charset: \"" + charset + "\"");
        this.charset = charset;
    }

    /**
     * Gets charset name.
     *
     * @return String.
     */
    public String getCharset() {
        return charset;
    }
}
