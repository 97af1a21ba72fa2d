package com.mimecast.mimetree.mime.exceptions;

/**
 * Sub-part with no header fields that is not the trailing artifact of a missing close delimiter.
 */
public class EmptyHeaderException extends MimeException {
    private final String boundary;

    /**
     * Constructs a new EmptyHeaderException instance.
     *
     * @param boundary Boundary of the enclosing multipart.
     */
    public EmptyHeaderException(String boundary) {
        super("Empty header at boundary " + boundary);
        this.boundary = boundary;
    }

    /**
     * Constructs a new EmptyHeaderException instance with cause.
     *
     * @param boundary Boundary of the enclosing multipart.
     * @param cause    Failure met while looking past the empty header.
     */
    public EmptyHeaderException(String boundary, Throwable cause) {
        super("Empty header at boundary " + boundary + ": " + cause.getMessage(), cause);
        this.boundary = boundary;
    }

    /**
     * Gets boundary.
     *
     * @return String.
     */
    public String getBoundary() {
        return boundary;
    }
}
