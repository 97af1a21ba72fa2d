package com.mimecast.mimetree.mime.exceptions;

/**
 * Failure splitting a multipart body on its boundary.
 */
public class BoundaryException extends MimeException {

    /**
     * Boundary being scanned for.
     */
    private final String boundary;

    /**
     * Input ended inside a part body.
     */
    private final boolean unexpectedEnd;

    /**
     * Constructs a new BoundaryException instance.
     *
     * @param boundary      Boundary.
     * @param message       Error message.
     * @param unexpectedEnd Input ended before a delimiter.
     */
    public BoundaryException(String boundary, String message, boolean unexpectedEnd) {
        super("Error at boundary " + boundary + ": " + message);
        this.boundary = boundary;
        this.unexpectedEnd = unexpectedEnd;
    }

    /**
     * Constructs a new BoundaryException instance with cause.
     *
     * @param boundary Boundary.
     * @param cause    Cause.
     */
    public BoundaryException(String boundary, Throwable cause) {
        super("Error at boundary " + boundary + ": " + cause.getMessage(), cause);
        this.boundary = boundary;
        this.unexpectedEnd = false;
    }

    /**
     * Gets boundary.
     *
     * @return String.
     */
    public String getBoundary() {
        return boundary;
    }

    /**
     * Is unexpected end of input.
     *
     * @return Boolean.
     */
    public boolean isUnexpectedEnd() {
        return unexpectedEnd;
    }
}
