package com.mimecast.mimetree.mime.exceptions;

/**
 * Sub-part without Content-Type.
 */
public class MissingContentTypeException extends MimeException {
    private final String boundary;

    /**
     * Constructs a new MissingContentTypeException instance.
     *
     * @param boundary Boundary of the enclosing multipart.
     */
    public MissingContentTypeException(String boundary) {
        super("Missing Content-Type at boundary " + boundary);
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
