package com.mimecast.mimetree.mime.exceptions;

import java.io.IOException;

/**
 * Base of every MIME parse failure.
 *
 * <p>Extends IOException so parsing keeps a single {@code throws IOException} contract.
 * <br>Read failures of the underlying source are thrown as plain IOException.
 */
public abstract class MimeException extends IOException {

    /**
     * Constructs a new MimeException instance.
     *
     * @param message Error message.
     */
    protected MimeException(String message) {
        super(message);
    }

    /**
     * Constructs a new MimeException instance with cause.
     *
     * @param message Error message.
     * @param cause   Cause.
     */
    protected MimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
