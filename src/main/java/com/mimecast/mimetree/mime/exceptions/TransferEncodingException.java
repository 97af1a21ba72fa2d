package com.mimecast.mimetree.mime.exceptions;

/**
 * Body that does not decode under its Content-Transfer-Encoding.
 */
public class TransferEncodingException extends MimeException {
    private final String encoding;

    /**
     * Constructs a new TransferEncodingException instance.
     *
     * @param encoding Content-Transfer-Encoding value.
     * @param message  Reason.
     */
    public TransferEncodingException(String encoding, String message) {
        super("Invalid " + encoding + " body: " + message);
        this.encoding = encoding;
    }

    /**
     * Gets transfer encoding.
     *
     * @return String.
     */
    public String getEncoding() {
        return encoding;
    }
}
