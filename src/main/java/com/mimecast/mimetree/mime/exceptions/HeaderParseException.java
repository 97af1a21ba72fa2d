package com.mimecast.mimetree.mime.exceptions;

/**
 * Malformed header block.
 */
public class HeaderParseException extends MimeException {

    /**
     * Line number of the offending line.
     */
    private final int lineNumber;

    /**
     * Constructs a new HeaderParseException instance.
     *
     * @param message    Error message.
     * @param lineNumber Line number.
     */
    public HeaderParseException(String message, int lineNumber) {
        super(message + " at line " + lineNumber);
        this.lineNumber = lineNumber;
    }

    /**
     * Gets line number.
     *
     * @return Line number.
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
