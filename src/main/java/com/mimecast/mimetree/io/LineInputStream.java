package com.mimecast.mimetree.io;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;

/**
 * Input stream with binary line reading capability.
 *
 * <p>Returns lines with their EOL bytes as byte arrays and counts lines.
 * <p>Lines end at LF, CRLF or a lone CR.
 * <br>Anything read past a line can be handed back with {@link #unread(byte[])}.
 */
public class LineInputStream extends PushbackInputStream {

    /**
     * Carrige return byte.
     */
    private static final int CR = 13; // \r

    /**
     * Line feed byte.
     */
    private static final int LF = 10; // \n

    /**
     * Initial line buffer size (typical RFC 5322 line is 78-998 bytes).
     */
    private static final int LINE_BUFFER_INITIAL_SIZE = 1024;

    /**
     * Current line number.
     */
    private int lineNumber = 0;

    /**
     * Reusable line buffer to reduce allocations.
     */
    private final ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream(LINE_BUFFER_INITIAL_SIZE);

    /**
     * Constructs a new LineInputStream instance with a 1KB pushback buffer.
     *
     * @param stream InputStream instance.
     */
    public LineInputStream(InputStream stream) {
        this(stream, 1024);
    }

    /**
     * Constructs a new LineInputStream instance with given pushback buffer size.
     * <p>The pushback buffer must fit the longest line the caller intends to unread.
     *
     * @param stream InputStream instance.
     * @param size   Pushback buffer size.
     */
    public LineInputStream(InputStream stream, int size) {
        super(stream instanceof BufferedInputStream ? stream : new BufferedInputStream(stream), size);
    }

    /**
     * Gets line number.
     *
     * @return Line number.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Read line as byte array.
     *
     * @return Byte array including EOL bytes or null at end of stream.
     * @throws IOException Unable to read.
     */
    @SuppressWarnings("squid:S1168")
    public byte[] readLine() throws IOException {
        lineBuffer.reset();

        int intByte;
        while ((intByte = read()) != -1) {
            lineBuffer.write(intByte);

            if (intByte == LF) {
                break;
            }

            if (intByte == CR) {
                // CR alone also ends a line, anything else goes back.
                int next = read();
                if (next == LF) {
                    lineBuffer.write(next);
                } else if (next != -1) {
                    unread(next);
                }
                break;
            }
        }

        // Return null if nothing was read.
        if (lineBuffer.size() == 0) {
            return null;
        }

        lineNumber++;
        return lineBuffer.toByteArray();
    }

    /**
     * Checks if the stream has no more bytes without consuming any.
     *
     * @return Boolean.
     * @throws IOException Unable to read.
     */
    public boolean isAtEnd() throws IOException {
        int next = read();
        if (next == -1) {
            return true;
        }

        unread(next);
        return false;
    }

    /**
     * Gets the length of the EOL sequence ending the given line.
     *
     * @param line Line bytes as returned by {@link #readLine()}.
     * @return 0, 1 or 2.
     */
    public static int eolLength(byte[] line) {
        int length = line.length;
        if (length > 1 && line[length - 2] == CR && line[length - 1] == LF) {
            return 2;
        }
        if (length > 0 && (line[length - 1] == LF || line[length - 1] == CR)) {
            return 1;
        }
        return 0;
    }
}
