package com.mimecast.mimetree.mime.headers;

import com.mimecast.mimetree.io.LineInputStream;
import com.mimecast.mimetree.mime.exceptions.HeaderParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * RFC 5322 header block reader.
 *
 * <p>Reads header lines up to the blank line that separates headers from body, or to end of input.
 * <br>Folded lines are unfolded by dropping the line break and keeping the leading whitespace.
 * <br>The stream is left positioned at the first body byte.
 */
public final class HeaderReader {

    /**
     * Private constructor.
     */
    private HeaderReader() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Reads a header block.
     *
     * @param stream LineInputStream instance.
     * @return MimeHeaders instance, empty if the block holds no fields.
     * @throws HeaderParseException Malformed header line.
     * @throws IOException          Unable to read.
     */
    public static MimeHeaders read(LineInputStream stream) throws IOException {
        MimeHeaders headers = new MimeHeaders();
        StringBuilder header = new StringBuilder();
        int start = 0;

        byte[] bytes;
        while ((bytes = stream.readLine()) != null) {
            String line = new String(bytes, 0, bytes.length - LineInputStream.eolLength(bytes), StandardCharsets.UTF_8);

            // Blank line ends the block.
            if (line.isEmpty()) {
                break;
            }

            // Folded continuation.
            if (line.charAt(0) == ' ' || line.charAt(0) == '\t') {
                if (header.length() == 0) {
                    throw new HeaderParseException("Continuation line without header", stream.getLineNumber());
                }
                header.append(line);
                continue;
            }

            if (header.length() > 0) {
                headers.put(parse(header.toString(), start));
                header.setLength(0);
            }
            header.append(line);
            start = stream.getLineNumber();
        }

        // Last header.
        if (header.length() > 0) {
            headers.put(parse(header.toString(), start));
        }

        return headers;
    }

    /**
     * Parses one unfolded header line.
     *
     * @param line       Unfolded line.
     * @param lineNumber Line number the header starts on.
     * @return MimeHeader instance.
     * @throws HeaderParseException Missing colon or invalid field name.
     */
    static MimeHeader parse(String line, int lineNumber) throws HeaderParseException {
        int colon = line.indexOf(':');
        if (colon < 1) {
            throw new HeaderParseException("Malformed header line \"" + line + "\"", lineNumber);
        }

        String name = line.substring(0, colon);
        if (!isFieldName(name)) {
            throw new HeaderParseException("Invalid header name \"" + name + "\"", lineNumber);
        }

        return new MimeHeader(name, line.substring(colon + 1).trim());
    }

    /**
     * Checks field name is printable US-ASCII without colon or whitespace.
     *
     * @param name Field name.
     * @return Boolean.
     */
    public static boolean isFieldName(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c < 33 || c > 126 || c == ':') {
                return false;
            }
        }
        return true;
    }
}
