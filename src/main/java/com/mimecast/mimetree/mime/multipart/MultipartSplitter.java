package com.mimecast.mimetree.mime.multipart;

import com.mimecast.mimetree.io.LineInputStream;
import com.mimecast.mimetree.mime.exceptions.BoundaryException;
import com.mimecast.mimetree.mime.exceptions.HeaderParseException;
import com.mimecast.mimetree.mime.headers.HeaderReader;
import com.mimecast.mimetree.mime.headers.MimeHeaders;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * RFC 2046 multipart body splitter.
 *
 * <p>Pulls one raw sub-part at a time from a body delimited by {@code --boundary} lines.
 * <br>The preamble before the first delimiter and the epilogue after {@code --boundary--} are ignored.
 * <br>The line break before a delimiter belongs to the delimiter, not to the body.
 *
 * <p>{@link #nextPart()} returns null once the close delimiter or the end of input is reached.
 * <br>Input ending right after a plain delimiter yields one last part with no headers,
 * <br>which is how a missing close delimiter shows up to callers.
 * <br>Input ending inside a body yields that part, then fails the next pull with an unexpected end.
 *
 * <p>Sequences are lazy, finite and not restartable.
 */
public class MultipartSplitter {
    private static final Logger log = LogManager.getLogger(MultipartSplitter.class);

    private enum State {
        PREAMBLE, PARTS, TRUNCATED, DONE
    }

    /**
     * Body stream.
     */
    private final LineInputStream stream;

    /**
     * Boundary as declared in Content-Type.
     */
    private final String boundary;

    /**
     * Delimiter line without EOL.
     */
    private final byte[] delimiter;

    private State state = State.PREAMBLE;

    /**
     * Constructs a new MultipartSplitter instance.
     *
     * @param body     Body stream, not closed by the splitter.
     * @param boundary Boundary parameter value.
     */
    public MultipartSplitter(InputStream body, String boundary) {
        this(body instanceof LineInputStream ? (LineInputStream) body : new LineInputStream(body), boundary);
    }

    /**
     * Constructs a new MultipartSplitter instance.
     *
     * @param stream   LineInputStream instance.
     * @param boundary Boundary parameter value.
     */
    public MultipartSplitter(LineInputStream stream, String boundary) {
        this.stream = stream;
        this.boundary = boundary;
        this.delimiter = ("--" + boundary).getBytes(StandardCharsets.ISO_8859_1);
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
     * Pulls the next raw sub-part.
     *
     * @return RawPart instance or null on clean end of parts.
     * @throws BoundaryException Body ended without delimiter or malformed sub-part header.
     * @throws IOException       Unable to read.
     */
    @SuppressWarnings("squid:S1168")
    public RawPart nextPart() throws IOException {
        switch (state) {
            case DONE:
                return null;

            case TRUNCATED:
                state = State.DONE;
                throw new BoundaryException(boundary, "unexpected end of input", true);

            case PREAMBLE:
                if (!skipPreamble()) {
                    state = State.DONE;
                    return null;
                }
                state = State.PARTS;
                break;

            default:
                break;
        }

        // Delimiter without anything after it.
        if (stream.isAtEnd()) {
            log.debug("Input ended after delimiter of boundary: {}", boundary);
            state = State.DONE;
            return new RawPart(new MimeHeaders(), new byte[0]);
        }

        MimeHeaders headers;
        try {
            headers = HeaderReader.read(stream);
        } catch (HeaderParseException e) {
            state = State.DONE;
            throw new BoundaryException(boundary, e);
        }

        return new RawPart(headers, readBody());
    }

    /**
     * Skips lines up to the first delimiter.
     *
     * @return True if a plain delimiter was found, false on close delimiter or end of input.
     * @throws IOException Unable to read.
     */
    private boolean skipPreamble() throws IOException {
        byte[] line;
        while ((line = stream.readLine()) != null) {
            Delimiter match = match(line);
            if (match == Delimiter.OPEN) {
                return true;
            }
            if (match == Delimiter.CLOSE) {
                return false;
            }
        }
        return false;
    }

    /**
     * Reads body lines up to the next delimiter and moves state accordingly.
     *
     * @return Body bytes.
     * @throws IOException Unable to read.
     */
    private byte[] readBody() throws IOException {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        byte[] pendingEol = new byte[0];

        byte[] line;
        while ((line = stream.readLine()) != null) {
            Delimiter match = match(line);
            if (match == Delimiter.OPEN) {
                return body.toByteArray();
            }
            if (match == Delimiter.CLOSE) {
                state = State.DONE;
                return body.toByteArray();
            }

            body.write(pendingEol);
            int eol = LineInputStream.eolLength(line);
            body.write(line, 0, line.length - eol);
            pendingEol = new byte[eol];
            System.arraycopy(line, line.length - eol, pendingEol, 0, eol);
        }

        // No delimiter before end of input.
        body.write(pendingEol);
        state = State.TRUNCATED;
        return body.toByteArray();
    }

    private enum Delimiter {
        NONE, OPEN, CLOSE
    }

    /**
     * Matches a line against the delimiter, allowing trailing whitespace.
     *
     * @param line Line bytes with EOL.
     * @return Delimiter kind.
     */
    private Delimiter match(byte[] line) {
        int end = line.length - LineInputStream.eolLength(line);
        while (end > 0 && (line[end - 1] == ' ' || line[end - 1] == '\t')) {
            end--;
        }

        if (end < delimiter.length) {
            return Delimiter.NONE;
        }
        for (int i = 0; i < delimiter.length; i++) {
            if (line[i] != delimiter[i]) {
                return Delimiter.NONE;
            }
        }

        if (end == delimiter.length) {
            return Delimiter.OPEN;
        }
        if (end == delimiter.length + 2 && line[end - 1] == '-' && line[end - 2] == '-') {
            return Delimiter.CLOSE;
        }
        return Delimiter.NONE;
    }
}
