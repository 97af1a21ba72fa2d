package com.mimecast.mimetree.mime;

import com.mimecast.mimetree.mime.decode.ContentDecoder;
import com.mimecast.mimetree.mime.exceptions.BoundaryException;
import com.mimecast.mimetree.mime.exceptions.EmptyHeaderException;
import com.mimecast.mimetree.mime.exceptions.MediaTypeParseException;
import com.mimecast.mimetree.mime.exceptions.MissingContentTypeException;
import com.mimecast.mimetree.mime.exceptions.NestingDepthException;
import com.mimecast.mimetree.mime.headers.HeaderReader;
import com.mimecast.mimetree.mime.headers.HeaderWordDecoder;
import com.mimecast.mimetree.mime.headers.MediaType;
import com.mimecast.mimetree.mime.headers.MimeHeaders;
import com.mimecast.mimetree.mime.multipart.MultipartSplitter;
import com.mimecast.mimetree.mime.multipart.RawPart;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;

/**
 * Recursive descent over multipart boundaries.
 *
 * <p>Each call handles one boundary level: it pulls raw sub-parts from a {@link MultipartSplitter},
 * <br>links a {@link MimePart} per sub-part under the parent in document order,
 * <br>and either recurses into nested multiparts or decodes leaf bodies.
 * <p>Any failure other than an unparsable Content-Disposition aborts the whole tree.
 */
class PartTreeBuilder {
    private static final Logger log = LogManager.getLogger(PartTreeBuilder.class);

    private final ContentDecoder decoder;
    private final int maxDepth;
    private final boolean repairContentType;

    /**
     * Constructs a new PartTreeBuilder instance.
     *
     * @param decoder           ContentDecoder instance.
     * @param maxDepth          Deepest nesting level accepted.
     * @param repairContentType Lift Content-Type parameters into header fields.
     */
    PartTreeBuilder(ContentDecoder decoder, int maxDepth, boolean repairContentType) {
        this.decoder = decoder;
        this.maxDepth = maxDepth;
        this.repairContentType = repairContentType;
    }

    /**
     * Builds the children of a multipart part.
     *
     * @param parent   Container part.
     * @param body     Multipart body.
     * @param boundary Boundary parameter.
     * @param depth    Nesting level of the children, 1 under the root.
     * @throws IOException Any parse failure.
     */
    void build(MimePart parent, InputStream body, String boundary, int depth) throws IOException {
        if (depth > maxDepth) {
            throw new NestingDepthException(maxDepth, boundary);
        }

        MultipartSplitter splitter = new MultipartSplitter(body, boundary);
        MimePart prevSibling = null;

        RawPart raw;
        while ((raw = splitter.nextPart()) != null) {
            MimeHeaders headers = raw.getHeaders();

            if (headers.isEmpty()) {
                // Most likely the last part was closed with --boundary instead of --boundary--.
                if (isEndOfParts(splitter)) {
                    log.warn("Tolerating missing close delimiter at boundary: {}", boundary);
                    break;
                }
                throw new EmptyHeaderException(boundary);
            }

            if (repairContentType) {
                repairContentTypeParameters(headers);
            }

            String contentType = headers.getValue("Content-Type");
            if (contentType.isEmpty()) {
                throw new MissingContentTypeException(boundary);
            }
            MediaType type = MediaType.parse(contentType);

            MimePart part = new MimePart(parent, type.getValue());
            part.setHeaders(headers);
            if (prevSibling != null) {
                prevSibling.setNextSibling(part);
            } else {
                parent.setFirstChild(part);
            }
            prevSibling = part;

            resolveFileName(part, headers, type);

            String nested = type.getParameter("boundary");
            if (!nested.isEmpty()) {
                log.debug("Descending into {} at depth {} with boundary: {}", type.getValue(), depth + 1, nested);
                part.setMultipart(true);
                build(part, raw.getBody(), nested, depth + 1);
            } else {
                part.setContent(decoder.decode(headers.getValue("Content-Transfer-Encoding"), charset(headers, type), raw.getBody()));
                log.debug("Part {} at depth {}: {}", type.getValue(), depth, part);
            }
        }
    }

    /**
     * Looks one part past an empty header.
     *
     * @param splitter MultipartSplitter instance.
     * @return True if parts end there.
     * @throws EmptyHeaderException Another part or another failure follows.
     */
    private boolean isEndOfParts(MultipartSplitter splitter) throws EmptyHeaderException {
        try {
            return splitter.nextPart() == null;

        } catch (BoundaryException e) {
            if (e.isUnexpectedEnd()) {
                return true;
            }
            throw new EmptyHeaderException(splitter.getBoundary(), e);

        } catch (IOException e) {
            throw new EmptyHeaderException(splitter.getBoundary(), e);
        }
    }

    /**
     * Lifts {@code name=value} segments of a {@code "; "} split Content-Type into header fields.
     * <p>Fields already present are left as they are.
     *
     * @param headers Part headers.
     */
    static void repairContentTypeParameters(MimeHeaders headers) {
        String[] segments = headers.getValue("Content-Type").split("; ");
        for (int i = 1; i < segments.length; i++) {
            int idx = segments[i].indexOf('=');
            if (idx == -1) {
                continue;
            }

            String name = segments[i].substring(0, idx).trim();
            if (HeaderReader.isFieldName(name) && !headers.contains(name)) {
                headers.add(name, segments[i].substring(idx + 1).trim());
            }
        }
    }

    /**
     * Sets disposition and file name.
     * <p>The disposition filename wins over the type name parameter.
     * <br>An unparsable Content-Disposition only leaves the disposition empty.
     *
     * @param part    MimePart instance.
     * @param headers Part headers.
     * @param type    Parsed Content-Type.
     */
    static void resolveFileName(MimePart part, MimeHeaders headers, MediaType type) {
        String value = headers.getValue("Content-Disposition");
        if (!value.isEmpty()) {
            try {
                MediaType disposition = MediaType.parseDisposition(value);
                part.setDisposition(disposition.getValue());
                part.setFileName(HeaderWordDecoder.decode(disposition.getParameter("filename")));

            } catch (MediaTypeParseException e) {
                log.warn("Ignoring Content-Disposition: {}", e.getMessage());
            }
        }

        if (part.getFileName().isEmpty() && !type.getParameter("name").isEmpty()) {
            part.setFileName(HeaderWordDecoder.decode(type.getParameter("name")));
        }
    }

    /**
     * Gets charset from the type parameter, else from a charset header field.
     *
     * @param headers Part headers.
     * @param type    Parsed Content-Type.
     * @return Charset name or empty string.
     */
    static String charset(MimeHeaders headers, MediaType type) {
        String charset = type.getParameter("charset");
        if (StringUtils.isBlank(charset)) {
            charset = StringUtils.strip(headers.getValue("charset"), " \"'");
        }
        return StringUtils.trimToEmpty(charset);
    }
}
