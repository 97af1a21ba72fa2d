package com.mimecast.mimetree.mime;

import com.mimecast.mimetree.config.ParserConfig;
import com.mimecast.mimetree.io.LineInputStream;
import com.mimecast.mimetree.main.Config;
import com.mimecast.mimetree.mime.decode.CharsetRegistry;
import com.mimecast.mimetree.mime.decode.ContentDecoder;
import com.mimecast.mimetree.mime.decode.JdkCharsetRegistry;
import com.mimecast.mimetree.mime.exceptions.BoundaryException;
import com.mimecast.mimetree.mime.headers.HeaderReader;
import com.mimecast.mimetree.mime.headers.MediaType;
import com.mimecast.mimetree.mime.headers.MimeHeaders;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * MimeParser reads a MIME document into a tree of {@link MimePart} objects.
 * <p>
 * This parser handles:
 * <ul>
 *     <li>Multi-line headers with folding support</li>
 *     <li>Single part and arbitrarily nested multipart documents, up to a configured depth</li>
 *     <li>Base64 (with stray byte cleaning), Quoted-Printable and identity transfer encodings</li>
 *     <li>Charset conversion of decoded text to UTF-8</li>
 *     <li>RFC 2047 encoded file names in Content-Disposition and Content-Type</li>
 *     <li>A last part closed with a plain delimiter instead of the close delimiter</li>
 * </ul>
 * <p>
 * The whole tree is built in memory by one call and any failure aborts it.
 * A parser instance holds no per-parse state and may be shared between threads.
 * <p>
 * Example usage:
 * <pre>
 * MimePart root = new MimeParser().parse("/path/to/email.eml");
 * for (MimePart part = root.getFirstChild(); part != null; part = part.getNextSibling()) {
 *     System.out.println(part.getContentType() + " " + part.getFileName());
 * }
 * </pre>
 *
 * @see MimePart
 * @see ParserConfig
 */
public class MimeParser {
    private static final Logger log = LogManager.getLogger(MimeParser.class);

    private final ContentDecoder decoder;
    private final PartTreeBuilder builder;
    private final int bufferSize;

    /**
     * Constructs a new MimeParser instance with the global parser configuration.
     *
     * @see Config#getParser()
     */
    public MimeParser() {
        this(Config.getParser());
    }

    /**
     * Constructs a new MimeParser instance.
     *
     * @param config ParserConfig instance.
     */
    public MimeParser(ParserConfig config) {
        this(config, new JdkCharsetRegistry(config.getCharsetAliases()));
    }

    /**
     * Constructs a new MimeParser instance with a custom charset registry.
     *
     * @param config   ParserConfig instance.
     * @param charsets CharsetRegistry instance.
     */
    public MimeParser(ParserConfig config, CharsetRegistry charsets) {
        Objects.requireNonNull(config, "config");
        this.decoder = new ContentDecoder(charsets);
        this.builder = new PartTreeBuilder(decoder, config.getMaxDepth(), config.isRepairContentTypeParameters());
        this.bufferSize = config.getBufferSize();
    }

    /**
     * Parses a MIME document file.
     *
     * @param path Path to the file (.eml format).
     * @return Root MimePart.
     * @throws IOException Unable to read or parse.
     */
    public MimePart parse(String path) throws IOException {
        try (InputStream input = new FileInputStream(path)) {
            return parse(input);
        }
    }

    /**
     * Parses a MIME document held in memory.
     *
     * @param bytes Document bytes.
     * @return Root MimePart.
     * @throws IOException Unable to parse.
     */
    public MimePart parse(byte[] bytes) throws IOException {
        return parse(new ByteArrayInputStream(bytes));
    }

    /**
     * Parses a MIME document from a stream.
     * <p>The stream is read to its end and left open.
     *
     * @param input Stream positioned at the start of the document.
     * @return Root MimePart.
     * @throws IOException Unable to read or parse.
     */
    public MimePart parse(InputStream input) throws IOException {
        LineInputStream stream = new LineInputStream(input, bufferSize);

        MimeHeaders headers = HeaderReader.read(stream);
        MediaType type = MediaType.parse(headers.getValue("Content-Type"));

        MimePart root = new MimePart(null, type.getValue());
        root.setHeaders(headers);
        PartTreeBuilder.resolveFileName(root, headers, type);

        if (type.isMultipart()) {
            String boundary = type.getParameter("boundary");
            if (boundary.isEmpty()) {
                throw new BoundaryException("", type.getValue() + " without boundary parameter", false);
            }

            log.debug("Parsing {} with boundary: {}", type.getValue(), boundary);
            root.setMultipart(true);
            builder.build(root, stream, boundary, 1);

        } else {
            root.setContent(decoder.decode(headers.getValue("Content-Transfer-Encoding"),
                    PartTreeBuilder.charset(headers, type), stream));
        }

        return root;
    }
}
