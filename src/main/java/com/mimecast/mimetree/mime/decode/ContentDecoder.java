package com.mimecast.mimetree.mime.decode;

import com.mimecast.mimetree.mime.exceptions.TransferEncodingException;
import com.mimecast.mimetree.mime.exceptions.UnsupportedCharsetException;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * Part body decoding pipeline.
 *
 * <p>Applies the Content-Transfer-Encoding first:
 * <ul>
 *     <li>quoted-printable: {@link QuotedPrintableDecoder}</li>
 *     <li>base64: {@link Base64CleanerInputStream} then commons-codec base64, failing on data after padding</li>
 *     <li>anything else: bytes as they are</li>
 * </ul>
 * <p>Then, when a charset is given, converts the text from that charset to UTF-8.
 * <p>The whole body is decoded in memory.
 */
public class ContentDecoder {
    private static final Logger log = LogManager.getLogger(ContentDecoder.class);

    /**
     * Charset name resolver.
     */
    private final CharsetRegistry charsets;

    /**
     * Constructs a new ContentDecoder instance.
     *
     * @param charsets CharsetRegistry instance.
     */
    public ContentDecoder(CharsetRegistry charsets) {
        this.charsets = Objects.requireNonNull(charsets, "charsets");
    }

    /**
     * Decodes a body.
     *
     * @param encoding Content-Transfer-Encoding value, may be empty.
     * @param charset  Charset name, may be empty.
     * @param body     Raw body stream, read to its end and left open.
     * @return Decoded bytes.
     * @throws TransferEncodingException   Base64 data continues after padding.
     * @throws UnsupportedCharsetException Charset not known to the registry.
     * @throws IOException                 Unable to read.
     */
    public byte[] decode(String encoding, String charset, InputStream body) throws IOException {
        byte[] bytes;
        switch (StringUtils.trimToEmpty(encoding).toLowerCase(Locale.ROOT)) {
            case "quoted-printable":
                bytes = QuotedPrintableDecoder.decode(IOUtils.toByteArray(body));
                break;

            case "base64":
                bytes = decodeBase64(IOUtils.toByteArray(new Base64CleanerInputStream(body)));
                break;

            default:
                bytes = IOUtils.toByteArray(body);
                break;
        }

        if (StringUtils.isNotBlank(charset)) {
            bytes = toUtf8(bytes, charset);
        }

        log.debug("Decoded {} bytes with encoding: {} charset: {}", bytes.length, encoding, charset);
        return bytes;
    }

    /**
     * Decodes a body held in memory.
     *
     * @param encoding Content-Transfer-Encoding value, may be empty.
     * @param charset  Charset name, may be empty.
     * @param body     Raw body bytes.
     * @return Decoded bytes.
     * @throws IOException Unsupported charset or decoding failure.
     */
    public byte[] decode(String encoding, String charset, byte[] body) throws IOException {
        return decode(encoding, charset, new ByteArrayInputStream(body));
    }

    /**
     * Decodes cleaned base64.
     * <p>Padding may only end the data.
     *
     * @param clean Base64 alphabet bytes.
     * @return Decoded bytes.
     * @throws TransferEncodingException Data after padding.
     */
    private static byte[] decodeBase64(byte[] clean) throws TransferEncodingException {
        boolean padded = false;
        for (int i = 0; i < clean.length; i++) {
            if (clean[i] == '=') {
                padded = true;
            } else if (padded) {
                throw new TransferEncodingException("base64", "data after padding at offset " + i);
            }
        }

        return Base64.decodeBase64(clean);
    }

    /**
     * Converts text bytes from the named charset to UTF-8.
     *
     * @param bytes   Text bytes.
     * @param charset Charset name.
     * @return UTF-8 bytes.
     * @throws UnsupportedCharsetException Charset not known to the registry.
     */
    private byte[] toUtf8(byte[] bytes, String charset) throws UnsupportedCharsetException {
        Charset source = charsets.lookup(charset)
                .orElseThrow(() -> new UnsupportedCharsetException(charset));

        return new String(bytes, source).getBytes(StandardCharsets.UTF_8);
    }
}
