package com.mimecast.mimetree.mime.multipart;

import com.mimecast.mimetree.mime.headers.MimeHeaders;

import java.io.ByteArrayInputStream;
import java.io.InputStream;

/**
 * Undecoded sub-part of a multipart body: its header block and raw body bytes.
 */
public class RawPart {
    private final MimeHeaders headers;
    private final byte[] body;

    /**
     * Constructs a new RawPart instance.
     *
     * @param headers MimeHeaders instance.
     * @param body    Raw body bytes.
     */
    public RawPart(MimeHeaders headers, byte[] body) {
        this.headers = headers;
        this.body = body;
    }

    /**
     * Gets headers.
     *
     * @return MimeHeaders instance.
     */
    public MimeHeaders getHeaders() {
        return headers;
    }

    /**
     * Gets body size.
     *
     * @return Byte count.
     */
    public int getSize() {
        return body.length;
    }

    /**
     * Gets body as a fresh stream.
     *
     * @return InputStream instance.
     */
    public InputStream getBody() {
        return new ByteArrayInputStream(body);
    }
}
