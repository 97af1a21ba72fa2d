package com.mimecast.mimetree.mime;

import com.mimecast.mimetree.mime.headers.MimeHeaders;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of a parsed MIME tree.
 *
 * <p>Each part carries its headers, the Content-Type and Content-Disposition without parameters,
 * <br>the resolved file name and the decoded content.
 * <br>Text content is always UTF-8 once a charset has been applied.
 * <br>Multipart containers have empty content and hold their payload in child parts.
 *
 * <p>Parts are linked by parent, first child and next sibling in document order.
 * <br>A tree is built once by {@link MimeParser} and not changed afterwards.
 */
public class MimePart {
    private final MimePart parent;
    private MimePart firstChild;
    private MimePart nextSibling;

    private final String contentType;
    private MimeHeaders headers = new MimeHeaders();
    private String disposition = "";
    private String fileName = "";
    private byte[] content = new byte[0];
    private boolean multipart = false;

    /**
     * Constructs a new MimePart instance.
     * <p>Does not link itself into the parent's children.
     *
     * @param parent      Parent part or null for the root.
     * @param contentType Media type without parameters.
     */
    MimePart(MimePart parent, String contentType) {
        this.parent = parent;
        this.contentType = contentType;
    }

    /**
     * Gets parent part.
     *
     * @return MimePart instance or null for the root.
     */
    public MimePart getParent() {
        return parent;
    }

    /**
     * Gets first child.
     *
     * @return MimePart instance or null.
     */
    public MimePart getFirstChild() {
        return firstChild;
    }

    /**
     * Gets next sibling.
     *
     * @return MimePart instance or null.
     */
    public MimePart getNextSibling() {
        return nextSibling;
    }

    /**
     * Gets children in document order.
     *
     * @return Unmodifiable list of MimePart.
     */
    public List<MimePart> getChildren() {
        List<MimePart> children = new ArrayList<>();
        for (MimePart child = firstChild; child != null; child = child.nextSibling) {
            children.add(child);
        }
        return Collections.unmodifiableList(children);
    }

    /**
     * Gets depth below the root.
     *
     * @return 0 for the root.
     */
    public int getDepth() {
        int depth = 0;
        for (MimePart p = parent; p != null; p = p.parent) {
            depth++;
        }
        return depth;
    }

    /**
     * Gets headers.
     *
     * @return Copy of the part headers.
     */
    public MimeHeaders getHeaders() {
        return new MimeHeaders(headers);
    }

    /**
     * Gets first value of a header.
     *
     * @param name Header name, case-insensitive.
     * @return Value or empty string.
     */
    public String getHeader(String name) {
        return headers.getValue(name);
    }

    /**
     * Gets Content-Type without parameters.
     *
     * @return Lower-case media type such as {@code text/plain}.
     */
    public String getContentType() {
        return contentType;
    }

    /**
     * Is multipart container.
     * <p>True only for parts parsed as boundary groups.
     * <br>A multipart type without a boundary is decoded as a leaf and is not a container.
     *
     * @return Boolean.
     */
    public boolean isMultipart() {
        return multipart;
    }

    /**
     * Gets Content-Disposition without parameters.
     *
     * @return Lower-case disposition or empty string.
     */
    public String getDisposition() {
        return disposition;
    }

    /**
     * Gets file name from the disposition or type header.
     *
     * @return Decoded file name or empty string.
     */
    public String getFileName() {
        return fileName;
    }

    /**
     * Gets decoded content.
     *
     * @return Copy of the content bytes, empty for containers.
     */
    public byte[] getContent() {
        return content.clone();
    }

    /**
     * Gets decoded content size.
     *
     * @return Byte count.
     */
    public int getSize() {
        return content.length;
    }

    /**
     * Gets decoded content as UTF-8 text.
     *
     * @return String.
     */
    public String getContentAsString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    void setFirstChild(MimePart firstChild) {
        this.firstChild = firstChild;
    }

    void setNextSibling(MimePart nextSibling) {
        this.nextSibling = nextSibling;
    }

    void setHeaders(MimeHeaders headers) {
        this.headers = headers;
    }

    void setDisposition(String disposition) {
        this.disposition = disposition;
    }

    void setFileName(String fileName) {
        this.fileName = fileName;
    }

    void setMultipart(boolean multipart) {
        this.multipart = multipart;
    }

    void setContent(byte[] content) {
        this.content = content;
    }

    @Override
    public String toString() {
        return "MimePart{" +
                "contentType='" + contentType + '\'' +
                ", disposition='" + disposition + '\'' +
                ", fileName='" + fileName + '\'' +
                ", size=" + content.length +
                '}';
    }
}
