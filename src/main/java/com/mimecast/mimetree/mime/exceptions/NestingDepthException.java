package com.mimecast.mimetree.mime.exceptions;

/**
 * Multipart nesting deeper than the configured limit.
 */
public class NestingDepthException extends MimeException {
    private final int maxDepth;

    /**
     * Constructs a new NestingDepthException instance.
     *
     * @param maxDepth Configured limit.
     * @param boundary Boundary that would exceed it.
     */
    public NestingDepthException(int maxDepth, String boundary) {
        super("Multipart nesting exceeds " + maxDepth + " levels at boundary " + boundary);
        this.maxDepth = maxDepth;
    }

    /**
     * Gets the configured limit.
     *
     * @return Integer.
     */
    public int getMaxDepth() {
        return maxDepth;
    }
}
