/**
 * Deals with the headers of a MIME message.
 *
 * <p>This package contains classes for working with MIME headers, including:
 * <ul>
 *   <li>{@link com.mimecast.mimetree.mime.headers.MimeHeader} - Container for individual MIME headers</li>
 *   <li>{@link com.mimecast.mimetree.mime.headers.MimeHeaders} - Ordered, case-insensitive multi-map of headers</li>
 *   <li>{@link com.mimecast.mimetree.mime.headers.HeaderReader} - Reads and unfolds a header block</li>
 *   <li>{@link com.mimecast.mimetree.mime.headers.MediaType} - Content-Type and Content-Disposition values</li>
 *   <li>{@link com.mimecast.mimetree.mime.headers.HeaderWordDecoder} - RFC 2047 encoded-word decoding</li>
 * </ul>
 */
package com.mimecast.mimetree.mime.headers;
