/**
 * Everything required for parsing MIME documents into part trees.
 *
 * <p>The {@link com.mimecast.mimetree.mime.MimeParser} reads a document and returns its root
 * <br>{@link com.mimecast.mimetree.mime.MimePart}, linked to its children by first child and next sibling.
 * <br>Features include:
 * <ul>
 *     <li>Nested multipart structures with a nesting depth limit</li>
 *     <li>Content encodings (Base64, Quoted-Printable) and charset conversion to UTF-8</li>
 *     <li>Disposition and file name resolution with RFC 2047 decoding</li>
 *     <li>Tolerance for a missing close delimiter on the last part</li>
 * </ul>
 *
 * <p>The {@link com.mimecast.mimetree.mime.PartMatcher} searches a parsed tree breadth or depth first.
 *
 * @see com.mimecast.mimetree.mime.MimeParser
 * @see com.mimecast.mimetree.mime.headers.MimeHeaders
 * @see com.mimecast.mimetree.mime.decode.ContentDecoder
 */
package com.mimecast.mimetree.mime;
