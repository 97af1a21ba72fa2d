/**
 * Content decoding of MIME part bodies.
 *
 * <p>{@link com.mimecast.mimetree.mime.decode.ContentDecoder} undoes the transfer encoding
 * <br>and converts text to UTF-8 through a {@link com.mimecast.mimetree.mime.decode.CharsetRegistry}.
 * <p>Base64 bodies are cleaned of stray bytes first by {@link com.mimecast.mimetree.mime.decode.Base64CleanerInputStream}.
 */
package com.mimecast.mimetree.mime.decode;
