/**
 * Checked failures raised while parsing a MIME document.
 *
 * <p>Every class extends {@link com.mimecast.mimetree.mime.exceptions.MimeException}, itself an IOException.
 * <br>Any of them aborts the whole parse; no partial tree is returned.
 */
package com.mimecast.mimetree.mime.exceptions;
