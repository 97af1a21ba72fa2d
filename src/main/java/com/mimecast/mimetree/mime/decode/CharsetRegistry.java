package com.mimecast.mimetree.mime.decode;

import java.nio.charset.Charset;
import java.util.Optional;

/**
 * Resolves charset names found in MIME headers.
 *
 * <p>Implementations must be safe for concurrent reads.
 */
public interface CharsetRegistry {

    /**
     * Looks up a charset by name, case-insensitive.
     *
     * @param name Charset name such as {@code iso-8859-1}.
     * @return Optional of Charset, empty if unknown.
     */
    Optional<Charset> lookup(String name);
}
