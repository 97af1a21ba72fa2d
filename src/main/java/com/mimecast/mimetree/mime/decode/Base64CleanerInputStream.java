package com.mimecast.mimetree.mime.decode;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Input stream dropping every byte outside the base64 alphabet.
 *
 * <p>Sits between a raw part body and the base64 decoder.
 * <br>Line breaks and stray punctuation some mail agents leave in base64 bodies are removed
 * <br>so the decoder only ever sees {@code A-Z a-z 0-9 + / =}.
 */
public class Base64CleanerInputStream extends FilterInputStream {

    /**
     * Base64 alphabet lookup including padding.
     */
    private static final boolean[] ALPHABET = new boolean[256];

    static {
        for (int c = 'A'; c <= 'Z'; c++) ALPHABET[c] = true;
        for (int c = 'a'; c <= 'z'; c++) ALPHABET[c] = true;
        for (int c = '0'; c <= '9'; c++) ALPHABET[c] = true;
        ALPHABET['+'] = true;
        ALPHABET['/'] = true;
        ALPHABET['='] = true;
    }

    /**
     * Constructs a new Base64CleanerInputStream instance.
     *
     * @param in InputStream instance.
     */
    public Base64CleanerInputStream(InputStream in) {
        super(in);
    }

    /**
     * Checks byte is in the base64 alphabet.
     *
     * @param b Byte value 0-255.
     * @return Boolean.
     */
    public static boolean isBase64(int b) {
        return b >= 0 && b < 256 && ALPHABET[b];
    }

    @Override
    public int read() throws IOException {
        int b;
        do {
            b = in.read();
        } while (b != -1 && !ALPHABET[b]);
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }

        // Keep reading until at least one alphabet byte is available or the source ends.
        while (true) {
            int read = in.read(b, off, len);
            if (read == -1) {
                return -1;
            }

            int kept = 0;
            for (int i = off; i < off + read; i++) {
                if (ALPHABET[b[i] & 0xFF]) {
                    b[off + kept++] = b[i];
                }
            }

            if (kept > 0) {
                return kept;
            }
        }
    }

    @Override
    public long skip(long n) throws IOException {
        long skipped = 0;
        while (skipped < n && read() != -1) {
            skipped++;
        }
        return skipped;
    }

    @Override
    public int available() {
        return 0;
    }

    @Override
    public boolean markSupported() {
        return false;
    }
}
