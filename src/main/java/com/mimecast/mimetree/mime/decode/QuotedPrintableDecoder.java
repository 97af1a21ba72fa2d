package com.mimecast.mimetree.mime.decode;

import java.io.ByteArrayOutputStream;

/**
 * Lenient quoted-printable decoder.
 *
 * <p>Works on the full 8-bit byte range rather than strict 7-bit input:
 * <ul>
 *     <li>{@code =XX} in either hex case becomes the byte.</li>
 *     <li>{@code =} before a line break is a soft break and is removed with the break.</li>
 *     <li>Malformed {@code =} sequences are kept literally.</li>
 *     <li>Spaces and tabs before a hard line break are transport padding and are dropped.</li>
 *     <li>Bytes above 0x7F pass through unchanged.</li>
 * </ul>
 *
 * @see <a href="https://www.rfc-editor.org/rfc/rfc2045#section-6.7">RFC 2045 6.7</a>
 */
public final class QuotedPrintableDecoder {

    private static final byte ESCAPE = '=';
    private static final byte CR = '\r';
    private static final byte LF = '\n';

    /**
     * Private constructor.
     */
    private QuotedPrintableDecoder() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Decodes quoted-printable bytes.
     *
     * @param bytes Encoded bytes.
     * @return Decoded bytes.
     */
    public static byte[] decode(byte[] bytes) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length);

        // Whitespace is held back until we know it is not trailing.
        int pendingFrom = -1;

        int i = 0;
        while (i < bytes.length) {
            byte b = bytes[i];

            if (b == ' ' || b == '\t') {
                if (pendingFrom == -1) {
                    pendingFrom = i;
                }
                i++;
                continue;
            }

            if (b == CR || b == LF) {
                // Hard line break drops padding.
                pendingFrom = -1;
                out.write(b);
                i++;
                continue;
            }

            if (pendingFrom != -1) {
                out.write(bytes, pendingFrom, i - pendingFrom);
                pendingFrom = -1;
            }

            if (b != ESCAPE) {
                out.write(b);
                i++;
                continue;
            }

            // Soft line break, possibly after padding.
            int next = i + 1;
            while (next < bytes.length && (bytes[next] == ' ' || bytes[next] == '\t')) {
                next++;
            }
            if (next == bytes.length) {
                i = next;
                continue;
            }
            if (bytes[next] == CR || bytes[next] == LF) {
                i = next + (bytes[next] == CR && next + 1 < bytes.length && bytes[next + 1] == LF ? 2 : 1);
                continue;
            }

            if (i + 2 < bytes.length) {
                int high = Character.digit(bytes[i + 1], 16);
                int low = Character.digit(bytes[i + 2], 16);
                if (high != -1 && low != -1) {
                    out.write((high << 4) | low);
                    i += 3;
                    continue;
                }
            }

            // Not an escape, keep it.
            out.write(b);
            i++;
        }

        // Padding still pending at end of input is dropped.
        return out.toByteArray();
    }
}
