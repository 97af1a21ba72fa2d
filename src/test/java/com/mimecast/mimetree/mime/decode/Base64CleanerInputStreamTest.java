package com.mimecast.mimetree.mime.decode;

import org.apache.commons.io.IOUtils;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class Base64CleanerInputStreamTest {

    private static InputStream cleaner(String content) {
        return new Base64CleanerInputStream(new ByteArrayInputStream(content.getBytes(StandardCharsets.ISO_8859_1)));
    }

    @Test
    void dropsLineBreaksAndPunctuation() throws IOException {
        byte[] cleaned = IOUtils.toByteArray(cleaner("SGVs\r\nbG8g!V29y\tbGQ=\r\n"));

        assertEquals("SGVsbG8gV29ybGQ=", new String(cleaned, StandardCharsets.US_ASCII));
    }

    @Test
    void singleByteReads() throws IOException {
        InputStream stream = cleaner("\r\nA-Bé=");

        assertEquals('A', stream.read());
        assertEquals('B', stream.read());
        assertEquals('=', stream.read());
        assertEquals(-1, stream.read());
    }

    @Test
    void bulkReadSkipsChunksWithoutAlphabet() throws IOException {
        InputStream stream = cleaner("!!!!\r\n\r\n....QQ==");
        byte[] buffer = new byte[4];

        int read = stream.read(buffer, 0, buffer.length);

        assertTrue(read > 0);
        assertEquals('Q', buffer[0]);
    }

    @Test
    void onlyJunk() throws IOException {
        assertEquals(0, IOUtils.toByteArray(cleaner("\r\n!!\r\n")).length);
    }

    @Test
    void alphabet() {
        assertTrue(Base64CleanerInputStream.isBase64('a'));
        assertTrue(Base64CleanerInputStream.isBase64('Z'));
        assertTrue(Base64CleanerInputStream.isBase64('9'));
        assertTrue(Base64CleanerInputStream.isBase64('+'));
        assertTrue(Base64CleanerInputStream.isBase64('/'));
        assertTrue(Base64CleanerInputStream.isBase64('='));
        assertFalse(Base64CleanerInputStream.isBase64('\n'));
        assertFalse(Base64CleanerInputStream.isBase64('-'));
        assertFalse(Base64CleanerInputStream.isBase64(0xE9));
        assertFalse(Base64CleanerInputStream.isBase64(-1));
    }
}
