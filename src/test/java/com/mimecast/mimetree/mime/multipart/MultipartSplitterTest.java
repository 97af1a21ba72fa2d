package com.mimecast.mimetree.mime.multipart;

import com.mimecast.mimetree.mime.exceptions.BoundaryException;
import org.apache.commons.io.IOUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MultipartSplitterTest {

    private static MultipartSplitter splitter(String body) {
        return new MultipartSplitter(new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)), "b");
    }

    private static String body(RawPart part) throws IOException {
        return IOUtils.toString(part.getBody(), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Preamble and epilogue are skipped")
    void preambleEpilogue() throws IOException {
        MultipartSplitter splitter = splitter("This is a preamble.\r\n" +
                "--b\r\n" +
                "Content-Type: text/plain\r\n" +
                "\r\n" +
                "one\r\n" +
                "--b\r\n" +
                "Content-Type: text/html\r\n" +
                "\r\n" +
                "<b>two</b>\r\n" +
                "--b--\r\n" +
                "This is an epilogue.\r\n" +
                "--b\r\n");

        RawPart first = splitter.nextPart();
        assertEquals("text/plain", first.getHeaders().getValue("content-type"));
        assertEquals("one", body(first));

        RawPart second = splitter.nextPart();
        assertEquals("text/html", second.getHeaders().getValue("Content-Type"));
        assertEquals("<b>two</b>", body(second));
        assertEquals(10, second.getSize());

        assertNull(splitter.nextPart());
        assertNull(splitter.nextPart());
        assertEquals("b", splitter.getBoundary());
    }

    @Test
    @DisplayName("Only the EOL before a delimiter is stripped")
    void innerLineBreaks() throws IOException {
        MultipartSplitter splitter = splitter("--b\n" +
                "Content-Type: text/plain\n" +
                "\n" +
                "line one\n" +
                "\n" +
                "line three\n" +
                "\n" +
                "--b--\n");

        assertEquals("line one\n\nline three\n", body(splitter.nextPart()));
        assertNull(splitter.nextPart());
    }

    @Test
    @DisplayName("Delimiters may carry trailing whitespace")
    void delimiterPadding() throws IOException {
        MultipartSplitter splitter = splitter("--b \t\r\n" +
                "Content-Type: text/plain\r\n" +
                "\r\n" +
                "--bogus\r\n" +
                "--b-- \r\n");

        assertEquals("--bogus", body(splitter.nextPart()));
        assertNull(splitter.nextPart());
    }

    @Test
    @DisplayName("Trailing plain delimiter yields an empty header part then ends")
    void trailingDelimiter() throws IOException {
        MultipartSplitter splitter = splitter("--b\r\n" +
                "Content-Type: text/plain\r\n" +
                "\r\n" +
                "one\r\n" +
                "--b\r\n");

        assertEquals("one", body(splitter.nextPart()));

        RawPart artifact = splitter.nextPart();
        assertTrue(artifact.getHeaders().isEmpty());
        assertEquals(0, artifact.getSize());

        assertNull(splitter.nextPart());
    }

    @Test
    @DisplayName("Input ending inside a body fails the following pull")
    void truncated() throws IOException {
        MultipartSplitter splitter = splitter("--b\r\n" +
                "Content-Type: text/plain\r\n" +
                "\r\n" +
                "cut short");

        assertEquals("cut short", body(splitter.nextPart()));

        BoundaryException e = assertThrows(BoundaryException.class, splitter::nextPart);
        assertTrue(e.isUnexpectedEnd());
        assertEquals("b", e.getBoundary());

        assertNull(splitter.nextPart());
    }

    @Test
    @DisplayName("Malformed sub-part headers surface as boundary errors")
    void malformedHeader() {
        MultipartSplitter splitter = splitter("--b\r\n" +
                "no colon here\r\n" +
                "\r\n" +
                "body\r\n" +
                "--b--\r\n");

        BoundaryException e = assertThrows(BoundaryException.class, splitter::nextPart);
        assertFalse(e.isUnexpectedEnd());
    }

    @Test
    @DisplayName("No delimiter at all is a clean empty end")
    void noDelimiter() throws IOException {
        assertNull(splitter("just text\r\nand more\r\n").nextPart());
        assertNull(splitter("").nextPart());
        assertNull(splitter("preamble\r\n--b--\r\n").nextPart());
    }

    @Test
    @DisplayName("Longer boundaries sharing the prefix are body text")
    void prefixBoundary() throws IOException {
        MultipartSplitter splitter = splitter("--b\r\n" +
                "Content-Type: text/plain\r\n" +
                "\r\n" +
                "--bb\r\n" +
                "--b---\r\n" +
                "--b--\r\n");

        assertEquals("--bb\r\n--b---", body(splitter.nextPart()));
        assertNull(splitter.nextPart());
    }
}
