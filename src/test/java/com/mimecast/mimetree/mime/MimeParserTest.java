package com.mimecast.mimetree.mime;

import com.mimecast.mimetree.config.ParserConfig;
import com.mimecast.mimetree.mime.exceptions.BoundaryException;
import com.mimecast.mimetree.mime.exceptions.EmptyHeaderException;
import com.mimecast.mimetree.mime.exceptions.HeaderParseException;
import com.mimecast.mimetree.mime.exceptions.MediaTypeParseException;
import com.mimecast.mimetree.mime.exceptions.MimeException;
import com.mimecast.mimetree.mime.exceptions.MissingContentTypeException;
import com.mimecast.mimetree.mime.exceptions.NestingDepthException;
import com.mimecast.mimetree.mime.exceptions.TransferEncodingException;
import com.mimecast.mimetree.mime.exceptions.UnsupportedCharsetException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MimeParserTest {

    private final MimeParser parser = new MimeParser(new ParserConfig());

    private static byte[] eml(String... lines) {
        return (String.join("\r\n", lines) + "\r\n").getBytes(StandardCharsets.UTF_8);
    }

    private static String describe(MimePart part) {
        StringBuilder sb = new StringBuilder()
                .append(part.getContentType()).append('|')
                .append(part.getDisposition()).append('|')
                .append(part.getFileName()).append('|')
                .append(part.getContentAsString());
        for (MimePart child : part.getChildren()) {
            sb.append('(').append(describe(child)).append(')');
        }
        return sb.toString();
    }

    private static final String[] TWO_PARTS = {
            "Content-Type: multipart/mixed; boundary=b",
            "",
            "--b",
            "Content-Type: text/plain",
            "",
            "plain body",
            "--b",
            "Content-Type: text/html",
            "",
            "<p>html body</p>",
            "--b--"
    };

    @Test
    @DisplayName("Siblings link in document order")
    void treeShape() throws IOException {
        MimePart root = parser.parse(eml(TWO_PARTS));

        assertEquals("multipart/mixed", root.getContentType());
        assertNull(root.getParent());
        assertEquals(0, root.getSize());

        MimePart a = root.getFirstChild();
        assertEquals("text/plain", a.getContentType());
        assertEquals("plain body", a.getContentAsString());
        assertSame(root, a.getParent());
        assertEquals(1, a.getDepth());

        MimePart b = a.getNextSibling();
        assertEquals("text/html", b.getContentType());
        assertEquals("<p>html body</p>", b.getContentAsString());
        assertSame(root, b.getParent());
        assertNull(b.getNextSibling());
        assertNull(b.getFirstChild());

        assertEquals(List.of(a, b), root.getChildren());
    }

    @Test
    @DisplayName("Nested multipart containers have no content")
    void nested() throws IOException {
        MimePart root = parser.parse(eml(
                "Content-Type: multipart/mixed; boundary=outer",
                "",
                "--outer",
                "Content-Type: multipart/alternative; boundary=inner",
                "",
                "--inner",
                "Content-Type: text/plain",
                "",
                "text",
                "--inner",
                "Content-Type: text/html",
                "",
                "<b>html</b>",
                "--inner--",
                "--outer--"));

        MimePart alternative = root.getFirstChild();
        assertEquals("multipart/alternative", alternative.getContentType());
        assertTrue(alternative.isMultipart());
        assertEquals(0, alternative.getContent().length);
        assertNull(alternative.getNextSibling());

        MimePart plain = alternative.getFirstChild();
        assertEquals("text/plain", plain.getContentType());
        assertEquals("text", plain.getContentAsString());
        assertEquals(2, plain.getDepth());
        assertSame(alternative, plain.getParent());

        MimePart html = plain.getNextSibling();
        assertEquals("text/html", html.getContentType());
        assertEquals("<b>html</b>", html.getContentAsString());
        assertNull(html.getNextSibling());
    }

    @Test
    @DisplayName("Disposition filename beats the type name parameter")
    void fileNamePrecedence() throws IOException {
        MimePart root = parser.parse(eml(
                "Content-Type: multipart/mixed; boundary=b",
                "",
                "--b",
                "Content-Type: application/octet-stream; name=\"b.txt\"",
                "Content-Disposition: attachment; filename=\"a.txt\"",
                "",
                "x",
                "--b",
                "Content-Type: application/octet-stream; name=\"b.txt\"",
                "",
                "y",
                "--b",
                "Content-Type: application/octet-stream",
                "Content-Disposition: INLINE",
                "",
                "z",
                "--b--"));

        MimePart first = root.getFirstChild();
        assertEquals("a.txt", first.getFileName());
        assertEquals("attachment", first.getDisposition());

        MimePart second = first.getNextSibling();
        assertEquals("b.txt", second.getFileName());
        assertEquals("", second.getDisposition());

        MimePart third = second.getNextSibling();
        assertEquals("", third.getFileName());
        assertEquals("inline", third.getDisposition());
    }

    @Test
    @DisplayName("Unparsable disposition is ignored")
    void badDisposition() throws IOException {
        MimePart root = parser.parse(eml(
                "Content-Type: multipart/mixed; boundary=b",
                "",
                "--b",
                "Content-Type: text/plain; name=fallback.txt",
                "Content-Disposition: ; filename=lost.txt",
                "",
                "body",
                "--b--"));

        MimePart part = root.getFirstChild();
        assertEquals("", part.getDisposition());
        assertEquals("fallback.txt", part.getFileName());
        assertEquals("body", part.getContentAsString());
    }

    @Test
    @DisplayName("Missing close delimiter builds the same tree")
    void trailingBoundary() throws IOException {
        String[] lines = TWO_PARTS.clone();
        lines[lines.length - 1] = "--b";

        assertEquals(describe(parser.parse(eml(TWO_PARTS))), describe(parser.parse(eml(lines))));

        // Blank line after the plain delimiter.
        String[] padded = new String[lines.length + 1];
        System.arraycopy(lines, 0, padded, 0, lines.length);
        padded[lines.length] = "";
        assertEquals(describe(parser.parse(eml(TWO_PARTS))), describe(parser.parse(eml(padded))));
    }

    @Test
    @DisplayName("Body without any closing delimiter fails")
    void truncatedBody() {
        BoundaryException e = assertThrows(BoundaryException.class, () -> parser.parse(eml(
                "Content-Type: multipart/mixed; boundary=b",
                "",
                "--b",
                "Content-Type: text/plain",
                "",
                "cut")));

        assertTrue(e.isUnexpectedEnd());
    }

    @Test
    @DisplayName("Empty header followed by more parts fails")
    void emptyHeader() {
        EmptyHeaderException e = assertThrows(EmptyHeaderException.class, () -> parser.parse(eml(
                "Content-Type: multipart/mixed; boundary=b",
                "",
                "--b",
                "",
                "stray",
                "--b",
                "Content-Type: text/plain",
                "",
                "x",
                "--b--")));

        assertEquals("b", e.getBoundary());
    }

    @Test
    @DisplayName("Sub-part without Content-Type fails")
    void missingContentType() {
        MissingContentTypeException e = assertThrows(MissingContentTypeException.class, () -> parser.parse(eml(
                "Content-Type: multipart/mixed; boundary=b",
                "",
                "--b",
                "Content-Transfer-Encoding: 7bit",
                "",
                "x",
                "--b--")));

        assertEquals("b", e.getBoundary());
    }

    @Test
    @DisplayName("Sub-part with a broken Content-Type fails")
    void badSubPartContentType() {
        assertThrows(MediaTypeParseException.class, () -> parser.parse(eml(
                "Content-Type: multipart/mixed; boundary=b",
                "",
                "--b",
                "Content-Type: text",
                "",
                "x",
                "--b--")));
    }

    @Test
    @DisplayName("Root without Content-Type fails")
    void rootWithoutContentType() {
        MediaTypeParseException e = assertThrows(MediaTypeParseException.class,
                () -> parser.parse(eml("Subject: hello", "", "body")));

        assertEquals("", e.getValue());
    }

    @Test
    @DisplayName("Multipart root without boundary fails")
    void rootWithoutBoundary() {
        assertThrows(BoundaryException.class,
                () -> parser.parse(eml("Content-Type: multipart/mixed", "", "--b", "--b--")));
    }

    @Test
    @DisplayName("Malformed root header fails with its line")
    void rootHeaderError() {
        HeaderParseException e = assertThrows(HeaderParseException.class,
                () -> parser.parse(eml("Content-Type: text/plain", "not a header", "", "body")));

        assertEquals(2, e.getLineNumber());
    }

    @Test
    @DisplayName("Unknown charset fails the whole parse")
    void unknownCharset() {
        UnsupportedCharsetException e = assertThrows(UnsupportedCharsetException.class, () -> parser.parse(eml(
                "Content-Type: multipart/mixed; boundary=b",
                "",
                "--b",
                "Content-Type: text/plain; charset=unknown-x",
                "",
                "x",
                "--b--")));

        assertEquals("unknown-x", e.getCharset());
        assertTrue(e instanceof MimeException);
    }

    @Test
    @DisplayName("Charset header field is used when the type has none")
    void charsetHeaderFallback() throws IOException {
        byte[] head = eml(
                "Content-Type: multipart/mixed; boundary=b",
                "",
                "--b",
                "Content-Type: text/plain",
                "Charset: iso-8859-1",
                "");
        byte[] body = {'C', 'a', 'f', (byte) 0xE9, '\r', '\n', '-', '-', 'b', '-', '-', '\r', '\n'};
        byte[] message = new byte[head.length + body.length];
        System.arraycopy(head, 0, message, 0, head.length);
        System.arraycopy(body, 0, message, head.length, body.length);

        assertEquals("Café", parser.parse(message).getFirstChild().getContentAsString());
    }

    @Test
    @DisplayName("Nesting beyond the limit fails")
    void depthGuard() throws IOException {
        MimeParser shallow = new MimeParser(new ParserConfig(Map.of("maxDepth", 1)));

        // One level is fine.
        assertEquals(2, shallow.parse(eml(TWO_PARTS)).getChildren().size());

        NestingDepthException e = assertThrows(NestingDepthException.class, () -> shallow.parse(eml(
                "Content-Type: multipart/mixed; boundary=outer",
                "",
                "--outer",
                "Content-Type: multipart/alternative; boundary=inner",
                "",
                "--inner",
                "Content-Type: text/plain",
                "",
                "text",
                "--inner--",
                "--outer--")));

        assertEquals(1, e.getMaxDepth());
    }

    @Test
    @DisplayName("Large nesting limit from config still parses")
    void largeDepthLimit() throws IOException {
        MimeParser deep = new MimeParser(new ParserConfig(Map.of("maxDepth", 3000000000.0, "bufferSize", 3000000000.0)));

        assertEquals(2, deep.parse(eml(TWO_PARTS)).getChildren().size());
    }

    @Test
    @DisplayName("Base64 body continuing after padding fails")
    void base64AfterPadding() {
        assertThrows(TransferEncodingException.class, () -> parser.parse(eml(
                "Content-Type: text/plain",
                "Content-Transfer-Encoding: base64",
                "",
                "QQ==",
                "Qg==")));
    }

    @Test
    @DisplayName("Multipart type without boundary is a leaf")
    void multipartWithoutBoundaryIsLeaf() throws IOException {
        MimePart root = parser.parse(eml(
                "Content-Type: multipart/mixed; boundary=b",
                "",
                "--b",
                "Content-Type: multipart/alternative",
                "",
                "not split",
                "--b--"));

        MimePart part = root.getFirstChild();
        assertEquals("multipart/alternative", part.getContentType());
        assertFalse(part.isMultipart());
        assertNull(part.getFirstChild());
        assertEquals("not split", part.getContentAsString());
        assertTrue(root.isMultipart());
    }

    @Test
    @DisplayName("Single part quoted-printable root")
    void singlePartQuotedPrintable() throws IOException {
        MimePart root = parser.parse(eml(
                "Subject: test",
                "Content-Type: text/plain; charset=\"iso-8859-1\"",
                "Content-Transfer-Encoding: quoted-printable",
                "",
                "Caf=E9 =",
                "cr=E8me"));

        assertEquals("text/plain", root.getContentType());
        assertEquals("Café crème\r\n", root.getContentAsString());
        assertNull(root.getFirstChild());
    }

    @Test
    @DisplayName("Single part base64 attachment root")
    void singlePartBase64() throws IOException {
        MimePart root = parser.parse(new ByteArrayInputStream(eml(
                "Content-Type: application/pdf; name=\"=?UTF-8?B?w6l0w6kucGRm?=\"",
                "Content-Disposition: attachment",
                "Content-Transfer-Encoding: base64",
                "",
                "JVBE",
                "Ri0x")));

        assertEquals("application/pdf", root.getContentType());
        assertEquals("attachment", root.getDisposition());
        assertEquals("été.pdf", root.getFileName());
        assertEquals("%PDF-1", new String(root.getContent(), StandardCharsets.US_ASCII));
    }

    @Test
    @DisplayName("Parse file fixture")
    void parseFile() throws IOException {
        MimePart root = parser.parse("src/test/resources/mime/nested.eml");

        assertEquals("multipart/mixed", root.getContentType());
        assertEquals("=?UTF-8?B?UmVwb3J0IMOpdMOp?=", root.getHeader("subject"));

        MimePart alternative = root.getFirstChild();
        assertEquals("multipart/alternative", alternative.getContentType());

        MimePart plain = alternative.getFirstChild();
        assertEquals("Café au lait.", plain.getContentAsString());
        assertEquals("<p>Café au lait.</p>", plain.getNextSibling().getContentAsString());

        MimePart attachment = alternative.getNextSibling();
        assertEquals("text/plain", attachment.getContentType());
        assertEquals("attachment", attachment.getDisposition());
        assertEquals("résumé.txt", attachment.getFileName());
        assertEquals("Quarterly numbers: 42\n", attachment.getContentAsString());
        assertNull(attachment.getNextSibling());

        assertEquals(2, PartMatcher.depthMatchAll(root, PartMatcher.contentType("text/plain")).size());
    }

    @Test
    @DisplayName("Returned content and headers are copies")
    void snapshot() throws IOException {
        MimePart part = parser.parse(eml(TWO_PARTS)).getFirstChild();

        part.getContent()[0] = 'X';
        part.getHeaders().set("Content-Type", "text/html");

        assertEquals("plain body", part.getContentAsString());
        assertEquals("text/plain", part.getHeader("Content-Type"));
    }
}
