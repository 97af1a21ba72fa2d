package com.mimecast.mimetree.mime.headers;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HeaderWordDecoderTest {

    @Test
    void decodeBase64Word() {
        assertEquals("Report été", HeaderWordDecoder.decode("=?UTF-8?B?UmVwb3J0IMOpdMOp?="));
    }

    @Test
    void decodeQuotedPrintableWord() {
        assertEquals("résumé.txt", HeaderWordDecoder.decode("=?UTF-8?Q?r=C3=A9sum=C3=A9.txt?="));
    }

    @Test
    void plainValueUnchanged() {
        assertEquals("plain.txt", HeaderWordDecoder.decode("plain.txt"));
    }

    @Test
    void nullAndEmpty() {
        assertEquals("", HeaderWordDecoder.decode(null));
        assertEquals("", HeaderWordDecoder.decode(""));
    }
}
