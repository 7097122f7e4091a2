package com.e2eq.l10n.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CommentCodecTest {

    @Test
    void escapesDoubleHyphenAndTrailingHyphen() {
        assertEquals("a&#45;-b", CommentCodec.encode("a--b"));
        assertEquals("end&#45;", CommentCodec.encode("end-"));
        assertEquals("&#45;&#45;&#45;", CommentCodec.encode("---"));
        assertEquals("well-known", CommentCodec.encode("well-known"));
    }

    @Test
    void escapesAmpersand() {
        assertEquals("Tom &amp; Jerry", CommentCodec.encode("Tom & Jerry"));
    }

    @Test
    void encodedTextIsALegalCommentBody() {
        String encoded = CommentCodec.encode("-- x -- y --");
        assertFalse(encoded.contains("--"));
        assertFalse(encoded.endsWith("-"));
    }

    @Test
    void decodeReversesEncode() {
        String[] samples = {"", "plain", "a--b", "trailing-", "Tom & Jerry", "&amp; literal", "&#45;", "-- x -- y --"};
        for (String sample : samples) {
            assertEquals(sample, CommentCodec.decode(CommentCodec.encode(sample)), sample);
        }
    }

    @Test
    void trailingLineBreaksAreEncoded() {
        assertEquals("line one\nline two&#10;", CommentCodec.encode("line one\nline two\n"));
        assertEquals("x &#13;&#10;", CommentCodec.encode("x \r\n"));
        assertEquals("x \r\n", CommentCodec.decode(CommentCodec.encode("x \r\n")));
    }

    @Test
    void unknownEntitiesAreKeptLiterally() {
        assertEquals("a &lt; b", CommentCodec.decode("a &lt; b"));
        assertEquals("a & b", CommentCodec.decode("a & b"));
    }

    @Test
    void nullIsTreatedAsEmpty() {
        assertEquals("", CommentCodec.encode(null));
        assertEquals("", CommentCodec.decode(null));
    }
}
