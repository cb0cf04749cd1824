package com.schedbot.common.infra;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContentHashTest {

    @Test
    void sha256Hex_knownVector() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                ContentHash.sha256Hex(""));
    }

    @Test
    void sha256Hex_sameInputSameKey() {
        String a = ContentHash.sha256Hex("https://example.com/a.png");
        assertEquals(64, a.length());
        assertEquals(a, ContentHash.sha256Hex("https://example.com/a.png"));
        assertNotEquals(a, ContentHash.sha256Hex("https://example.com/b.png"));
    }
}
