package com.gateproof.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DigestsTest {

    @Test
    void shouldMatchKnownSha256Vector() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", Digests.sha256Hex("abc"));
    }

    @Test
    void shouldRecognizeOnlyLowercaseSha256Hex() {
        String digest = Digests.sha256Hex("payload");

        assertTrue(Digests.isSha256Hex(digest));
        assertFalse(Digests.isSha256Hex(digest.toUpperCase()));
        assertFalse(Digests.isSha256Hex(digest.substring(1)));
        assertFalse(Digests.isSha256Hex(null));
    }

    @Test
    void shouldRoundTripHex() {
        byte[] bytes = { 0, 1, (byte) 0x7f, (byte) 0x80, (byte) 0xff };
        assertEquals("00017f80ff", Digests.toHex(bytes));
        assertArrayEquals(bytes, Digests.fromHex("00017f80ff"));
    }

    @Test
    void shouldSeparateFieldsUnambiguously() {
        String joined = new CanonicalEncoder("test.v1").field("ab").field("c").digestHex();
        String shifted = new CanonicalEncoder("test.v1").field("a").field("bc").digestHex();
        String otherDomain = new CanonicalEncoder("test.v2").field("ab").field("c").digestHex();

        assertNotEquals(joined, shifted);
        assertNotEquals(joined, otherDomain);
    }

    @Test
    void shouldProduceKeyDependentHmac() {
        byte[] data = "data".getBytes(StandardCharsets.UTF_8);
        byte[] first = Digests.hmacSha256("k1".getBytes(StandardCharsets.UTF_8), data);
        byte[] second = Digests.hmacSha256("k2".getBytes(StandardCharsets.UTF_8), data);

        assertEquals(32, first.length);
        assertFalse(Arrays.equals(first, second));
    }
}
