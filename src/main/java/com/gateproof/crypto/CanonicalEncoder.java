package com.gateproof.crypto;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Length-prefixed field encoding used for every signed or hashed structure. Each field is a 4-byte
 * big-endian length followed by its bytes, so no delimiter choice can make two different field
 * sequences collide. A null field encodes as zero length.
 */
public final class CanonicalEncoder {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    public CanonicalEncoder(String domainTag) {
        field(domainTag);
    }

    public CanonicalEncoder field(String value) {
        return field(value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8));
    }

    public CanonicalEncoder field(long value) {
        return field(Long.toString(value));
    }

    public CanonicalEncoder field(byte[] value) {
        byte[] bytes = value == null ? new byte[0] : value;
        out.writeBytes(ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array());
        out.writeBytes(bytes);
        return this;
    }

    public byte[] toByteArray() {
        return out.toByteArray();
    }

    public String digestHex() {
        return Digests.sha256Hex(toByteArray());
    }
}
