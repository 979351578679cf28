package com.gateproof.gate;

import com.gateproof.crypto.Digests;

/**
 * Reference to an evidence item held by the collaborator that produced it. The core only ever sees
 * the content digest and where to fetch the payload.
 */
public record EvidenceRef(String name, String digest, String uri) {
    public EvidenceRef {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Evidence name must not be blank");
        }
        if (!Digests.isSha256Hex(digest)) {
            throw new IllegalArgumentException("Evidence digest must be lowercase SHA-256 hex: " + name);
        }
    }

    public static EvidenceRef of(String name, byte[] payload, String uri) {
        return new EvidenceRef(name, Digests.sha256Hex(payload), uri);
    }
}
