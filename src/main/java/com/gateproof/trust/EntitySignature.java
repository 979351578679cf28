package com.gateproof.trust;

import java.time.Instant;

import com.gateproof.crypto.CanonicalEncoder;

/**
 * Signature made by one entity. The signed bytes bind the content digest to the signer identity,
 * key id, role and signing time, so none of them can be swapped after the fact.
 */
public record EntitySignature(
        String entityId,
        String keyId,
        SigningRole role,
        Instant signedAt,
        String algorithm,
        String value) {

    public static byte[] signingInput(byte[] digest, String entityId, String keyId, SigningRole role, Instant signedAt) {
        return new CanonicalEncoder("gateproof.signature.v1")
                .field(digest)
                .field(entityId)
                .field(keyId)
                .field(role.name())
                .field(signedAt.toEpochMilli())
                .toByteArray();
    }

    public byte[] signingInput(byte[] digest) {
        return signingInput(digest, entityId, keyId, role, signedAt);
    }
}
