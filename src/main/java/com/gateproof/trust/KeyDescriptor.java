package com.gateproof.trust;

import java.security.PublicKey;
import java.time.Instant;
import java.util.Base64;

/**
 * Public half of one key generation, detached from the live trust layer so a third party can check
 * signatures offline.
 */
public record KeyDescriptor(
        String entityId,
        SigningRole role,
        String keyId,
        String algorithm,
        String publicKey,
        String fingerprint,
        Instant validFrom,
        Instant validUntil,
        Instant revokedAt) {

    public static KeyDescriptor of(SigningEntity entity, KeyVersion key) {
        return new KeyDescriptor(
                entity.identity(),
                entity.role(),
                key.keyId(),
                Ed25519Keys.ALGORITHM,
                Ed25519Keys.encodePublicKey(key.publicKey()),
                Ed25519Keys.fingerprint(key.publicKey()),
                key.validFrom(),
                key.validUntil(),
                entity.revokedAt());
    }

    public boolean matches(EntitySignature signature) {
        return entityId.equals(signature.entityId()) && keyId.equals(signature.keyId()) && role == signature.role();
    }

    /** Checks key validity at the signature's own timestamp, revocation, then the signature bytes. */
    public boolean verify(byte[] digest, EntitySignature signature) {
        if (!matches(signature) || !Ed25519Keys.ALGORITHM.equals(signature.algorithm())) {
            return false;
        }
        Instant signedAt = signature.signedAt();
        if (signedAt.isBefore(validFrom) || (validUntil != null && !signedAt.isBefore(validUntil))) {
            return false;
        }
        if (revokedAt != null && !signedAt.isBefore(revokedAt)) {
            return false;
        }
        byte[] signatureBytes;
        try {
            signatureBytes = Base64.getDecoder().decode(signature.value());
        } catch (IllegalArgumentException e) {
            return false;
        }
        PublicKey key = Ed25519Keys.decodePublicKey(publicKey);
        return Ed25519Keys.verify(key, signature.signingInput(digest), signatureBytes);
    }
}
