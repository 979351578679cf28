package com.gateproof.trust;

import java.security.PublicKey;
import java.time.Instant;

/**
 * One generation of an entity's key material. {@code validUntil} is exclusive; null means open-ended.
 */
public record KeyVersion(
        String keyId,
        PublicKey publicKey,
        KeySigner signer,
        Instant validFrom,
        Instant validUntil) {

    public boolean isValidAt(Instant instant) {
        return !instant.isBefore(validFrom) && (validUntil == null || instant.isBefore(validUntil));
    }

    KeyVersion endingAt(Instant end) {
        return new KeyVersion(keyId, publicKey, signer, validFrom, end);
    }
}
