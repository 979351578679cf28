package com.gateproof.trust;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A party allowed to sign under one role. Mutated only by {@link TrustLayer}; signing against the
 * entity's keys is serialized on the entity instance.
 */
public final class SigningEntity {
    private final String identity;
    private final SigningRole role;
    private final Instant validFrom;
    private final Instant validUntil;
    private final List<KeyVersion> keys = new ArrayList<>();
    private Instant revokedAt;

    SigningEntity(String identity, SigningRole role, Instant validFrom, Instant validUntil, KeyVersion initialKey) {
        this.identity = identity;
        this.role = role;
        this.validFrom = validFrom;
        this.validUntil = validUntil;
        this.keys.add(initialKey);
    }

    public String identity() {
        return identity;
    }

    public SigningRole role() {
        return role;
    }

    public Instant validFrom() {
        return validFrom;
    }

    public Instant validUntil() {
        return validUntil;
    }

    public synchronized Instant revokedAt() {
        return revokedAt;
    }

    public synchronized boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isValidAt(Instant instant) {
        return !instant.isBefore(validFrom) && (validUntil == null || instant.isBefore(validUntil));
    }

    public synchronized List<KeyVersion> keys() {
        return List.copyOf(keys);
    }

    public synchronized Optional<KeyVersion> key(String keyId) {
        return keys.stream().filter(key -> key.keyId().equals(keyId)).findFirst();
    }

    /** Newest key generation valid at {@code instant}. */
    public synchronized Optional<KeyVersion> keyValidAt(Instant instant) {
        KeyVersion selected = null;
        for (KeyVersion key : keys) {
            if (key.isValidAt(instant) && (selected == null || key.validFrom().isAfter(selected.validFrom()))) {
                selected = key;
            }
        }
        return Optional.ofNullable(selected);
    }

    synchronized KeyVersion currentKey() {
        return keys.get(keys.size() - 1);
    }

    synchronized void addKey(KeyVersion next, Instant previousKeyEnd) {
        int last = keys.size() - 1;
        keys.set(last, keys.get(last).endingAt(previousKeyEnd));
        keys.add(next);
    }

    synchronized void revoke(Instant at) {
        if (revokedAt == null) {
            revokedAt = at;
        }
    }
}
