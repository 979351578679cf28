package com.gateproof.trust;

import java.time.Instant;

public class RevokedEntityException extends RuntimeException {
    private final String entityId;

    public RevokedEntityException(String entityId, Instant revokedAt) {
        super("Signing entity " + entityId + " was revoked at " + revokedAt);
        this.entityId = entityId;
    }

    public String entityId() {
        return entityId;
    }
}
