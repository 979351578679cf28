package com.gateproof.lifecycle;

/**
 * Stage-scoped commitment. {@code stage} and {@code parentDigest} are null only for the lifecycle
 * root.
 */
public record Anchor(
        String lifecycleId,
        Stage stage,
        String digest,
        String parentDigest,
        String saltHex,
        String nonceHex) {

    public boolean isRoot() {
        return stage == null;
    }

    public String label() {
        return lifecycleId + "/" + (isRoot() ? "root" : stage.id());
    }
}
