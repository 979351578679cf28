package com.gateproof.orchestrator;

import java.time.Instant;

import com.gateproof.crypto.CanonicalEncoder;

/**
 * A reviewer's answer. {@code reviewerId} must be a registered signing entity; the decision is sealed
 * under that entity's signature.
 */
public record ReviewDecision(String reviewerId, boolean approved, String rationale, Instant decidedAt) {
    public ReviewDecision {
        if (reviewerId == null || reviewerId.isBlank()) {
            throw new IllegalArgumentException("reviewerId must not be blank");
        }
        if (decidedAt == null) {
            throw new IllegalArgumentException("decidedAt must not be null");
        }
    }

    public static ReviewDecision approve(String reviewerId, String rationale, Instant decidedAt) {
        return new ReviewDecision(reviewerId, true, rationale, decidedAt);
    }

    public static ReviewDecision reject(String reviewerId, String rationale, Instant decidedAt) {
        return new ReviewDecision(reviewerId, false, rationale, decidedAt);
    }

    public String evidenceDigest(String requestId) {
        return new CanonicalEncoder("gateproof.review.v1")
                .field(requestId)
                .field(reviewerId)
                .field(approved ? "APPROVED" : "REJECTED")
                .field(rationale)
                .field(decidedAt.toString())
                .digestHex();
    }
}
