package com.gateproof.orchestrator;

import java.util.concurrent.CompletableFuture;

/**
 * Hands escalations to humans. The returned future completes with the decision; the orchestrator
 * bounds it with the stage's escalation timeout and treats expiry or failure as a block.
 */
@FunctionalInterface
public interface ReviewBroker {
    CompletableFuture<ReviewDecision> requestReview(ReviewRequest request);
}
