package com.gateproof.orchestrator;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Review broker that parks requests until an operator decides. Requests leave the queue when decided
 * or when the orchestrator gives up waiting.
 */
public class PendingReviewQueue implements ReviewBroker {
    private static final Logger log = LoggerFactory.getLogger(PendingReviewQueue.class);

    private final Map<String, Pending> pending = new ConcurrentHashMap<>();
    private final Clock clock;

    public PendingReviewQueue(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public CompletableFuture<ReviewDecision> requestReview(ReviewRequest request) {
        CompletableFuture<ReviewDecision> future = new CompletableFuture<>();
        if (pending.putIfAbsent(request.requestId(), new Pending(request, future)) != null) {
            throw new IllegalStateException("Review already pending: " + request.requestId());
        }
        future.whenComplete((decision, error) -> pending.remove(request.requestId()));
        log.info("review.requested id={} op={} stage={} gates={} deadline={}", request.requestId(), request.operationId(),
                request.stage().id(), request.escalatingGates(), request.deadline());
        return future;
    }

    public List<ReviewRequest> pending() {
        return pending.values().stream()
                .map(Pending::request)
                .sorted(Comparator.comparing(ReviewRequest::requestedAt))
                .toList();
    }

    public Optional<ReviewRequest> request(String requestId) {
        return Optional.ofNullable(pending.get(requestId)).map(Pending::request);
    }

    public boolean approve(String requestId, String reviewerId, String rationale) {
        return decide(requestId, ReviewDecision.approve(reviewerId, rationale, clock.instant()));
    }

    public boolean reject(String requestId, String reviewerId, String rationale) {
        return decide(requestId, ReviewDecision.reject(reviewerId, rationale, clock.instant()));
    }

    private boolean decide(String requestId, ReviewDecision decision) {
        Pending entry = pending.get(requestId);
        if (entry == null) {
            log.warn("review.decision.unmatched id={} reviewer={}", requestId, decision.reviewerId());
            return false;
        }
        boolean accepted = entry.future().complete(decision);
        log.info("review.decided id={} reviewer={} approved={} accepted={}", requestId, decision.reviewerId(), decision.approved(), accepted);
        return accepted;
    }

    private record Pending(ReviewRequest request, CompletableFuture<ReviewDecision> future) {
    }
}
