package com.gateproof.receipt;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import com.gateproof.MutableClock;
import com.gateproof.crypto.Digests;
import com.gateproof.gate.GateStatus;
import com.gateproof.gate.GateVerdict;
import com.gateproof.lifecycle.Anchor;
import com.gateproof.lifecycle.AnchorChain;
import com.gateproof.lifecycle.Stage;
import com.gateproof.policy.EnforcementAction;
import com.gateproof.trust.SigningRole;
import com.gateproof.trust.TrustLayer;

/** Shared wiring for tests that need real signed receipts. */
public final class ReceiptFixtures {
    public static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final TrustLayer trust = new TrustLayer(clock, 1, Duration.ZERO);
    public final AnchorChain chain = AnchorChain.fromSecret("lc-1",
            "root-secret".getBytes(StandardCharsets.UTF_8), "nonce-0000000001".getBytes(StandardCharsets.UTF_8));
    public final ReceiptGenerator generator;
    private final AtomicInteger ids = new AtomicInteger();
    private final AtomicLong nanos = new AtomicLong(1_000);

    public ReceiptFixtures() {
        trust.register("operator-a", SigningRole.PLATFORM_OPERATOR, START, null);
        trust.register("auditor-a", SigningRole.AUDITOR, START, null);
        trust.register("auditor-b", SigningRole.AUDITOR, START, null);
        generator = new ReceiptGenerator(trust, SigningRole.PLATFORM_OPERATOR,
                new MonotonicTimeSource(clock, nanos::incrementAndGet), () -> "r" + ids.incrementAndGet());
    }

    public Anchor anchor(Stage stage) {
        return chain.anchorFor(stage).orElseGet(() -> {
            Stage previous = stage.previous();
            if (previous != null) {
                anchor(previous);
            }
            return chain.advance(stage, stage.id().getBytes(StandardCharsets.UTF_8));
        });
    }

    public Receipt seal(String operationId) {
        GateVerdict verdict = GateVerdict.of("bias", Stage.DATASET, GateStatus.PASS, "ok");
        VerdictSummary summary = new VerdictSummary(GateStatus.PASS, EnforcementAction.ALLOW, Outcome.PROCEEDED,
                List.of(GateOutcome.of(verdict)), List.of(), null);
        return generator.seal(operationId, anchor(Stage.DATASET), Digests.sha256Hex(operationId), "policy@1.0.0#abc", summary, null);
    }
}
