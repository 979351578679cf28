package com.gateproof.receipt;

import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gateproof.crypto.Digests;
import com.gateproof.lifecycle.Anchor;
import com.gateproof.trust.EntitySignature;
import com.gateproof.trust.KeyDescriptor;
import com.gateproof.trust.SigningRole;
import com.gateproof.trust.TrustLayer;

/**
 * Seals receipts: stamps them, computes the canonical digest and has the trust layer sign it.
 * Signing failures propagate; an unsigned receipt is never returned.
 */
public class ReceiptGenerator {
    private static final Logger log = LoggerFactory.getLogger(ReceiptGenerator.class);

    private final TrustLayer trustLayer;
    private final SigningRole signingRole;
    private final MonotonicTimeSource timeSource;
    private final Supplier<String> receiptIds;

    public ReceiptGenerator(TrustLayer trustLayer, SigningRole signingRole, MonotonicTimeSource timeSource) {
        this(trustLayer, signingRole, timeSource, () -> UUID.randomUUID().toString());
    }

    public ReceiptGenerator(TrustLayer trustLayer, SigningRole signingRole, MonotonicTimeSource timeSource, Supplier<String> receiptIds) {
        this.trustLayer = Objects.requireNonNull(trustLayer, "trustLayer");
        this.signingRole = Objects.requireNonNull(signingRole, "signingRole");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
        this.receiptIds = Objects.requireNonNull(receiptIds, "receiptIds");
    }

    public Receipt seal(
            String operationId,
            Anchor anchor,
            String evidenceDigest,
            String policyRef,
            VerdictSummary summary,
            String parentReceiptId) {
        return build(ReceiptKind.STAGE, operationId, anchor, evidenceDigest, policyRef, summary, parentReceiptId,
                digest -> trustLayer.sign(digest, signingRole));
    }

    /** Seals a human review decision, signed by the reviewer's own entity. */
    public Receipt sealReview(
            String operationId,
            Anchor anchor,
            String reviewerId,
            String evidenceDigest,
            String policyRef,
            VerdictSummary summary,
            String parentReceiptId) {
        Objects.requireNonNull(reviewerId, "reviewerId");
        return build(ReceiptKind.REVIEW, operationId, anchor, evidenceDigest, policyRef, summary, parentReceiptId,
                digest -> trustLayer.signAs(reviewerId, digest));
    }

    public boolean verify(Receipt receipt) {
        return receipt.signature() != null && trustLayer.verify(ReceiptCodec.digest(receipt), receipt.signature());
    }

    /** Offline check against a published key descriptor. */
    public static boolean verify(Receipt receipt, KeyDescriptor key) {
        return receipt.signature() != null && key.verify(ReceiptCodec.digest(receipt), receipt.signature());
    }

    private Receipt build(
            ReceiptKind kind,
            String operationId,
            Anchor anchor,
            String evidenceDigest,
            String policyRef,
            VerdictSummary summary,
            String parentReceiptId,
            Function<byte[], EntitySignature> signer) {
        if (operationId == null || operationId.isBlank()) {
            throw new IllegalArgumentException("operationId must not be blank");
        }
        Objects.requireNonNull(anchor, "anchor");
        Objects.requireNonNull(summary, "summary");
        if (anchor.isRoot()) {
            throw new IllegalArgumentException("Receipts reference stage anchors, not the lifecycle root");
        }
        if (!Digests.isSha256Hex(evidenceDigest)) {
            throw new IllegalArgumentException("evidenceDigest must be lowercase SHA-256 hex");
        }

        ReceiptTimestamp timestamp = timeSource.next(anchor.lifecycleId());
        Receipt unsigned = new Receipt(receiptIds.get(), kind, operationId, anchor.lifecycleId(), anchor.stage(),
                anchor.digest(), evidenceDigest, policyRef, timestamp, summary, parentReceiptId, null);
        byte[] digest = ReceiptCodec.digest(unsigned);
        EntitySignature signature = signer.apply(digest);
        Receipt sealed = new Receipt(unsigned.receiptId(), kind, operationId, unsigned.lifecycleId(), unsigned.stage(),
                unsigned.anchorDigest(), evidenceDigest, policyRef, timestamp, summary, parentReceiptId, signature);
        log.info("receipt.sealed id={} kind={} op={} stage={} action={} signer={}", sealed.receiptId(), kind, operationId,
                anchor.stage().id(), summary.action().id(), signature.entityId());
        return sealed;
    }
}
