package com.gateproof.receipt;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import com.gateproof.crypto.CanonicalEncoder;
import com.gateproof.crypto.Digests;

/**
 * Fixed-order, length-prefixed encoding of a receipt without its signature. Field order is part of
 * the verification contract and must not change under the same domain tag.
 */
public final class ReceiptCodec {
    public static final String DOMAIN_TAG = "gateproof.receipt.v1";

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'").withZone(ZoneOffset.UTC);

    private ReceiptCodec() {
    }

    public static byte[] canonicalBytes(Receipt receipt) {
        VerdictSummary summary = receipt.verdictSummary();
        CanonicalEncoder encoder = new CanonicalEncoder(DOMAIN_TAG)
                .field(receipt.receiptId())
                .field(receipt.kind() == null ? null : receipt.kind().name())
                .field(receipt.operationId())
                .field(receipt.lifecycleId())
                .field(receipt.stage() == null ? null : receipt.stage().id())
                .field(receipt.anchorDigest())
                .field(receipt.evidenceDigest())
                .field(receipt.policyRef())
                .field(receipt.timestamp() == null ? null : TIMESTAMP_FORMAT.format(receipt.timestamp().wallClock()))
                .field(receipt.timestamp() == null ? 0 : receipt.timestamp().monotonicNanos())
                .field(receipt.parentReceiptId());
        if (summary == null) {
            return encoder.field((String) null).field((String) null).field((String) null)
                    .field(0).field(0).field((String) null).toByteArray();
        }
        encoder.field(summary.aggregateStatus().name())
                .field(summary.action().name())
                .field(summary.outcome().name())
                .field(summary.gates().size());
        for (GateOutcome gate : summary.gates()) {
            encoder.field(gate.gateName()).field(gate.status().name()).field(gate.verdictDigest());
        }
        encoder.field(summary.warnings().size());
        summary.warnings().forEach(encoder::field);
        return encoder.field(summary.reviewReceiptId()).toByteArray();
    }

    public static byte[] digest(Receipt receipt) {
        return Digests.sha256(canonicalBytes(receipt));
    }

    public static String digestHex(Receipt receipt) {
        return Digests.toHex(digest(receipt));
    }
}
