package com.gateproof.receipt;

import com.gateproof.lifecycle.Stage;
import com.gateproof.trust.EntitySignature;

/**
 * Sealed, signed record of one stage evaluation or review decision. The signature covers the
 * canonical encoding of every other field.
 */
public record Receipt(
        String receiptId,
        ReceiptKind kind,
        String operationId,
        String lifecycleId,
        Stage stage,
        String anchorDigest,
        String evidenceDigest,
        String policyRef,
        ReceiptTimestamp timestamp,
        VerdictSummary verdictSummary,
        String parentReceiptId,
        EntitySignature signature) {

    /** Lowercase hex SHA-256 of the canonical encoding; the Merkle leaf value. */
    public String digest() {
        return ReceiptCodec.digestHex(this);
    }
}
