package com.gateproof.audit;

import java.util.List;

import com.gateproof.merkle.InclusionProof;
import com.gateproof.merkle.SignedBatchRoot;
import com.gateproof.receipt.Receipt;
import com.gateproof.trust.KeyDescriptor;

/**
 * Everything needed to check one receipt offline: the receipt, its inclusion proof, the signed batch
 * root and the public keys of every signer involved.
 */
public record ProofBundle(
        String format,
        Receipt receipt,
        InclusionProof proof,
        SignedBatchRoot batchRoot,
        List<KeyDescriptor> keys) {

    public static final String FORMAT = "gateproof.bundle.v1";

    public ProofBundle {
        keys = keys == null ? List.of() : List.copyOf(keys);
    }
}
