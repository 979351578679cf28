package com.gateproof.merkle;

import java.util.List;

/**
 * Sibling path from one leaf to its batch root, ordered leaf to root.
 */
public record InclusionProof(
        String leafDigest,
        List<ProofStep> steps,
        int leafIndex,
        int leafCount,
        String batchId,
        String root) {

    public InclusionProof {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }
}
