package com.gateproof.trust;

import java.util.List;

/**
 * M-of-N signature set. Only ever built once {@code signatures} holds at least {@code threshold}
 * distinct signers.
 */
public record ThresholdSignature(int threshold, List<EntitySignature> signatures) {
    public ThresholdSignature {
        signatures = List.copyOf(signatures);
    }
}
