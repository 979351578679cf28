package com.gateproof.merkle;

import java.time.Instant;
import java.util.List;

public record SealedBatch(int sequence, Instant openedAt, List<String> leafDigests, SignedBatchRoot signedRoot) {
    public SealedBatch {
        leafDigests = List.copyOf(leafDigests);
    }

    public String batchId() {
        return signedRoot.batchId();
    }

    public String root() {
        return signedRoot.root();
    }
}
