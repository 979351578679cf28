package com.gateproof.merkle;

import java.time.Instant;

import com.gateproof.crypto.CanonicalEncoder;
import com.gateproof.crypto.Digests;
import com.gateproof.trust.ThresholdSignature;

/**
 * Published commitment of a sealed batch. The threshold signature covers batch id, root, leaf count
 * and sealing time.
 */
public record SignedBatchRoot(
        String batchId,
        String root,
        int leafCount,
        Instant sealedAt,
        ThresholdSignature signature) {

    public static byte[] signingDigest(String batchId, String root, int leafCount, Instant sealedAt) {
        return Digests.sha256(new CanonicalEncoder("gateproof.batch.v1")
                .field(batchId)
                .field(root)
                .field(leafCount)
                .field(sealedAt.toString())
                .toByteArray());
    }

    public byte[] signingDigest() {
        return signingDigest(batchId, root, leafCount, sealedAt);
    }
}
