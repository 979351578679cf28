package com.gateproof.merkle;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.gateproof.MutableClock;
import com.gateproof.crypto.Digests;
import com.gateproof.trust.SigningRole;
import com.gateproof.trust.SigningUnavailableException;
import com.gateproof.trust.TrustLayer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MerkleBatcherTest {
    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void shouldIgnoreDuplicateDigests() {
        MerkleBatcher batcher = batcher(new MutableClock(START), 10, 2);
        List<String> leaves = MerkleTreeTest.leaves(3);

        leaves.forEach(batcher::add);
        assertFalse(batcher.add(leaves.get(1)));
        SealedBatch batch = batcher.sealBatch();

        assertEquals(3, batch.leafDigests().size());
        assertFalse(batcher.add(leaves.get(0)));
        assertTrue(batcher.pendingDigests().isEmpty());
    }

    @Test
    void shouldSealWhenFullAndStartNextBatch() {
        MerkleBatcher batcher = batcher(new MutableClock(START), 2, 2);
        List<String> leaves = MerkleTreeTest.leaves(3);

        batcher.add(leaves.get(0));
        batcher.add(leaves.get(1));
        assertTrue(batcher.sealIfDue().isPresent());
        batcher.add(leaves.get(2));

        assertEquals(1, batcher.sealedBatches().size());
        assertEquals(List.of(leaves.get(2)), batcher.pendingDigests());
        assertTrue(batcher.sealIfDue().isEmpty());
    }

    @Test
    void shouldSealWhenWindowAgeElapses() {
        MutableClock clock = new MutableClock(START);
        MerkleBatcher batcher = batcher(clock, 100, 2);
        batcher.add(MerkleTreeTest.leaves(1).get(0));

        assertTrue(batcher.sealIfDue().isEmpty());
        clock.advance(Duration.ofMinutes(1));

        assertTrue(batcher.sealIfDue().isPresent());
    }

    @Test
    void shouldProveSealedReceiptsOnly() {
        MerkleBatcher batcher = batcher(new MutableClock(START), 10, 2);
        List<String> leaves = MerkleTreeTest.leaves(5);
        leaves.subList(0, 4).forEach(batcher::add);
        SealedBatch batch = batcher.sealBatch();
        batcher.add(leaves.get(4));

        InclusionProof proof = batcher.prove(leaves.get(2)).orElseThrow();

        assertEquals(batch.batchId(), proof.batchId());
        assertTrue(MerkleTree.verify(proof, batch.root()));
        assertTrue(batcher.prove(leaves.get(4)).isEmpty());
        assertTrue(batcher.verifyBatch(batch));
    }

    @Test
    void shouldLeaveBatchOpenWhenThresholdCannotBeMet() {
        MerkleBatcher batcher = batcher(new MutableClock(START), 10, 3);
        List<String> leaves = MerkleTreeTest.leaves(2);
        leaves.forEach(batcher::add);

        assertThrows(SigningUnavailableException.class, batcher::sealBatch);
        assertEquals(leaves, batcher.pendingDigests());
        assertTrue(batcher.sealedBatches().isEmpty());
    }

    @Test
    void shouldAcceptDigestsPastTheCountBoundWhileSigningIsUnavailable() {
        MerkleBatcher batcher = batcher(new MutableClock(START), 2, 3);
        List<String> leaves = MerkleTreeTest.leaves(4);

        for (String leaf : leaves) {
            assertTrue(batcher.add(leaf));
        }

        assertEquals(leaves, batcher.pendingDigests());
        assertTrue(batcher.sealedBatches().isEmpty());
        assertTrue(batcher.contains(leaves.get(3)));
        assertFalse(batcher.add(leaves.get(3)));
    }

    @Test
    void shouldKeepEveryDigestOnceAndInThreadOrderUnderConcurrentAdds() throws Exception {
        MerkleBatcher batcher = batcher(new MutableClock(START), 64, 2);
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        assertTrue(batcher.add(digest(thread, i)));
                        batcher.sealIfDue();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        if (!batcher.pendingDigests().isEmpty()) {
            batcher.sealBatch();
        }

        List<String> leafOrder = new ArrayList<>();
        for (SealedBatch batch : batcher.sealedBatches()) {
            assertTrue(batch.leafDigests().size() <= 64);
            assertTrue(batcher.verifyBatch(batch));
            leafOrder.addAll(batch.leafDigests());
        }
        assertEquals(threads * perThread, leafOrder.size());
        assertEquals(threads * perThread, new HashSet<>(leafOrder).size());
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < leafOrder.size(); i++) {
            position.put(leafOrder.get(i), i);
        }
        for (int t = 0; t < threads; t++) {
            for (int i = 1; i < perThread; i++) {
                assertTrue(position.get(digest(t, i - 1)) < position.get(digest(t, i)), "thread " + t + " leaf " + i);
            }
        }
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        TrustLayer trust = new TrustLayer();
        BatchWindow window = new BatchWindow(1, Duration.ofSeconds(1));

        assertThrows(IllegalArgumentException.class, () -> new MerkleBatcher(trust, Set.of(), 1, window, new MutableClock(START)));
        assertThrows(IllegalArgumentException.class,
                () -> new MerkleBatcher(trust, Set.of(SigningRole.AUDITOR), 0, window, new MutableClock(START)));
        assertThrows(IllegalArgumentException.class, () -> new BatchWindow(0, Duration.ofSeconds(1)));
    }

    private static String digest(int thread, int index) {
        return Digests.sha256Hex("thread-" + thread + "-" + index);
    }

    private static MerkleBatcher batcher(MutableClock clock, int maxReceipts, int threshold) {
        TrustLayer trust = new TrustLayer(clock, 1, Duration.ZERO);
        trust.register("operator-a", SigningRole.PLATFORM_OPERATOR, START, null);
        trust.register("auditor-a", SigningRole.AUDITOR, START, null);
        return new MerkleBatcher(trust, EnumSet.of(SigningRole.PLATFORM_OPERATOR, SigningRole.AUDITOR), threshold,
                new BatchWindow(maxReceipts, Duration.ofMinutes(1)), clock);
    }
}
