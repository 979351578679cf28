package com.gateproof.audit;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.gateproof.lifecycle.Stage;
import com.gateproof.merkle.BatchWindow;
import com.gateproof.merkle.MerkleBatcher;
import com.gateproof.merkle.MerkleTree;
import com.gateproof.receipt.Receipt;
import com.gateproof.receipt.ReceiptFixtures;
import com.gateproof.runtime.RetryPolicy;
import com.gateproof.trust.SigningRole;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuditTrailTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldAppendReceiptOnlyOnce() throws IOException {
        ReceiptFixtures fixtures = new ReceiptFixtures();
        AuditTrail trail = trail(fixtures, new InMemoryAppendOnlyLog(), 10);
        Receipt receipt = fixtures.seal("op-1");

        assertTrue(trail.append(receipt));
        assertFalse(trail.append(receipt));
        assertEquals(1, trail.list(ReceiptQuery.all()).size());
    }

    @Test
    void shouldRejectUnsignedReceipt() {
        ReceiptFixtures fixtures = new ReceiptFixtures();
        AuditTrail trail = trail(fixtures, new InMemoryAppendOnlyLog(), 10);
        Receipt sealed = fixtures.seal("op-1");
        Receipt unsigned = new Receipt(sealed.receiptId(), sealed.kind(), sealed.operationId(), sealed.lifecycleId(), sealed.stage(),
                sealed.anchorDigest(), sealed.evidenceDigest(), sealed.policyRef(), sealed.timestamp(), sealed.verdictSummary(),
                sealed.parentReceiptId(), null);

        assertThrows(IllegalArgumentException.class, () -> trail.append(unsigned));
    }

    @Test
    void shouldRestartQueryIterationFromTheBeginning() throws IOException {
        ReceiptFixtures fixtures = new ReceiptFixtures();
        AuditTrail trail = trail(fixtures, new InMemoryAppendOnlyLog(), 100);
        for (int i = 0; i < 300; i++) {
            trail.append(fixtures.seal(i % 2 == 0 ? "op-even" : "op-odd"));
        }

        Iterable<Receipt> even = trail.query(ReceiptQuery.forOperation("op-even"));
        int firstPass = count(even);
        Iterator<Receipt> partial = even.iterator();
        partial.next();

        assertEquals(150, firstPass);
        assertEquals(150, count(even));
        assertEquals(0, trail.list(ReceiptQuery.forOperation("op-even").withStage(Stage.MODEL)).size());
    }

    @Test
    void shouldFilterByTimeRange() throws IOException {
        ReceiptFixtures fixtures = new ReceiptFixtures();
        AuditTrail trail = trail(fixtures, new InMemoryAppendOnlyLog(), 10);
        trail.append(fixtures.seal("op-1"));
        fixtures.clock.advance(Duration.ofHours(1));
        Receipt later = fixtures.seal("op-2");
        trail.append(later);

        List<Receipt> found = trail.list(ReceiptQuery.all().between(ReceiptFixtures.START.plusSeconds(60), null));

        assertEquals(List.of(later), found);
    }

    @Test
    void shouldExportOnlySealedReceiptsAndVerifyOffline() throws IOException {
        ReceiptFixtures fixtures = new ReceiptFixtures();
        AuditTrail trail = trail(fixtures, new InMemoryAppendOnlyLog(), 10);
        for (int i = 0; i < 4; i++) {
            trail.append(fixtures.seal("op-1"));
        }
        trail.flush();
        trail.append(fixtures.seal("op-1"));

        List<ProofBundle> bundles = trail.exportProofBundles("op-1");

        assertEquals(4, bundles.size());
        ProofBundleVerifier verifier = new ProofBundleVerifier(2, null);
        for (ProofBundle bundle : bundles) {
            assertTrue(verifier.verify(bundle).valid(), () -> verifier.verify(bundle).failures().toString());
            assertTrue(MerkleTree.verify(bundle.proof(), bundle.batchRoot().root()));
        }
    }

    @Test
    void shouldSummarizeStageReceipts() throws IOException {
        ReceiptFixtures fixtures = new ReceiptFixtures();
        AuditTrail trail = trail(fixtures, new InMemoryAppendOnlyLog(), 10);
        trail.append(fixtures.seal("op-1"));
        trail.append(fixtures.seal("op-2"));

        AuditSummary summary = trail.summarize(ReceiptQuery.all());

        assertEquals(2, summary.stageReceipts());
        assertEquals(1.0, summary.passRate());
        assertEquals(0, summary.blockedOperations());
        assertTrue(summary.stagesCovered().contains("dataset"));
    }

    @Test
    void shouldReportIntactTrailAfterSealing() throws IOException {
        ReceiptFixtures fixtures = new ReceiptFixtures();
        AuditTrail trail = trail(fixtures, new InMemoryAppendOnlyLog(), 2);
        for (int i = 0; i < 5; i++) {
            trail.append(fixtures.seal("op-" + i));
        }
        trail.flush();

        IntegrityReport report = trail.verifyIntegrity(fixtures.trust);

        assertTrue(report.intact(), report.failures().toString());
        assertEquals(5, report.receiptsChecked());
        assertEquals(3, report.batchesChecked());
    }

    @Test
    void shouldDeferSealingWhenBatchSignersAreUnavailable() throws IOException {
        ReceiptFixtures fixtures = new ReceiptFixtures();
        MerkleBatcher batcher = new MerkleBatcher(fixtures.trust, EnumSet.of(SigningRole.REGULATOR), 1,
                new BatchWindow(1, Duration.ofMinutes(1)), fixtures.clock);
        AuditTrail trail = new AuditTrail(new InMemoryAppendOnlyLog(), batcher, fixtures.trust, RetryPolicy.none());

        assertTrue(trail.append(fixtures.seal("op-1")));
        assertEquals(1, batcher.pendingDigests().size());
        assertTrue(trail.exportProofBundles("op-1").isEmpty());
    }

    @Test
    void shouldKeepQueueingDigestsWhileFullBatchCannotBeSigned() throws IOException {
        ReceiptFixtures fixtures = new ReceiptFixtures();
        MerkleBatcher batcher = new MerkleBatcher(fixtures.trust, EnumSet.of(SigningRole.REGULATOR), 1,
                new BatchWindow(1, Duration.ofDays(1)), fixtures.clock);
        AuditTrail trail = new AuditTrail(new InMemoryAppendOnlyLog(), batcher, fixtures.trust, RetryPolicy.none());
        Receipt first = fixtures.seal("op-1");
        Receipt second = fixtures.seal("op-2");

        assertTrue(trail.append(first));
        assertTrue(trail.append(second));
        assertEquals(List.of(first.digest(), second.digest()), batcher.pendingDigests());

        fixtures.trust.register("regulator-a", SigningRole.REGULATOR, ReceiptFixtures.START, null);
        assertTrue(trail.flush().isPresent());

        assertTrue(batcher.batchOf(first.digest()).isPresent());
        assertTrue(batcher.batchOf(second.digest()).isPresent());
        assertEquals(1, trail.exportProofBundles("op-2").size());
        IntegrityReport report = trail.verifyIntegrity(fixtures.trust);
        assertTrue(report.intact(), report.failures().toString());
    }

    @Test
    void shouldRequeueStoredReceiptThatNeverReachedTheBatcher() throws IOException {
        ReceiptFixtures fixtures = new ReceiptFixtures();
        InMemoryAppendOnlyLog store = new InMemoryAppendOnlyLog();
        MerkleBatcher batcher = batcher(fixtures, 10);
        AuditTrail trail = new AuditTrail(store, batcher, fixtures.trust, RetryPolicy.none());
        Receipt receipt = fixtures.seal("op-1");
        store.append(receipt);

        IntegrityReport before = trail.verifyIntegrity(fixtures.trust);
        assertFalse(before.intact());
        assertEquals(List.of("receipt " + receipt.receiptId() + ": stored but not queued for any batch"), before.failures());

        assertFalse(trail.append(receipt));
        assertEquals(List.of(receipt.digest()), batcher.pendingDigests());
        assertFalse(trail.append(receipt));
        assertEquals(1, batcher.pendingDigests().size());

        trail.flush();
        assertEquals(1, trail.exportProofBundles("op-1").size());
        assertTrue(trail.verifyIntegrity(fixtures.trust).intact());
    }

    @Test
    void shouldRetryTransientStorageFailures() throws IOException {
        ReceiptFixtures fixtures = new ReceiptFixtures();
        AtomicInteger failuresLeft = new AtomicInteger(2);
        InMemoryAppendOnlyLog delegate = new InMemoryAppendOnlyLog();
        AppendOnlyLog flaky = new AppendOnlyLog() {
            @Override
            public boolean append(Receipt receipt) throws IOException {
                if (failuresLeft.getAndDecrement() > 0) {
                    throw new IOException("disk busy");
                }
                return delegate.append(receipt);
            }

            @Override
            public List<Receipt> read(long fromInclusive, long toExclusive) {
                return delegate.read(fromInclusive, toExclusive);
            }

            @Override
            public Optional<Receipt> find(String receiptId) {
                return delegate.find(receiptId);
            }

            @Override
            public long size() {
                return delegate.size();
            }
        };
        AuditTrail trail = new AuditTrail(flaky, batcher(fixtures, 10), fixtures.trust, new RetryPolicy(2, Duration.ZERO));

        assertTrue(trail.append(fixtures.seal("op-1")));
        assertEquals(1, delegate.size());
    }

    @Test
    void shouldPersistReceiptsAsJsonLines() throws IOException {
        ReceiptFixtures fixtures = new ReceiptFixtures();
        Path logPath = tempDir.resolve("audit/receipts.jsonl");
        Receipt first = fixtures.seal("op-1");
        Receipt second = fixtures.seal("op-2");
        trail(fixtures, new JsonLinesAppendOnlyLog(logPath), 10).append(first);
        trail(fixtures, new JsonLinesAppendOnlyLog(logPath), 10).append(second);

        JsonLinesAppendOnlyLog reopened = new JsonLinesAppendOnlyLog(logPath);
        List<Receipt> stored = reopened.read(0, 10);

        assertEquals(2, reopened.size());
        assertEquals(List.of(first, second), stored);
        assertEquals(first.digest(), stored.get(0).digest());
        assertTrue(fixtures.generator.verify(stored.get(1)));
        assertFalse(reopened.append(first));
    }

    @Test
    void shouldServeReopenedJsonLinesLogFromMemory() throws IOException {
        ReceiptFixtures fixtures = new ReceiptFixtures();
        Path logPath = tempDir.resolve("receipts.jsonl");
        AuditTrail writer = trail(fixtures, new JsonLinesAppendOnlyLog(logPath), 1000);
        List<Receipt> written = new ArrayList<>();
        for (int i = 0; i < 600; i++) {
            Receipt receipt = fixtures.seal("op-" + (i % 3));
            written.add(receipt);
            writer.append(receipt);
        }

        JsonLinesAppendOnlyLog reopened = new JsonLinesAppendOnlyLog(logPath);
        AuditTrail reader = trail(fixtures, reopened, 1000);
        List<Receipt> pagedThrough = reader.list(ReceiptQuery.all());

        assertEquals(written, pagedThrough);
        assertEquals(200, reader.list(ReceiptQuery.forOperation("op-1")).size());
        assertEquals(Optional.of(written.get(417)), reopened.find(written.get(417).receiptId()));
        assertTrue(reopened.find("missing").isEmpty());

        Receipt appended = fixtures.seal("op-9");
        assertTrue(reopened.append(appended));
        assertEquals(601, reopened.size());
        assertEquals(List.of(appended), reopened.read(600, 700));
        assertEquals(appended, new JsonLinesAppendOnlyLog(logPath).find(appended.receiptId()).orElseThrow());
    }

    private static AuditTrail trail(ReceiptFixtures fixtures, AppendOnlyLog store, int maxReceipts) {
        return new AuditTrail(store, batcher(fixtures, maxReceipts), fixtures.trust, RetryPolicy.none());
    }

    private static MerkleBatcher batcher(ReceiptFixtures fixtures, int maxReceipts) {
        return new MerkleBatcher(fixtures.trust, EnumSet.of(SigningRole.PLATFORM_OPERATOR, SigningRole.AUDITOR), 2,
                new BatchWindow(maxReceipts, Duration.ofDays(1)), fixtures.clock);
    }

    private static int count(Iterable<Receipt> receipts) {
        List<Receipt> collected = new ArrayList<>();
        receipts.forEach(collected::add);
        return collected.size();
    }
}
