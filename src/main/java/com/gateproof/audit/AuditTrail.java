package com.gateproof.audit;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gateproof.gate.GateStatus;
import com.gateproof.merkle.InclusionProof;
import com.gateproof.merkle.MerkleBatcher;
import com.gateproof.merkle.MerkleTree;
import com.gateproof.merkle.SealedBatch;
import com.gateproof.policy.EnforcementAction;
import com.gateproof.receipt.Outcome;
import com.gateproof.receipt.Receipt;
import com.gateproof.receipt.ReceiptCodec;
import com.gateproof.receipt.ReceiptKind;
import com.gateproof.runtime.RetryPolicy;
import com.gateproof.trust.EntitySignature;
import com.gateproof.trust.SigningUnavailableException;
import com.gateproof.trust.TrustLayer;

/**
 * Append-only evidentiary record. Every accepted receipt is stored once, in arrival order, and its
 * digest is handed to the batcher.
 */
public class AuditTrail {
    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);
    private static final int PAGE_SIZE = 256;

    private final AppendOnlyLog store;
    private final MerkleBatcher batcher;
    private final TrustLayer trustLayer;
    private final RetryPolicy storageRetry;

    public AuditTrail(AppendOnlyLog store, MerkleBatcher batcher, TrustLayer trustLayer, RetryPolicy storageRetry) {
        this.store = Objects.requireNonNull(store, "store");
        this.batcher = Objects.requireNonNull(batcher, "batcher");
        this.trustLayer = Objects.requireNonNull(trustLayer, "trustLayer");
        this.storageRetry = Objects.requireNonNull(storageRetry, "storageRetry");
    }

    /**
     * Appends a sealed receipt. A second append of the same receipt id stores nothing, but re-queues the
     * stored receipt's digest if the batcher has not seen it, so an interrupted append can be repeated.
     *
     * @return false when the receipt was already present
     */
    public synchronized boolean append(Receipt receipt) throws IOException {
        Objects.requireNonNull(receipt, "receipt");
        if (receipt.signature() == null) {
            throw new IllegalArgumentException("Only sealed receipts can be appended: " + receipt.receiptId());
        }
        boolean stored = storageRetry.run("audit.append", IOException.class, () -> store.append(receipt));
        if (!stored) {
            requeueIfUnbatched(receipt);
            return false;
        }
        enqueue(receipt.digest());
        log.info("audit.appended id={} op={} stage={} kind={}", receipt.receiptId(), receipt.operationId(), receipt.stage().id(), receipt.kind());
        return true;
    }

    private void requeueIfUnbatched(Receipt receipt) throws IOException {
        Optional<Receipt> existing = storageRetry.run("audit.find", IOException.class, () -> store.find(receipt.receiptId()));
        String digest = receipt.digest();
        if (existing.isEmpty() || !existing.get().digest().equals(digest) || batcher.contains(digest)) {
            log.debug("audit.append.duplicate id={}", receipt.receiptId());
            return;
        }
        log.warn("audit.append.requeued id={} digest={}", receipt.receiptId(), digest);
        enqueue(digest);
    }

    private void enqueue(String digest) {
        batcher.add(digest);
        try {
            batcher.sealIfDue();
        } catch (SigningUnavailableException e) {
            log.warn("audit.batch.seal.deferred pending={} reason={}", batcher.pendingDigests().size(), e.getMessage());
        }
    }

    /** Seals whatever is pending, regardless of the batch window. */
    public Optional<SealedBatch> flush() {
        synchronized (this) {
            return batcher.pendingDigests().isEmpty() ? Optional.empty() : Optional.of(batcher.sealBatch());
        }
    }

    /** Lazy view over the log; every iteration starts again from the first receipt. */
    public Iterable<Receipt> query(ReceiptQuery query) {
        Objects.requireNonNull(query, "query");
        return () -> new QueryIterator(query);
    }

    public List<Receipt> list(ReceiptQuery query) {
        List<Receipt> receipts = new ArrayList<>();
        query(query).forEach(receipts::add);
        return receipts;
    }

    /** One bundle per receipt of the operation that already sits in a sealed batch, in log order. */
    public List<ProofBundle> exportProofBundles(String operationId) {
        List<ProofBundle> bundles = new ArrayList<>();
        for (Receipt receipt : query(ReceiptQuery.forOperation(operationId))) {
            String digest = receipt.digest();
            Optional<SealedBatch> batch = batcher.batchOf(digest);
            Optional<InclusionProof> proof = batcher.prove(digest);
            if (batch.isEmpty() || proof.isEmpty()) {
                log.debug("audit.export.unsealed id={}", receipt.receiptId());
                continue;
            }
            List<EntitySignature> signatures = new ArrayList<>();
            signatures.add(receipt.signature());
            signatures.addAll(batch.get().signedRoot().signature().signatures());
            bundles.add(new ProofBundle(ProofBundle.FORMAT, receipt, proof.get(), batch.get().signedRoot(),
                    trustLayer.describe(signatures)));
        }
        log.info("audit.export op={} bundles={}", operationId, bundles.size());
        return bundles;
    }

    public AuditSummary summarize(ReceiptQuery query) {
        long stageReceipts = 0;
        long reviewReceipts = 0;
        Map<GateStatus, Long> statusCounts = new EnumMap<>(GateStatus.class);
        Map<EnforcementAction, Long> actionCounts = new EnumMap<>(EnforcementAction.class);
        Set<String> blocked = new LinkedHashSet<>();
        Set<String> stages = new TreeSet<>();
        Set<String> policyRefs = new TreeSet<>();
        for (Receipt receipt : query(query)) {
            if (receipt.kind() == ReceiptKind.REVIEW) {
                reviewReceipts++;
                continue;
            }
            stageReceipts++;
            statusCounts.merge(receipt.verdictSummary().aggregateStatus(), 1L, Long::sum);
            actionCounts.merge(receipt.verdictSummary().action(), 1L, Long::sum);
            if (receipt.verdictSummary().outcome() == Outcome.BLOCKED) {
                blocked.add(receipt.operationId());
            }
            stages.add(receipt.stage().id());
            if (receipt.policyRef() != null) {
                policyRefs.add(receipt.policyRef());
            }
        }
        return new AuditSummary(stageReceipts, reviewReceipts, statusCounts, actionCounts,
                rate(statusCounts.get(GateStatus.PASS), stageReceipts),
                rate(statusCounts.get(GateStatus.FAIL), stageReceipts),
                rate(statusCounts.get(GateStatus.REVIEW), stageReceipts),
                blocked.size(), stages, policyRefs);
    }

    /** Re-verifies every stored receipt signature, every inclusion proof and every sealed batch. */
    public IntegrityReport verifyIntegrity(TrustLayer verifier) {
        List<String> failures = new ArrayList<>();
        long receipts = 0;
        for (Receipt receipt : query(ReceiptQuery.all())) {
            receipts++;
            String digest = receipt.digest();
            if (receipt.signature() == null || !verifier.verify(ReceiptCodec.digest(receipt), receipt.signature())) {
                failures.add("receipt " + receipt.receiptId() + ": signature does not verify");
            }
            Optional<SealedBatch> batch = batcher.batchOf(digest);
            if (batch.isPresent()) {
                Optional<InclusionProof> proof = batcher.prove(digest);
                if (proof.isEmpty() || !MerkleTree.verify(proof.get(), batch.get().root())) {
                    failures.add("receipt " + receipt.receiptId() + ": inclusion proof does not match batch " + batch.get().batchId());
                }
            } else if (!queued(digest)) {
                failures.add("receipt " + receipt.receiptId() + ": stored but not queued for any batch");
            }
        }
        List<SealedBatch> batches = batcher.sealedBatches();
        for (SealedBatch batch : batches) {
            if (!batcher.verifyBatch(batch)) {
                failures.add("batch " + batch.batchId() + ": root or threshold signature does not verify");
            }
        }
        if (!failures.isEmpty()) {
            log.error("audit.integrity.failed failures={}", failures.size());
        }
        return new IntegrityReport(receipts, batches.size(), failures);
    }

    // append holds this lock from store write to batcher hand-off
    private synchronized boolean queued(String digest) {
        return batcher.contains(digest);
    }

    private static double rate(Long count, long total) {
        return total == 0 || count == null ? 0.0 : (double) count / total;
    }

    private final class QueryIterator implements Iterator<Receipt> {
        private final ReceiptQuery query;
        private long position;
        private List<Receipt> page = List.of();
        private int pageIndex;
        private Receipt next;

        private QueryIterator(ReceiptQuery query) {
            this.query = query;
        }

        @Override
        public boolean hasNext() {
            while (next == null) {
                if (pageIndex >= page.size()) {
                    if (!loadPage()) {
                        return false;
                    }
                }
                Receipt candidate = page.get(pageIndex++);
                if (query.matches(candidate)) {
                    next = candidate;
                }
            }
            return true;
        }

        @Override
        public Receipt next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Receipt result = next;
            next = null;
            return result;
        }

        private boolean loadPage() {
            try {
                page = store.read(position, position + PAGE_SIZE);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read audit log at position " + position, e);
            }
            pageIndex = 0;
            position += page.size();
            return !page.isEmpty();
        }
    }
}
