package com.gateproof.merkle;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gateproof.trust.SigningRole;
import com.gateproof.trust.SigningUnavailableException;
import com.gateproof.trust.ThresholdSignature;
import com.gateproof.trust.TrustLayer;

/**
 * Accumulates receipt digests into batches and seals each batch under an M-of-N signature.
 *
 * <p>The open batch is mutable only through this instance and every mutation is synchronized on it.
 * Arrival order is leaf order; once a digest is accepted its position never changes. Sealed batches
 * are immutable.
 */
public class MerkleBatcher {
    private static final Logger log = LoggerFactory.getLogger(MerkleBatcher.class);

    private final TrustLayer trustLayer;
    private final Set<SigningRole> signerRoles;
    private final int signatureThreshold;
    private final BatchWindow window;
    private final Clock clock;

    private final LinkedHashSet<String> pending = new LinkedHashSet<>();
    private Instant openedAt;
    private int sequence;
    private final List<SealedBatch> sealed = new ArrayList<>();
    private final Map<String, SealedBatch> batchByDigest = new HashMap<>();
    private final Map<String, MerkleTree> treeByBatch = new HashMap<>();

    public MerkleBatcher(TrustLayer trustLayer, Set<SigningRole> signerRoles, int signatureThreshold, BatchWindow window, Clock clock) {
        this.trustLayer = Objects.requireNonNull(trustLayer, "trustLayer");
        if (signerRoles == null || signerRoles.isEmpty()) {
            throw new IllegalArgumentException("signerRoles must not be empty");
        }
        this.signerRoles = EnumSet.copyOf(signerRoles);
        if (signatureThreshold < 1) {
            throw new IllegalArgumentException("signatureThreshold must be >= 1");
        }
        this.signatureThreshold = signatureThreshold;
        this.window = Objects.requireNonNull(window, "window");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Appends a digest to the open batch. A full batch is sealed before the digest opens the next one.
     * When that seal cannot be signed yet, the digest still joins the open batch, which then runs past
     * its count bound until the next successful seal. An accepted digest is never dropped.
     *
     * @return false when the digest is already pending or sealed
     */
    public synchronized boolean add(String receiptDigest) {
        Objects.requireNonNull(receiptDigest, "receiptDigest");
        if (pending.contains(receiptDigest) || batchByDigest.containsKey(receiptDigest)) {
            log.debug("batch.add.duplicate digest={}", receiptDigest);
            return false;
        }
        if (pending.size() >= window.maxReceipts()) {
            try {
                sealBatch();
            } catch (SigningUnavailableException e) {
                log.warn("batch.seal.deferred pending={} reason={}", pending.size(), e.getMessage());
            }
        }
        if (pending.isEmpty()) {
            openedAt = clock.instant();
        }
        pending.add(receiptDigest);
        return true;
    }

    /** Seals the open batch when its count or age bound has been reached. */
    public synchronized Optional<SealedBatch> sealIfDue() {
        if (pending.isEmpty()) {
            return Optional.empty();
        }
        boolean full = pending.size() >= window.maxReceipts();
        boolean expired = Duration.between(openedAt, clock.instant()).compareTo(window.maxAge()) >= 0;
        return full || expired ? Optional.of(sealBatch()) : Optional.empty();
    }

    /**
     * Closes the open batch. If the signature threshold cannot be met the batch stays open and the
     * failure propagates.
     */
    public synchronized SealedBatch sealBatch() {
        if (pending.isEmpty()) {
            throw new IllegalStateException("No receipts pending; nothing to seal");
        }
        List<String> leaves = List.copyOf(pending);
        MerkleTree tree = MerkleTree.build(leaves);
        String batchId = "batch-" + UUID.randomUUID();
        Instant sealedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        ThresholdSignature signature = trustLayer.signThreshold(
                SignedBatchRoot.signingDigest(batchId, tree.root(), leaves.size(), sealedAt), signerRoles, signatureThreshold);

        SealedBatch batch = new SealedBatch(++sequence, openedAt, leaves,
                new SignedBatchRoot(batchId, tree.root(), leaves.size(), sealedAt, signature));
        sealed.add(batch);
        treeByBatch.put(batchId, tree);
        for (String leaf : leaves) {
            batchByDigest.put(leaf, batch);
        }
        pending.clear();
        openedAt = null;
        log.info("batch.sealed id={} sequence={} leaves={} root={} signers={}", batchId, batch.sequence(), leaves.size(),
                tree.root(), signature.signatures().size());
        return batch;
    }

    public synchronized Optional<InclusionProof> prove(String receiptDigest) {
        SealedBatch batch = batchByDigest.get(receiptDigest);
        if (batch == null) {
            return Optional.empty();
        }
        MerkleTree tree = treeByBatch.get(batch.batchId());
        return Optional.of(tree.prove(tree.indexOf(receiptDigest), batch.batchId()));
    }

    public synchronized Optional<SealedBatch> batchOf(String receiptDigest) {
        return Optional.ofNullable(batchByDigest.get(receiptDigest));
    }

    public synchronized List<SealedBatch> sealedBatches() {
        return List.copyOf(sealed);
    }

    /** True when the digest is pending or already sealed. */
    public synchronized boolean contains(String receiptDigest) {
        return pending.contains(receiptDigest) || batchByDigest.containsKey(receiptDigest);
    }

    public synchronized List<String> pendingDigests() {
        return List.copyOf(pending);
    }

    /** Recomputes the root from the batch's leaves and checks the threshold signature. */
    public boolean verifyBatch(SealedBatch batch) {
        SignedBatchRoot signedRoot = batch.signedRoot();
        if (batch.leafDigests().size() != signedRoot.leafCount()) {
            return false;
        }
        if (!MerkleTree.build(batch.leafDigests()).root().equals(signedRoot.root())) {
            return false;
        }
        return signedRoot.signature().threshold() >= signatureThreshold
                && trustLayer.verifyThreshold(signedRoot.signingDigest(), signedRoot.signature());
    }
}
