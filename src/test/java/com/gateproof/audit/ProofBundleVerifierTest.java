package com.gateproof.audit;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.gateproof.crypto.Digests;
import com.gateproof.merkle.BatchWindow;
import com.gateproof.merkle.MerkleBatcher;
import com.gateproof.merkle.ProofVerificationException;
import com.gateproof.receipt.Receipt;
import com.gateproof.receipt.ReceiptFixtures;
import com.gateproof.runtime.RetryPolicy;
import com.gateproof.trust.Ed25519Keys;
import com.gateproof.trust.KeyDescriptor;
import com.gateproof.trust.SigningRole;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProofBundleVerifierTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldVerifyBundleReadBackFromDisk() throws IOException {
        ProofBundle bundle = exportOne();
        Path file = tempDir.resolve("bundles/op-1.json");
        ProofBundleCodec codec = new ProofBundleCodec();

        codec.write(bundle, file);
        ProofBundle reloaded = codec.read(file);

        assertDoesNotThrow(() -> new ProofBundleVerifier(2, Set.of()).requireValid(reloaded));
    }

    @Test
    void shouldRejectBundleWithAlteredReceipt() {
        ProofBundle bundle = exportOne();
        Receipt receipt = bundle.receipt();
        Receipt altered = new Receipt(receipt.receiptId(), receipt.kind(), receipt.operationId(), receipt.lifecycleId(),
                receipt.stage(), receipt.anchorDigest(), Digests.sha256Hex("swapped"), receipt.policyRef(), receipt.timestamp(),
                receipt.verdictSummary(), receipt.parentReceiptId(), receipt.signature());
        ProofBundle forged = new ProofBundle(bundle.format(), altered, bundle.proof(), bundle.batchRoot(), bundle.keys());

        ProofBundleVerifier.VerificationResult result = new ProofBundleVerifier().verify(forged);

        assertFalse(result.valid());
        assertTrue(result.failures().contains("receipt digest does not match the proof leaf"));
        assertThrows(ProofVerificationException.class, () -> new ProofBundleVerifier().requireValid(forged));
    }

    @Test
    void shouldRejectKeysOutsideTrustedSet() {
        ProofBundle bundle = exportOne();
        String strangerFingerprint = Ed25519Keys.fingerprint(Ed25519Keys.generate().getPublic());

        assertFalse(new ProofBundleVerifier(1, Set.of(strangerFingerprint)).verify(bundle).valid());

        Set<String> trusted = new HashSet<>();
        for (KeyDescriptor key : bundle.keys()) {
            trusted.add(key.fingerprint());
        }
        assertTrue(new ProofBundleVerifier(2, trusted).verify(bundle).valid());
    }

    @Test
    void shouldRejectSubstitutedPublicKey() {
        ProofBundle bundle = exportOne();
        KeyDescriptor original = bundle.keys().get(0);
        KeyDescriptor substituted = new KeyDescriptor(original.entityId(), original.role(), original.keyId(), original.algorithm(),
                Ed25519Keys.encodePublicKey(Ed25519Keys.generate().getPublic()), original.fingerprint(),
                original.validFrom(), original.validUntil(), original.revokedAt());
        List<KeyDescriptor> keys = new ArrayList<>(bundle.keys());
        keys.set(0, substituted);

        ProofBundle forged = new ProofBundle(bundle.format(), bundle.receipt(), bundle.proof(), bundle.batchRoot(), keys);

        assertFalse(new ProofBundleVerifier(2, Set.of(original.fingerprint())).verify(forged).valid());
    }

    @Test
    void shouldDemandConfiguredThreshold() {
        ProofBundle bundle = exportOne();

        assertFalse(new ProofBundleVerifier(3, Set.of()).verify(bundle).valid());
    }

    private static ProofBundle exportOne() {
        ReceiptFixtures fixtures = new ReceiptFixtures();
        MerkleBatcher batcher = new MerkleBatcher(fixtures.trust, EnumSet.of(SigningRole.PLATFORM_OPERATOR, SigningRole.AUDITOR), 2,
                new BatchWindow(10, Duration.ofDays(1)), fixtures.clock);
        AuditTrail trail = new AuditTrail(new InMemoryAppendOnlyLog(), batcher, fixtures.trust, RetryPolicy.none());
        try {
            trail.append(fixtures.seal("op-1"));
            trail.append(fixtures.seal("op-2"));
            trail.append(fixtures.seal("op-3"));
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        trail.flush();
        return trail.exportProofBundles("op-1").get(0);
    }
}
