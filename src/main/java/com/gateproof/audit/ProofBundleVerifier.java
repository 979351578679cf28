package com.gateproof.audit;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.gateproof.merkle.InclusionProof;
import com.gateproof.merkle.MerkleTree;
import com.gateproof.merkle.ProofVerificationException;
import com.gateproof.merkle.SignedBatchRoot;
import com.gateproof.receipt.Receipt;
import com.gateproof.receipt.ReceiptCodec;
import com.gateproof.trust.Ed25519Keys;
import com.gateproof.trust.EntitySignature;
import com.gateproof.trust.KeyDescriptor;

/**
 * Checks a proof bundle with nothing but its own contents. When trusted fingerprints are configured,
 * only signatures from those keys count; otherwise the bundled keys are taken at face value.
 */
public class ProofBundleVerifier {
    private final int minimumThreshold;
    private final Set<String> trustedFingerprints;

    public ProofBundleVerifier() {
        this(1, Set.of());
    }

    public ProofBundleVerifier(int minimumThreshold, Set<String> trustedFingerprints) {
        this.minimumThreshold = Math.max(1, minimumThreshold);
        this.trustedFingerprints = trustedFingerprints == null ? Set.of() : Set.copyOf(trustedFingerprints);
    }

    public VerificationResult verify(ProofBundle bundle) {
        List<String> failures = new ArrayList<>();
        if (bundle == null || bundle.receipt() == null || bundle.proof() == null || bundle.batchRoot() == null) {
            return new VerificationResult(false, List.of("bundle is incomplete"));
        }
        if (!ProofBundle.FORMAT.equals(bundle.format())) {
            failures.add("unsupported bundle format " + bundle.format());
        }

        Receipt receipt = bundle.receipt();
        InclusionProof proof = bundle.proof();
        SignedBatchRoot batchRoot = bundle.batchRoot();
        byte[] receiptDigest = ReceiptCodec.digest(receipt);

        if (!ReceiptCodec.digestHex(receipt).equals(proof.leafDigest())) {
            failures.add("receipt digest does not match the proof leaf");
        }
        if (!batchRoot.root().equals(proof.root()) || !batchRoot.batchId().equals(proof.batchId())
                || batchRoot.leafCount() != proof.leafCount()) {
            failures.add("proof does not belong to batch " + batchRoot.batchId());
        }
        if (!MerkleTree.verify(proof, batchRoot.root())) {
            failures.add("inclusion proof does not recompute to the batch root");
        }

        EntitySignature receiptSignature = receipt.signature();
        if (receiptSignature == null) {
            failures.add("receipt is unsigned");
        } else if (!verifiedBy(bundle, receiptDigest, receiptSignature)) {
            failures.add("receipt signature by " + receiptSignature.entityId() + " does not verify against a trusted key");
        }

        if (batchRoot.signature() == null) {
            failures.add("batch root is unsigned");
        } else {
            byte[] rootDigest = batchRoot.signingDigest();
            Set<String> signers = new HashSet<>();
            for (EntitySignature signature : batchRoot.signature().signatures()) {
                if (verifiedBy(bundle, rootDigest, signature)) {
                    signers.add(signature.entityId());
                }
            }
            int required = Math.max(minimumThreshold, batchRoot.signature().threshold());
            if (signers.size() < required) {
                failures.add("batch root carries " + signers.size() + " valid signatures, " + required + " required");
            }
        }
        return new VerificationResult(failures.isEmpty(), failures);
    }

    public void requireValid(ProofBundle bundle) {
        VerificationResult result = verify(bundle);
        if (!result.valid()) {
            throw new ProofVerificationException("Proof bundle rejected: " + String.join("; ", result.failures()));
        }
    }

    private boolean verifiedBy(ProofBundle bundle, byte[] digest, EntitySignature signature) {
        Optional<KeyDescriptor> key = bundle.keys().stream().filter(descriptor -> descriptor.matches(signature)).findFirst();
        if (key.isEmpty()) {
            return false;
        }
        try {
            // the bundled fingerprint field is not trusted; recompute it from the key bytes
            String fingerprint = Ed25519Keys.fingerprint(Ed25519Keys.decodePublicKey(key.get().publicKey()));
            if (!trustedFingerprints.isEmpty() && !trustedFingerprints.contains(fingerprint)) {
                return false;
            }
            return key.get().verify(digest, signature);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public record VerificationResult(boolean valid, List<String> failures) {
        public VerificationResult {
            failures = List.copyOf(failures);
        }
    }
}
