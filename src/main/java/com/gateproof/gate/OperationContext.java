package com.gateproof.gate;

import java.util.List;
import java.util.Map;

import com.gateproof.crypto.CanonicalEncoder;
import com.gateproof.lifecycle.Stage;

/**
 * Immutable input of one stage run. Gates read it; nobody mutates it.
 */
public record OperationContext(
        String operationId,
        String lifecycleId,
        Stage stage,
        Map<String, String> metadata,
        List<EvidenceRef> evidence) {

    public OperationContext {
        if (operationId == null || operationId.isBlank()) {
            throw new IllegalArgumentException("operationId must not be blank");
        }
        if (lifecycleId == null || lifecycleId.isBlank()) {
            throw new IllegalArgumentException("lifecycleId must not be blank");
        }
        if (stage == null) {
            throw new IllegalArgumentException("stage must not be null");
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    public static OperationContext of(String operationId, String lifecycleId, Stage stage, EvidenceRef... evidence) {
        return new OperationContext(operationId, lifecycleId, stage, Map.of(), List.of(evidence));
    }

    /** Digest over the evidence references in the order supplied. */
    public String evidenceDigest() {
        CanonicalEncoder encoder = new CanonicalEncoder("gateproof.evidence.v1").field(evidence.size());
        for (EvidenceRef ref : evidence) {
            encoder.field(ref.name()).field(ref.digest()).field(ref.uri());
        }
        return encoder.digestHex();
    }
}
