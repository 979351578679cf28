package com.gateproof.gate;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.gateproof.crypto.CanonicalEncoder;
import com.gateproof.lifecycle.Stage;

public record GateVerdict(
        String gateName,
        Stage stage,
        GateStatus status,
        Map<String, Double> metrics,
        List<String> recommendations,
        String evidenceDigest,
        String detail) {

    public GateVerdict {
        if (gateName == null || gateName.isBlank()) {
            throw new IllegalArgumentException("gateName must not be blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public static GateVerdict of(String gateName, Stage stage, GateStatus status, String detail) {
        return new GateVerdict(gateName, stage, status, Map.of(), List.of(), null, detail);
    }

    public static GateVerdict skipped(String gateName, Stage stage) {
        return of(gateName, stage, GateStatus.SKIPPED, "skipped after fail-fast");
    }

    /** Canonical digest of the verdict; metrics are encoded in key order. */
    public String digest() {
        CanonicalEncoder encoder = new CanonicalEncoder("gateproof.verdict.v1")
                .field(gateName)
                .field(stage == null ? null : stage.id())
                .field(status.name())
                .field(metrics.size());
        new TreeMap<>(metrics).forEach((name, value) -> encoder.field(name).field(Double.toString(value)));
        encoder.field(recommendations.size());
        recommendations.forEach(encoder::field);
        return encoder.field(evidenceDigest).field(detail).digestHex();
    }
}
