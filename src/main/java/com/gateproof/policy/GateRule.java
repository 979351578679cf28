package com.gateproof.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.gateproof.gate.GateStatus;

/**
 * Per-gate policy entry. {@code enforcement} overrides the stage mapping for the statuses it names.
 * Null entries are kept so that {@link PolicyLoader#validate(Policy)} can report them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GateRule(
        String gateName,
        boolean enabled,
        Map<String, Double> thresholds,
        Map<GateStatus, EnforcementAction> enforcement) {

    public GateRule {
        thresholds = thresholds == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(thresholds));
        enforcement = enforcement == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(enforcement));
    }

    public static GateRule of(String gateName, Map<String, Double> thresholds) {
        return new GateRule(gateName, true, thresholds, Map.of());
    }
}
