package com.gateproof.gate;

import java.util.Map;

/**
 * What a gate sees: the operation plus the thresholds and policy reference the policy engine
 * attached for this gate.
 */
public record GateContext(OperationContext operation, Map<String, Double> thresholds, String policyRef) {
    public GateContext {
        if (operation == null) {
            throw new IllegalArgumentException("operation must not be null");
        }
        thresholds = thresholds == null ? Map.of() : Map.copyOf(thresholds);
    }

    public double threshold(String name, double defaultValue) {
        Double value = thresholds.get(name);
        return value == null ? defaultValue : value;
    }
}
