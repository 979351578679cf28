package com.gateproof.orchestrator;

import java.util.Map;

import com.gateproof.gate.GateStatus;
import com.gateproof.policy.EnforcementAction;

/** A gate whose verdict drove the stage to block or escalate. */
public record BlockingGate(String gateName, GateStatus status, EnforcementAction action, Map<String, Double> thresholds, String detail) {
    public BlockingGate {
        thresholds = thresholds == null ? Map.of() : Map.copyOf(thresholds);
    }

    public String describe() {
        return "gate " + gateName + " returned " + status + " (thresholds " + thresholds + ")"
                + (detail == null || detail.isBlank() ? "" : ": " + detail);
    }
}
