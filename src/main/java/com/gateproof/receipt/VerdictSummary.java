package com.gateproof.receipt;

import java.util.List;

import com.gateproof.gate.GateStatus;
import com.gateproof.policy.EnforcementAction;

/**
 * Verdicts and enforcement decision carried by a receipt. {@code reviewReceiptId} links a stage
 * receipt to the review receipt that resolved its escalation.
 */
public record VerdictSummary(
        GateStatus aggregateStatus,
        EnforcementAction action,
        Outcome outcome,
        List<GateOutcome> gates,
        List<String> warnings,
        String reviewReceiptId) {

    public VerdictSummary {
        if (aggregateStatus == null || action == null || outcome == null) {
            throw new IllegalArgumentException("aggregateStatus, action and outcome are required");
        }
        gates = gates == null ? List.of() : List.copyOf(gates);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
