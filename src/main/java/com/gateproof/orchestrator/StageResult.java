package com.gateproof.orchestrator;

import java.util.List;
import java.util.Optional;

import com.gateproof.gate.GateStatus;
import com.gateproof.gate.GateVerdict;
import com.gateproof.lifecycle.Stage;
import com.gateproof.policy.EnforcementAction;
import com.gateproof.receipt.Outcome;
import com.gateproof.receipt.Receipt;

/**
 * Outcome of a stage that was allowed to proceed.
 */
public record StageResult(
        String operationId,
        Stage stage,
        String policyRef,
        GateStatus aggregateStatus,
        EnforcementAction action,
        Outcome outcome,
        List<GateVerdict> verdicts,
        List<String> warnings,
        Receipt receipt,
        Receipt reviewReceipt,
        List<OrchestratorState> transitions) {

    public StageResult {
        verdicts = List.copyOf(verdicts);
        warnings = List.copyOf(warnings);
        transitions = List.copyOf(transitions);
    }

    public Optional<Receipt> review() {
        return Optional.ofNullable(reviewReceipt);
    }

    public OrchestratorState finalState() {
        return transitions.get(transitions.size() - 1);
    }
}
