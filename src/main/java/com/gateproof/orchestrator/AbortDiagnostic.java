package com.gateproof.orchestrator;

import java.time.Instant;
import java.util.List;

import com.gateproof.receipt.GateOutcome;

/**
 * Local, unsigned record of an aborted stage run. Logged for debugging; never part of the evidentiary
 * trail.
 */
public record AbortDiagnostic(
        String operationId,
        String lifecycleId,
        String stage,
        OrchestratorState failedIn,
        String errorType,
        String message,
        Instant occurredAt,
        List<OrchestratorState> transitions,
        List<GateOutcome> verdicts) {

    public AbortDiagnostic {
        transitions = List.copyOf(transitions);
        verdicts = List.copyOf(verdicts);
    }
}
