package com.gateproof.orchestrator;

import java.time.Instant;
import java.util.List;

import com.gateproof.gate.GateStatus;
import com.gateproof.gate.GateVerdict;
import com.gateproof.lifecycle.Stage;

/**
 * A stage suspended on human review. The reviewer sees verdicts and evidence digests only.
 */
public record ReviewRequest(
        String requestId,
        String operationId,
        String lifecycleId,
        Stage stage,
        String policyRef,
        GateStatus aggregateStatus,
        List<String> escalatingGates,
        List<GateVerdict> verdicts,
        Instant requestedAt,
        Instant deadline) {

    public ReviewRequest {
        escalatingGates = List.copyOf(escalatingGates);
        verdicts = List.copyOf(verdicts);
    }
}
