package com.gateproof.policy;

import java.util.List;

import com.gateproof.gate.GateStatus;
import com.gateproof.lifecycle.Stage;

/**
 * Gates to run for one stage under one policy. {@code missingGates} are enabled in the policy but
 * absent from the registry; they can never pass.
 */
public record ResolvedStage(
        Stage stage,
        String policyId,
        SemanticVersion policyVersion,
        String policyRef,
        StagePolicy stagePolicy,
        List<ResolvedGate> gates,
        List<String> missingGates) {

    public ResolvedStage {
        gates = List.copyOf(gates);
        missingGates = List.copyOf(missingGates);
    }

    public EnforcementAction actionFor(String gateName, GateStatus status) {
        return stagePolicy.actionFor(status, stagePolicy.rule(gateName).orElse(null));
    }
}
