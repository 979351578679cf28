package com.gateproof.orchestrator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.gateproof.gate.GateStatus;
import com.gateproof.gate.GateVerdict;
import com.gateproof.policy.EnforcementAction;
import com.gateproof.policy.GateRule;
import com.gateproof.policy.ResolvedStage;

/**
 * Pure mapping from verdicts to an enforcement action under one resolved policy. Each verdict is
 * mapped through its gate's rule (or the stage mapping) and the most severe action wins.
 */
public record EnforcementDecision(
        GateStatus aggregateStatus,
        EnforcementAction action,
        List<String> warnings,
        List<BlockingGate> triggeringGates) {

    public EnforcementDecision {
        warnings = List.copyOf(warnings);
        triggeringGates = List.copyOf(triggeringGates);
    }

    public static EnforcementDecision decide(ResolvedStage resolved, List<GateVerdict> verdicts) {
        List<GateStatus> statuses = new ArrayList<>();
        List<EnforcementAction> actions = new ArrayList<>();
        for (GateVerdict verdict : verdicts) {
            statuses.add(verdict.status());
            actions.add(resolved.actionFor(verdict.gateName(), verdict.status()));
        }
        EnforcementAction action = EnforcementAction.mostSevere(actions);

        List<String> warnings = new ArrayList<>();
        List<BlockingGate> triggering = new ArrayList<>();
        for (int i = 0; i < verdicts.size(); i++) {
            GateVerdict verdict = verdicts.get(i);
            EnforcementAction gateAction = actions.get(i);
            if (gateAction == EnforcementAction.WARN) {
                warnings.add("gate " + verdict.gateName() + " " + verdict.status()
                        + (verdict.detail() == null || verdict.detail().isBlank() ? "" : ": " + verdict.detail()));
            }
            if (gateAction == action && (action == EnforcementAction.BLOCK || action == EnforcementAction.ESCALATE)) {
                Map<String, Double> thresholds = resolved.stagePolicy().rule(verdict.gateName())
                        .map(GateRule::thresholds)
                        .orElse(Map.of());
                triggering.add(new BlockingGate(verdict.gateName(), verdict.status(), gateAction, thresholds, verdict.detail()));
            }
        }
        return new EnforcementDecision(GateStatus.worst(statuses), action, warnings, triggering);
    }
}
