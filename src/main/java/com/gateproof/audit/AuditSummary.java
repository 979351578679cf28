package com.gateproof.audit;

import java.util.Map;
import java.util.Set;

import com.gateproof.gate.GateStatus;
import com.gateproof.policy.EnforcementAction;

/**
 * Compliance overview of the stage receipts matching a query. Rates are fractions of
 * {@code stageReceipts}.
 */
public record AuditSummary(
        long stageReceipts,
        long reviewReceipts,
        Map<GateStatus, Long> statusCounts,
        Map<EnforcementAction, Long> actionCounts,
        double passRate,
        double failRate,
        double reviewRate,
        long blockedOperations,
        Set<String> stagesCovered,
        Set<String> policyRefs) {

    public AuditSummary {
        statusCounts = Map.copyOf(statusCounts);
        actionCounts = Map.copyOf(actionCounts);
        stagesCovered = Set.copyOf(stagesCovered);
        policyRefs = Set.copyOf(policyRefs);
    }
}
