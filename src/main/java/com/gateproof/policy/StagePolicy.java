package com.gateproof.policy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.gateproof.gate.GateStatus;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StagePolicy(
        boolean failFast,
        Duration gateTimeout,
        Duration escalationTimeout,
        Map<GateStatus, EnforcementAction> enforcement,
        List<GateRule> gates) {

    public static final Duration DEFAULT_GATE_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_ESCALATION_TIMEOUT = Duration.ofHours(24);

    public StagePolicy {
        gateTimeout = gateTimeout == null ? DEFAULT_GATE_TIMEOUT : gateTimeout;
        escalationTimeout = escalationTimeout == null ? DEFAULT_ESCALATION_TIMEOUT : escalationTimeout;
        enforcement = enforcement == null ? defaultEnforcement() : Collections.unmodifiableMap(new LinkedHashMap<>(enforcement));
        gates = gates == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(gates));
    }

    /** PASS allows, WARN warns, REVIEW escalates, FAIL blocks. */
    public static Map<GateStatus, EnforcementAction> defaultEnforcement() {
        Map<GateStatus, EnforcementAction> mapping = new EnumMap<>(GateStatus.class);
        mapping.put(GateStatus.PASS, EnforcementAction.ALLOW);
        mapping.put(GateStatus.WARN, EnforcementAction.WARN);
        mapping.put(GateStatus.REVIEW, EnforcementAction.ESCALATE);
        mapping.put(GateStatus.FAIL, EnforcementAction.BLOCK);
        return Map.copyOf(mapping);
    }

    public Optional<GateRule> rule(String gateName) {
        return gates.stream().filter(rule -> rule.gateName().equals(gateName)).findFirst();
    }

    /**
     * Action for one gate's status: the gate's own override when present, then the stage mapping, then
     * the default mapping. SKIPPED always allows.
     */
    public EnforcementAction actionFor(GateStatus status, GateRule rule) {
        if (status == GateStatus.SKIPPED) {
            return EnforcementAction.ALLOW;
        }
        if (rule != null && rule.enforcement().containsKey(status)) {
            return rule.enforcement().get(status);
        }
        EnforcementAction action = enforcement.get(status);
        return action != null ? action : defaultEnforcement().get(status);
    }
}
