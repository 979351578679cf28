package com.gateproof.policy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gateproof.gate.Gate;
import com.gateproof.gate.GateRegistry;
import com.gateproof.gate.GateStatus;
import com.gateproof.lifecycle.Stage;

/**
 * Keeps the version history of every policy and resolves, per stage, which registered gates run and
 * how their verdicts are enforced.
 */
public class PolicyEngine {
    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    private final Map<String, List<Policy>> history = new ConcurrentHashMap<>();

    public synchronized Policy register(Policy policy) {
        PolicyLoader.requireValid(policy);
        List<Policy> versions = history.computeIfAbsent(policy.policyId(), ignored -> new ArrayList<>());
        if (!versions.isEmpty()) {
            SemanticVersion active = versions.get(versions.size() - 1).version();
            if (policy.version().compareTo(active) <= 0) {
                throw new IllegalArgumentException("Policy " + policy.policyId() + " version " + policy.version()
                        + " must be greater than active version " + active);
            }
        }
        versions.add(policy);
        log.info("policy.registered id={} version={} ref={}", policy.policyId(), policy.version(), policy.ref());
        return policy;
    }

    public synchronized Optional<Policy> active(String policyId) {
        List<Policy> versions = history.get(policyId);
        return versions == null || versions.isEmpty() ? Optional.empty() : Optional.of(versions.get(versions.size() - 1));
    }

    public synchronized List<Policy> history(String policyId) {
        List<Policy> versions = history.get(policyId);
        return versions == null ? List.of() : List.copyOf(versions);
    }

    /** Applies {@code change} to the active version and registers the result under the next patch version. */
    public synchronized Policy revise(String policyId, UnaryOperator<Policy> change) {
        Policy current = active(policyId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown policy " + policyId));
        Policy revised = change.apply(current).withVersion(current.version().nextPatch());
        if (!policyId.equals(revised.policyId())) {
            throw new IllegalArgumentException("Revision must keep policy id " + policyId);
        }
        return register(revised);
    }

    public ResolvedStage resolve(Policy policy, Stage stage, GateRegistry registry) {
        StagePolicy stagePolicy = policy.stage(stage)
                .orElseGet(() -> new StagePolicy(false, null, null, null, List.of()));
        Map<String, Gate> registered = new LinkedHashMap<>();
        for (Gate gate : registry.gates(stage)) {
            registered.put(gate.name(), gate);
        }

        List<ResolvedGate> gates = new ArrayList<>();
        for (Gate gate : registered.values()) {
            stagePolicy.rule(gate.name())
                    .filter(GateRule::enabled)
                    .ifPresent(rule -> gates.add(new ResolvedGate(gate, rule)));
        }
        List<String> missing = new ArrayList<>();
        for (GateRule rule : stagePolicy.gates()) {
            if (rule.enabled() && !registered.containsKey(rule.gateName())) {
                missing.add(rule.gateName());
            }
        }
        if (!missing.isEmpty()) {
            log.warn("policy.gates.missing stage={} policy={} gates={}", stage.id(), policy.policyId(), missing);
        }
        return new ResolvedStage(stage, policy.policyId(), policy.version(), policy.ref(), stagePolicy, gates, missing);
    }

    /**
     * Baseline policy for a risk classification. Elevated classifications add gates, tighten
     * thresholds and block on FAIL; critical also fails fast and shortens the escalation window.
     */
    public static Policy defaultPolicy(String policyId, RiskClassification risk) {
        Map<String, StagePolicy> stages = new LinkedHashMap<>();
        Duration escalation = risk == RiskClassification.CRITICAL ? Duration.ofHours(4) : Duration.ofHours(24);
        EnforcementAction onFail = risk.elevated() ? EnforcementAction.BLOCK : EnforcementAction.WARN;
        for (Stage stage : Stage.values()) {
            List<GateRule> rules = new ArrayList<>();
            for (String gateName : defaultGates(stage, risk)) {
                rules.add(new GateRule(gateName, true, defaultThresholds(gateName, risk), Map.of(GateStatus.FAIL, onFail)));
            }
            stages.put(stage.id(), new StagePolicy(
                    risk == RiskClassification.CRITICAL,
                    StagePolicy.DEFAULT_GATE_TIMEOUT,
                    escalation,
                    StagePolicy.defaultEnforcement(),
                    rules));
        }
        return new Policy(policyId, new SemanticVersion(1, 0, 0),
                "Default policy for " + risk.id() + " risk classification", risk, stages);
    }

    private static List<String> defaultGates(Stage stage, RiskClassification risk) {
        List<String> gates = new ArrayList<>();
        switch (stage) {
            case DATASET -> {
                gates.add("bias");
                gates.add("compliance-mapping");
                if (risk.elevated()) {
                    gates.add("uncertainty");
                }
            }
            case MODEL -> gates.add("compliance-mapping");
            case TRAINING -> {
                gates.add("bias");
                gates.add("uncertainty");
                if (risk.elevated()) {
                    gates.add("explainability");
                    gates.add("compliance-mapping");
                }
            }
            case DEPLOYMENT -> {
                gates.add("bias");
                gates.add("explainability");
                gates.add("robustness");
                gates.add("compliance-mapping");
            }
            case INFERENCE -> {
                gates.add("uncertainty");
                gates.add("hitl");
                if (risk.elevated()) {
                    gates.add("bias");
                    gates.add("explainability");
                }
            }
        }
        return gates;
    }

    private static Map<String, Double> defaultThresholds(String gateName, RiskClassification risk) {
        return switch (gateName) {
            case "bias" -> Map.of("demographic_parity_delta", risk.elevated() ? 0.05 : 0.1);
            case "uncertainty" -> Map.of("max_epistemic_uncertainty", 0.1, "max_aleatoric_uncertainty", 0.2);
            case "robustness" -> Map.of("min_adversarial_accuracy", risk.elevated() ? 0.8 : 0.7);
            default -> Map.of();
        };
    }
}
