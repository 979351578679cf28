package com.gateproof.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.gateproof.lifecycle.Stage;

/**
 * Immutable, versioned policy. Stage policies are keyed by stage id ({@code dataset}, {@code model},
 * ...). Every decision made under a policy records {@link #ref()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Policy(
        String policyId,
        SemanticVersion version,
        String description,
        RiskClassification riskClassification,
        Map<String, StagePolicy> stages) {

    public Policy {
        riskClassification = riskClassification == null ? RiskClassification.STANDARD : riskClassification;
        stages = stages == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stages));
    }

    public Optional<StagePolicy> stage(Stage stage) {
        return Optional.ofNullable(stages.get(stage.id()));
    }

    /** {@code policyId@version#digest}, where digest covers the canonical JSON form of the policy. */
    public String ref() {
        return policyId + "@" + version + "#" + PolicyLoader.digest(this);
    }

    public Policy withVersion(SemanticVersion nextVersion) {
        return new Policy(policyId, nextVersion, description, riskClassification, stages);
    }
}
