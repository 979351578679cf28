package com.gateproof.policy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.gateproof.crypto.Digests;
import com.gateproof.gate.GateStatus;
import com.gateproof.lifecycle.Stage;

/**
 * Reads policies from YAML or JSON, validates them and computes their canonical digest.
 */
public class PolicyLoader {
    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .findAndAddModules()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory()).findAndRegisterModules();
    private final ObjectMapper jsonMapper = JsonMapper.builder().findAndAddModules().build();

    public Policy load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new PolicyValidationException(List.of("Policy file not found: " + path));
        }
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = fileName.endsWith(".yml") || fileName.endsWith(".yaml") ? yamlMapper : jsonMapper;
        Policy policy;
        try {
            policy = mapper.readValue(path.toFile(), Policy.class);
        } catch (JsonProcessingException e) {
            throw new PolicyValidationException("Failed to parse policy from " + path + ": " + e.getOriginalMessage(), e);
        }
        return requireValid(policy);
    }

    public Policy readYaml(String yaml) {
        try {
            return requireValid(yamlMapper.readValue(yaml, Policy.class));
        } catch (JsonProcessingException e) {
            throw new PolicyValidationException("Failed to parse policy: " + e.getOriginalMessage(), e);
        }
    }

    public void write(Policy policy, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = fileName.endsWith(".yml") || fileName.endsWith(".yaml") ? yamlMapper : jsonMapper;
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), policy);
    }

    public static Policy requireValid(Policy policy) {
        List<String> errors = validate(policy);
        if (!errors.isEmpty()) {
            throw new PolicyValidationException(errors);
        }
        return policy;
    }

    /** Every problem found, empty when the policy is usable. */
    public static List<String> validate(Policy policy) {
        List<String> errors = new ArrayList<>();
        if (policy == null) {
            errors.add("Policy is empty");
            return errors;
        }
        if (policy.policyId() == null || policy.policyId().isBlank()) {
            errors.add("Policy ID is required");
        }
        if (policy.version() == null) {
            errors.add("Policy version is required");
        }
        for (Map.Entry<String, StagePolicy> entry : policy.stages().entrySet()) {
            String stageId = entry.getKey();
            if (!isStageId(stageId)) {
                errors.add("Unknown stage: " + stageId);
            }
            StagePolicy stagePolicy = entry.getValue();
            if (stagePolicy == null) {
                errors.add("Stage " + stageId + ": policy body is missing");
                continue;
            }
            validateStage(stageId, stagePolicy, errors);
        }
        return errors;
    }

    private static void validateStage(String stageId, StagePolicy stagePolicy, List<String> errors) {
        if (stagePolicy.gateTimeout().isNegative() || stagePolicy.gateTimeout().isZero()) {
            errors.add("Stage " + stageId + ": gate timeout must be positive");
        }
        if (stagePolicy.escalationTimeout().isNegative() || stagePolicy.escalationTimeout().isZero()) {
            errors.add("Stage " + stageId + ": escalation timeout must be positive");
        }
        validateEnforcement("Stage " + stageId, stagePolicy.enforcement(), errors);

        Set<String> seen = new HashSet<>();
        for (GateRule rule : stagePolicy.gates()) {
            if (rule == null || rule.gateName() == null || rule.gateName().isBlank()) {
                errors.add("Stage " + stageId + ": gate name is required");
                continue;
            }
            String label = "Stage " + stageId + ", Gate " + rule.gateName();
            if (!seen.add(rule.gateName())) {
                errors.add(label + ": configured more than once");
            }
            for (Map.Entry<String, Double> threshold : rule.thresholds().entrySet()) {
                Double value = threshold.getValue();
                if (value == null || value.isNaN() || value.isInfinite()) {
                    errors.add(label + ": threshold " + threshold.getKey() + " must be numeric");
                }
            }
            validateEnforcement(label, rule.enforcement(), errors);
        }
    }

    private static void validateEnforcement(String label, Map<GateStatus, EnforcementAction> enforcement, List<String> errors) {
        for (Map.Entry<GateStatus, EnforcementAction> entry : enforcement.entrySet()) {
            if (entry.getKey() == GateStatus.SKIPPED) {
                errors.add(label + ": SKIPPED cannot carry an enforcement action");
            }
            if (entry.getValue() == null) {
                errors.add(label + ": enforcement action for " + entry.getKey() + " is missing");
            }
        }
    }

    private static boolean isStageId(String stageId) {
        for (Stage stage : Stage.values()) {
            if (stage.id().equals(stageId)) {
                return true;
            }
        }
        return false;
    }

    public static String canonicalJson(Policy policy) {
        try {
            return CANONICAL_MAPPER.writeValueAsString(policy);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Policy cannot be serialized: " + policy.policyId(), e);
        }
    }

    public static String digest(Policy policy) {
        return Digests.sha256Hex(canonicalJson(policy));
    }
}
