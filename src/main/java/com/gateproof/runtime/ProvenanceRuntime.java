package com.gateproof.runtime;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gateproof.audit.AppendOnlyLog;
import com.gateproof.audit.AuditTrail;
import com.gateproof.audit.InMemoryAppendOnlyLog;
import com.gateproof.audit.JsonLinesAppendOnlyLog;
import com.gateproof.gate.GateRegistry;
import com.gateproof.lifecycle.LifecycleRegistry;
import com.gateproof.merkle.BatchWindow;
import com.gateproof.merkle.MerkleBatcher;
import com.gateproof.orchestrator.GateOrchestrator;
import com.gateproof.orchestrator.PendingReviewQueue;
import com.gateproof.policy.Policy;
import com.gateproof.policy.PolicyEngine;
import com.gateproof.policy.PolicyLoader;
import com.gateproof.policy.RiskClassification;
import com.gateproof.receipt.MonotonicTimeSource;
import com.gateproof.receipt.ReceiptGenerator;
import com.gateproof.trust.SigningRole;
import com.gateproof.trust.TrustLayer;

/**
 * Wires the provenance engine and the orchestrator from configuration. The trust layer is supplied by
 * the caller since key material never comes from config files.
 */
public class ProvenanceRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProvenanceRuntime.class);

    private final AppConfig config;
    private final TrustLayer trustLayer;
    private final LifecycleRegistry lifecycles = new LifecycleRegistry();
    private final GateRegistry gates = new GateRegistry();
    private final PolicyEngine policies = new PolicyEngine();
    private final PendingReviewQueue reviews;
    private final MerkleBatcher batcher;
    private final AuditTrail auditTrail;
    private final GateOrchestrator orchestrator;

    public ProvenanceRuntime(AppConfig config, TrustLayer trustLayer, Clock clock) {
        this.config = config;
        this.trustLayer = trustLayer;
        this.reviews = new PendingReviewQueue(clock);

        AppConfig.SigningConfig signing = config.getSigning();
        Set<SigningRole> batchRoles = EnumSet.noneOf(SigningRole.class);
        for (String role : signing.getBatchRoles()) {
            batchRoles.add(SigningRole.valueOf(role.trim().toUpperCase(Locale.ROOT)));
        }
        this.batcher = new MerkleBatcher(trustLayer, batchRoles, signing.getBatchThreshold(),
                new BatchWindow(config.getBatch().getMaxReceipts(), Duration.ofMillis(config.getBatch().getMaxAgeMs())), clock);

        AppConfig.AuditConfig audit = config.getAudit();
        this.auditTrail = new AuditTrail(openLog(audit), batcher, trustLayer,
                new RetryPolicy(audit.getMaxRetries(), Duration.ofMillis(audit.getRetryBackoffMs())));

        ReceiptGenerator receipts = new ReceiptGenerator(trustLayer,
                SigningRole.valueOf(signing.getReceiptRole().trim().toUpperCase(Locale.ROOT)),
                new MonotonicTimeSource(clock, System::nanoTime));
        AppConfig.OrchestratorConfig orchestratorConfig = config.getOrchestrator();
        this.orchestrator = new GateOrchestrator(gates, policies, lifecycles, receipts, auditTrail, reviews,
                new RetryPolicy(orchestratorConfig.getSigningMaxRetries(), Duration.ofMillis(orchestratorConfig.getSigningRetryBackoffMs())),
                clock, orchestratorConfig.getGateWorkers());
        log.info("runtime.started auditBackend={} batchMaxReceipts={} batchThreshold={} batchRoles={}",
                audit.getBackend(), config.getBatch().getMaxReceipts(), signing.getBatchThreshold(), batchRoles);
    }

    /** Empty trust layer honouring the configured threshold-signing retry budget. */
    public static TrustLayer newTrustLayer(AppConfig config, Clock clock) {
        AppConfig.SigningConfig signing = config.getSigning();
        return new TrustLayer(clock, signing.getThresholdAttempts(), Duration.ofMillis(signing.getThresholdBackoffMs()));
    }

    /** Loads the configured policy file, or the default policy for the configured risk class, and registers it. */
    public Policy loadPolicy() throws IOException {
        AppConfig.PolicyConfig policyConfig = config.getPolicy();
        Policy policy = policyConfig.getPath() == null || policyConfig.getPath().isBlank()
                ? PolicyEngine.defaultPolicy(policyConfig.getPolicyId(), RiskClassification.fromId(policyConfig.getRiskClassification()))
                : new PolicyLoader().load(Path.of(policyConfig.getPath()));
        return policies.register(policy);
    }

    public TrustLayer trustLayer() {
        return trustLayer;
    }

    public LifecycleRegistry lifecycles() {
        return lifecycles;
    }

    public GateRegistry gates() {
        return gates;
    }

    public PolicyEngine policies() {
        return policies;
    }

    public PendingReviewQueue reviews() {
        return reviews;
    }

    public MerkleBatcher batcher() {
        return batcher;
    }

    public AuditTrail auditTrail() {
        return auditTrail;
    }

    public GateOrchestrator orchestrator() {
        return orchestrator;
    }

    @Override
    public void close() {
        orchestrator.close();
    }

    private static AppendOnlyLog openLog(AppConfig.AuditConfig audit) {
        String backend = audit.getBackend() == null ? "memory" : audit.getBackend().trim().toLowerCase(Locale.ROOT);
        return switch (backend) {
            case "memory" -> new InMemoryAppendOnlyLog();
            case "jsonl" -> new JsonLinesAppendOnlyLog(Path.of(audit.getPath()));
            default -> throw new IllegalArgumentException("Unknown audit backend: " + audit.getBackend());
        };
    }
}
