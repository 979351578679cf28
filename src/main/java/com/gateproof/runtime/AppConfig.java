package com.gateproof.runtime;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private OrchestratorConfig orchestrator = new OrchestratorConfig();
    private SigningConfig signing = new SigningConfig();
    private BatchConfig batch = new BatchConfig();
    private AuditConfig audit = new AuditConfig();
    private PolicyConfig policy = new PolicyConfig();

    public OrchestratorConfig getOrchestrator() {
        return orchestrator;
    }

    public void setOrchestrator(OrchestratorConfig orchestrator) {
        this.orchestrator = orchestrator == null ? new OrchestratorConfig() : orchestrator;
    }

    public SigningConfig getSigning() {
        return signing;
    }

    public void setSigning(SigningConfig signing) {
        this.signing = signing == null ? new SigningConfig() : signing;
    }

    public BatchConfig getBatch() {
        return batch;
    }

    public void setBatch(BatchConfig batch) {
        this.batch = batch == null ? new BatchConfig() : batch;
    }

    public AuditConfig getAudit() {
        return audit;
    }

    public void setAudit(AuditConfig audit) {
        this.audit = audit == null ? new AuditConfig() : audit;
    }

    public PolicyConfig getPolicy() {
        return policy;
    }

    public void setPolicy(PolicyConfig policy) {
        this.policy = policy == null ? new PolicyConfig() : policy;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OrchestratorConfig {
        private int gateWorkers = 4;
        private int signingMaxRetries = 3;
        private long signingRetryBackoffMs = 200;

        public int getGateWorkers() {
            return gateWorkers;
        }

        public void setGateWorkers(int gateWorkers) {
            this.gateWorkers = gateWorkers;
        }

        public int getSigningMaxRetries() {
            return signingMaxRetries;
        }

        public void setSigningMaxRetries(int signingMaxRetries) {
            this.signingMaxRetries = signingMaxRetries;
        }

        public long getSigningRetryBackoffMs() {
            return signingRetryBackoffMs;
        }

        public void setSigningRetryBackoffMs(long signingRetryBackoffMs) {
            this.signingRetryBackoffMs = signingRetryBackoffMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SigningConfig {
        private String receiptRole = "PLATFORM_OPERATOR";
        private List<String> batchRoles = new ArrayList<>(List.of("PLATFORM_OPERATOR", "AUDITOR"));
        private int batchThreshold = 2;
        private int thresholdAttempts = 3;
        private long thresholdBackoffMs = 100;

        public String getReceiptRole() {
            return receiptRole;
        }

        public void setReceiptRole(String receiptRole) {
            this.receiptRole = receiptRole;
        }

        public List<String> getBatchRoles() {
            return batchRoles;
        }

        public void setBatchRoles(List<String> batchRoles) {
            this.batchRoles = batchRoles == null ? new ArrayList<>() : batchRoles;
        }

        public int getBatchThreshold() {
            return batchThreshold;
        }

        public void setBatchThreshold(int batchThreshold) {
            this.batchThreshold = batchThreshold;
        }

        public int getThresholdAttempts() {
            return thresholdAttempts;
        }

        public void setThresholdAttempts(int thresholdAttempts) {
            this.thresholdAttempts = thresholdAttempts;
        }

        public long getThresholdBackoffMs() {
            return thresholdBackoffMs;
        }

        public void setThresholdBackoffMs(long thresholdBackoffMs) {
            this.thresholdBackoffMs = thresholdBackoffMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BatchConfig {
        private int maxReceipts = 256;
        private long maxAgeMs = 60_000;

        public int getMaxReceipts() {
            return maxReceipts;
        }

        public void setMaxReceipts(int maxReceipts) {
            this.maxReceipts = maxReceipts;
        }

        public long getMaxAgeMs() {
            return maxAgeMs;
        }

        public void setMaxAgeMs(long maxAgeMs) {
            this.maxAgeMs = maxAgeMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AuditConfig {
        private String backend = "memory";
        private String path = ".gateproof/audit-log.jsonl";
        private int maxRetries = 3;
        private long retryBackoffMs = 100;

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PolicyConfig {
        private String path;
        private String policyId = "default";
        private String riskClassification = "standard";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getPolicyId() {
            return policyId;
        }

        public void setPolicyId(String policyId) {
            this.policyId = policyId;
        }

        public String getRiskClassification() {
            return riskClassification;
        }

        public void setRiskClassification(String riskClassification) {
            this.riskClassification = riskClassification;
        }
    }
}
