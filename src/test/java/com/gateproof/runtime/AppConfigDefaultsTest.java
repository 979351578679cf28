package com.gateproof.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class AppConfigDefaultsTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldDefaultToInMemoryAuditAndTwoOfTwoBatchSigning() {
        AppConfig config = new AppConfig();

        assertEquals(4, config.getOrchestrator().getGateWorkers());
        assertEquals("PLATFORM_OPERATOR", config.getSigning().getReceiptRole());
        assertEquals(List.of("PLATFORM_OPERATOR", "AUDITOR"), config.getSigning().getBatchRoles());
        assertEquals(2, config.getSigning().getBatchThreshold());
        assertEquals(256, config.getBatch().getMaxReceipts());
        assertEquals("memory", config.getAudit().getBackend());
        assertNull(config.getPolicy().getPath());
        assertEquals("standard", config.getPolicy().getRiskClassification());
    }

    @Test
    void shouldOverlayYamlOnDefaults() throws IOException {
        Path configPath = tempDir.resolve("gateproof.yml");
        Files.writeString(configPath, """
                orchestrator:
                  gateWorkers: 8
                batch:
                  maxReceipts: 16
                audit:
                  backend: jsonl
                  path: /var/lib/gateproof/audit.jsonl
                policy:
                  riskClassification: critical
                unknownSection:
                  ignored: true
                """);

        AppConfig config = ConfigLoader.load(configPath);

        assertEquals(8, config.getOrchestrator().getGateWorkers());
        assertEquals(3, config.getOrchestrator().getSigningMaxRetries());
        assertEquals(16, config.getBatch().getMaxReceipts());
        assertEquals(60_000, config.getBatch().getMaxAgeMs());
        assertEquals("jsonl", config.getAudit().getBackend());
        assertEquals("critical", config.getPolicy().getRiskClassification());
        assertEquals("default", config.getPolicy().getPolicyId());
    }

    @Test
    void shouldFallBackToDefaultsWhenConfigIsMissing() throws IOException {
        AppConfig config = ConfigLoader.load(tempDir.resolve("absent.yml"));

        assertEquals(2, config.getSigning().getBatchThreshold());
    }
}
