package com.gateproof;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.gateproof.audit.AuditTrail;
import com.gateproof.audit.InMemoryAppendOnlyLog;
import com.gateproof.audit.ProofBundle;
import com.gateproof.audit.ProofBundleCodec;
import com.gateproof.merkle.BatchWindow;
import com.gateproof.merkle.MerkleBatcher;
import com.gateproof.receipt.Receipt;
import com.gateproof.receipt.ReceiptFixtures;
import com.gateproof.runtime.RetryPolicy;
import com.gateproof.trust.SigningRole;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MainTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldValidateDefaultPolicy() {
        int exitCode = new CommandLine(new Main()).execute(
                "--mode", "validate-policy",
                "--config", tempDir.resolve("absent.yml").toString());

        assertEquals(0, exitCode);
    }

    @Test
    void shouldValidatePolicyFile() throws URISyntaxException {
        Path policy = Path.of(getClass().getResource("/policy/sample-policy.yml").toURI());

        int exitCode = new CommandLine(new Main()).execute("--mode", "validate-policy", "--policy", policy.toString());

        assertEquals(0, exitCode);
    }

    @Test
    void shouldReportInvalidPolicyFile() throws IOException {
        Path policy = tempDir.resolve("broken.yml");
        Files.writeString(policy, """
                policyId: ""
                version: 1.0.0
                stages:
                  staging:
                    gates: []
                """);

        int exitCode = new CommandLine(new Main()).execute("--mode", "validate-policy", "--policy", policy.toString());

        assertEquals(1, exitCode);
    }

    @Test
    void shouldVerifyExportedBundle() throws IOException {
        Path bundlePath = tempDir.resolve("op-1.json");
        new ProofBundleCodec().write(exportBundle(), bundlePath);

        int exitCode = new CommandLine(new Main()).execute("--mode", "verify-bundle", "--bundle", bundlePath.toString(), "--threshold", "2");

        assertEquals(0, exitCode);
    }

    @Test
    void shouldRejectTamperedBundle() throws IOException {
        ProofBundle bundle = exportBundle();
        Receipt receipt = bundle.receipt();
        Receipt tampered = new Receipt(receipt.receiptId(), receipt.kind(), "op-other", receipt.lifecycleId(), receipt.stage(),
                receipt.anchorDigest(), receipt.evidenceDigest(), receipt.policyRef(), receipt.timestamp(), receipt.verdictSummary(),
                receipt.parentReceiptId(), receipt.signature());
        Path bundlePath = tempDir.resolve("tampered.json");
        new ProofBundleCodec().write(new ProofBundle(bundle.format(), tampered, bundle.proof(), bundle.batchRoot(), bundle.keys()), bundlePath);

        int exitCode = new CommandLine(new Main()).execute("--mode", "verify-bundle", "--bundle", bundlePath.toString());

        assertEquals(1, exitCode);
    }

    @Test
    void shouldRequireBundleInVerifyMode() {
        assertEquals(2, new CommandLine(new Main()).execute("--mode", "verify-bundle"));
    }

    @Test
    void shouldRejectUnknownMode() {
        assertEquals(CommandLine.ExitCode.USAGE, new CommandLine(new Main()).execute("--mode", "publish"));
    }

    private static ProofBundle exportBundle() throws IOException {
        ReceiptFixtures fixtures = new ReceiptFixtures();
        MerkleBatcher batcher = new MerkleBatcher(fixtures.trust, EnumSet.of(SigningRole.PLATFORM_OPERATOR, SigningRole.AUDITOR), 2,
                new BatchWindow(10, Duration.ofDays(1)), fixtures.clock);
        AuditTrail trail = new AuditTrail(new InMemoryAppendOnlyLog(), batcher, fixtures.trust, RetryPolicy.none());
        trail.append(fixtures.seal("op-1"));
        trail.append(fixtures.seal("op-2"));
        trail.flush();
        return trail.exportProofBundles("op-1").get(0);
    }
}
