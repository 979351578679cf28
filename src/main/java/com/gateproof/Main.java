package com.gateproof;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gateproof.audit.ProofBundle;
import com.gateproof.audit.ProofBundleCodec;
import com.gateproof.audit.ProofBundleVerifier;
import com.gateproof.policy.Policy;
import com.gateproof.policy.PolicyEngine;
import com.gateproof.policy.PolicyLoader;
import com.gateproof.policy.PolicyValidationException;
import com.gateproof.policy.RiskClassification;
import com.gateproof.runtime.AppConfig;
import com.gateproof.runtime.ConfigLoader;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "gateproof",
        mixinStandardHelpOptions = true,
        version = "gateproof 0.1.0",
        description = "Offline verification of proof bundles and policy files.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "validate-policy",
            converter = ModeConverter.class)
    Mode mode;

    @Option(names = "--bundle", description = "Proof bundle JSON to verify")
    Path bundlePath;

    @Option(names = "--threshold", description = "Minimum distinct batch root signers", defaultValue = "1")
    int threshold;

    @Option(names = "--trusted-key", description = "Trusted key fingerprint (repeatable)")
    List<String> trustedKeys;

    @Option(names = "--policy", description = "Policy file (YAML or JSON); defaults to the configured policy")
    Path policyPath;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        return switch (mode) {
            case VERIFY_BUNDLE -> verifyBundle();
            case VALIDATE_POLICY -> validatePolicy();
        };
    }

    private int verifyBundle() throws IOException {
        if (bundlePath == null) {
            System.err.println("--bundle is required in verify-bundle mode");
            return 2;
        }
        ProofBundle bundle = new ProofBundleCodec().read(bundlePath);
        Set<String> trusted = trustedKeys == null ? Set.of() : new LinkedHashSet<>(trustedKeys);
        ProofBundleVerifier.VerificationResult result = new ProofBundleVerifier(threshold, trusted).verify(bundle);
        if (result.valid()) {
            log.info("bundle.verified receiptId={} batchId={}", bundle.receipt().receiptId(), bundle.batchRoot().batchId());
            System.out.println("VALID receipt=" + bundle.receipt().receiptId() + " batch=" + bundle.batchRoot().batchId());
            return 0;
        }
        log.warn("bundle.rejected path={} failures={}", bundlePath, result.failures());
        System.out.println("INVALID");
        result.failures().forEach(failure -> System.out.println("  - " + failure));
        return 1;
    }

    private int validatePolicy() throws IOException {
        AppConfig config = ConfigLoader.load(Path.of(configPath));
        Path path = policyPath;
        if (path == null && config.getPolicy().getPath() != null && !config.getPolicy().getPath().isBlank()) {
            path = Path.of(config.getPolicy().getPath());
        }
        try {
            Policy policy = path == null
                    ? PolicyLoader.requireValid(PolicyEngine.defaultPolicy(config.getPolicy().getPolicyId(),
                            RiskClassification.fromId(config.getPolicy().getRiskClassification())))
                    : new PolicyLoader().load(path);
            System.out.println("VALID policy=" + policy.ref());
            return 0;
        } catch (PolicyValidationException e) {
            log.warn("policy.rejected path={} errors={}", path, e.errors());
            System.out.println("INVALID");
            e.errors().forEach(error -> System.out.println("  - " + error));
            return 1;
        }
    }

    enum Mode {
        VERIFY_BUNDLE("verify-bundle"),
        VALIDATE_POLICY("validate-policy");

        private final String id;

        Mode(String id) {
            this.id = id;
        }

        @Override
        public String toString() {
            return id;
        }
    }

    static class ModeConverter implements CommandLine.ITypeConverter<Mode> {
        @Override
        public Mode convert(String value) {
            for (Mode candidate : Mode.values()) {
                if (candidate.id.equalsIgnoreCase(value)) {
                    return candidate;
                }
            }
            throw new CommandLine.TypeConversionException("Unknown mode: " + value);
        }
    }
}
