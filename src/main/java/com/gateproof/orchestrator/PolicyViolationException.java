package com.gateproof.orchestrator;

import java.util.List;
import java.util.stream.Collectors;

import com.gateproof.lifecycle.Stage;
import com.gateproof.receipt.Receipt;

/**
 * A stage was blocked by policy. This is an expected outcome, not a fault; the sealed receipt recording
 * the block is attached.
 */
public class PolicyViolationException extends RuntimeException {
    private final String operationId;
    private final Stage stage;
    private final String policyRef;
    private final List<BlockingGate> blockingGates;
    private final transient Receipt receipt;

    public PolicyViolationException(String operationId, Stage stage, String policyRef, List<BlockingGate> blockingGates, Receipt receipt, String reason) {
        super(message(operationId, stage, policyRef, blockingGates, reason));
        this.operationId = operationId;
        this.stage = stage;
        this.policyRef = policyRef;
        this.blockingGates = List.copyOf(blockingGates);
        this.receipt = receipt;
    }

    public String operationId() {
        return operationId;
    }

    public Stage stage() {
        return stage;
    }

    public String policyRef() {
        return policyRef;
    }

    public List<BlockingGate> blockingGates() {
        return blockingGates;
    }

    /** The sealed receipt recording the block, or for a refused later stage, the original block. */
    public Receipt receipt() {
        return receipt;
    }

    private static String message(String operationId, Stage stage, String policyRef, List<BlockingGate> gates, String reason) {
        String detail = gates.isEmpty()
                ? "no gate details"
                : gates.stream().map(BlockingGate::describe).collect(Collectors.joining("; "));
        return "Operation " + operationId + " blocked at stage " + stage.id() + " under policy " + policyRef
                + ": " + reason + "; " + detail;
    }
}
