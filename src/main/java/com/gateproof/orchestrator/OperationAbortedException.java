package com.gateproof.orchestrator;

public class OperationAbortedException extends RuntimeException {
    private final transient AbortDiagnostic diagnostic;

    public OperationAbortedException(AbortDiagnostic diagnostic, Throwable cause) {
        super("Operation " + diagnostic.operationId() + " aborted in " + diagnostic.failedIn() + " at stage "
                + diagnostic.stage() + ": " + diagnostic.message(), cause);
        this.diagnostic = diagnostic;
    }

    public AbortDiagnostic diagnostic() {
        return diagnostic;
    }
}
