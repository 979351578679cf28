package com.gateproof.orchestrator;

public enum OrchestratorState {
    IDLE,
    GATES_RUNNING,
    AGGREGATING,
    ENFORCING,
    SEALED,
    ABORTED;

    public boolean terminal() {
        return this == SEALED || this == ABORTED;
    }
}
