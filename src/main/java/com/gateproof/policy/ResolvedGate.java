package com.gateproof.policy;

import com.gateproof.gate.Gate;

public record ResolvedGate(Gate gate, GateRule rule) {
    public String name() {
        return gate.name();
    }
}
