package com.gateproof.gate;

import java.util.EnumSet;
import java.util.Set;

import com.gateproof.lifecycle.Stage;

/**
 * Pluggable evaluator. Implementations must be a pure function of the context so a verdict can be
 * reproduced from the same context and policy.
 */
public interface Gate {
    String name();

    default Set<Stage> supportedStages() {
        return EnumSet.allOf(Stage.class);
    }

    GateVerdict evaluate(GateContext context);
}
