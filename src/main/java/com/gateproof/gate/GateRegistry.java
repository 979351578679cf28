package com.gateproof.gate;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gateproof.lifecycle.Stage;

/**
 * Stage to ordered gates, keyed by gate name. Registration order is evaluation order.
 */
public class GateRegistry {
    private static final Logger log = LoggerFactory.getLogger(GateRegistry.class);

    private final Map<Stage, Map<String, Gate>> gates = new EnumMap<>(Stage.class);

    public synchronized void register(Stage stage, Gate gate) {
        if (!gate.supportedStages().contains(stage)) {
            throw new IllegalArgumentException("Gate " + gate.name() + " does not support stage " + stage.id());
        }
        Map<String, Gate> stageGates = gates.computeIfAbsent(stage, ignored -> new LinkedHashMap<>());
        if (stageGates.putIfAbsent(gate.name(), gate) != null) {
            throw new IllegalArgumentException("Gate " + gate.name() + " already registered for stage " + stage.id());
        }
        log.info("gate.registered stage={} gate={}", stage.id(), gate.name());
    }

    /** Registers {@code gate} for every stage it supports. */
    public synchronized void register(Gate gate) {
        for (Stage stage : gate.supportedStages()) {
            register(stage, gate);
        }
    }

    public synchronized boolean unregister(Stage stage, String gateName) {
        Map<String, Gate> stageGates = gates.get(stage);
        boolean removed = stageGates != null && stageGates.remove(gateName) != null;
        if (removed) {
            log.info("gate.unregistered stage={} gate={}", stage.id(), gateName);
        }
        return removed;
    }

    public synchronized List<Gate> gates(Stage stage) {
        Map<String, Gate> stageGates = gates.get(stage);
        return stageGates == null ? List.of() : List.copyOf(new ArrayList<>(stageGates.values()));
    }

    public synchronized Optional<Gate> gate(Stage stage, String gateName) {
        Map<String, Gate> stageGates = gates.get(stage);
        return stageGates == null ? Optional.empty() : Optional.ofNullable(stageGates.get(gateName));
    }
}
