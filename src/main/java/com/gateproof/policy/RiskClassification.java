package com.gateproof.policy;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskClassification {
    LOW,
    STANDARD,
    HIGH,
    CRITICAL;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RiskClassification fromId(String id) {
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }

    public boolean elevated() {
        return this == HIGH || this == CRITICAL;
    }
}
