package com.gateproof.policy;

import java.util.Collection;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operational consequence of a verdict status, ordered by severity.
 */
public enum EnforcementAction {
    ALLOW,
    WARN,
    ESCALATE,
    BLOCK;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static EnforcementAction fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Enforcement action must not be blank");
        }
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }

    public static EnforcementAction mostSevere(Collection<EnforcementAction> actions) {
        EnforcementAction result = ALLOW;
        for (EnforcementAction action : actions) {
            if (action.ordinal() > result.ordinal()) {
                result = action;
            }
        }
        return result;
    }
}
