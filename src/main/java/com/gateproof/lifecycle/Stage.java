package com.gateproof.lifecycle;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle stages in anchoring order. An anchor for a stage is keyed by the anchor of the stage
 * before it; {@link #DATASET} is keyed by the lifecycle root.
 */
public enum Stage {
    DATASET,
    MODEL,
    TRAINING,
    DEPLOYMENT,
    INFERENCE;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public Stage previous() {
        return ordinal() == 0 ? null : values()[ordinal() - 1];
    }

    public static Stage fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Stage id must not be blank");
        }
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}
