package com.gateproof.merkle;

import java.time.Duration;

/** Bounds of one open batch: whichever of count or age is reached first closes it. */
public record BatchWindow(int maxReceipts, Duration maxAge) {
    public BatchWindow {
        if (maxReceipts < 1) {
            throw new IllegalArgumentException("maxReceipts must be >= 1");
        }
        if (maxAge == null || maxAge.isNegative() || maxAge.isZero()) {
            throw new IllegalArgumentException("maxAge must be positive");
        }
    }
}
