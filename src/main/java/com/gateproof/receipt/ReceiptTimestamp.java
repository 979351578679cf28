package com.gateproof.receipt;

import java.time.Instant;

/**
 * Wall-clock UTC instant plus a monotonic reading taken at the same moment.
 */
public record ReceiptTimestamp(Instant wallClock, long monotonicNanos) {
    public ReceiptTimestamp {
        if (wallClock == null) {
            throw new IllegalArgumentException("wallClock must not be null");
        }
    }
}
