package com.gateproof.audit;

import java.time.Instant;

import com.gateproof.lifecycle.Stage;
import com.gateproof.receipt.Receipt;

/**
 * Receipt filter; null criteria match everything. The time range is {@code [from, to)} on the
 * receipt's wall-clock timestamp.
 */
public record ReceiptQuery(String operationId, Stage stage, Instant from, Instant to) {
    public static ReceiptQuery all() {
        return new ReceiptQuery(null, null, null, null);
    }

    public static ReceiptQuery forOperation(String operationId) {
        return new ReceiptQuery(operationId, null, null, null);
    }

    public ReceiptQuery withStage(Stage value) {
        return new ReceiptQuery(operationId, value, from, to);
    }

    public ReceiptQuery between(Instant fromInclusive, Instant toExclusive) {
        return new ReceiptQuery(operationId, stage, fromInclusive, toExclusive);
    }

    public boolean matches(Receipt receipt) {
        if (operationId != null && !operationId.equals(receipt.operationId())) {
            return false;
        }
        if (stage != null && stage != receipt.stage()) {
            return false;
        }
        Instant at = receipt.timestamp().wallClock();
        if (from != null && at.isBefore(from)) {
            return false;
        }
        return to == null || at.isBefore(to);
    }
}
