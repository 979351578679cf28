package com.gateproof.gate;

import java.util.Collection;

/**
 * Verdict status ranked by severity. {@link #SKIPPED} marks gates cut off by fail-fast and never
 * takes part in aggregation.
 */
public enum GateStatus {
    PASS(0),
    WARN(1),
    REVIEW(2),
    FAIL(3),
    SKIPPED(-1);

    private final int rank;

    GateStatus(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /** Worst status ranked FAIL > REVIEW > WARN > PASS; PASS when nothing ran. */
    public static GateStatus worst(Collection<GateStatus> statuses) {
        GateStatus worst = PASS;
        for (GateStatus status : statuses) {
            if (status != null && status.rank > worst.rank) {
                worst = status;
            }
        }
        return worst;
    }
}
