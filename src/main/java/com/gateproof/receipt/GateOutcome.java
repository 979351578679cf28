package com.gateproof.receipt;

import com.gateproof.gate.GateStatus;
import com.gateproof.gate.GateVerdict;

/** One gate's line in a receipt: its status and the digest of its full verdict. */
public record GateOutcome(String gateName, GateStatus status, String verdictDigest) {
    public static GateOutcome of(GateVerdict verdict) {
        return new GateOutcome(verdict.gateName(), verdict.status(), verdict.digest());
    }
}
