package com.gateproof.receipt;

public enum ReceiptKind {
    /** Automated gate evaluation and enforcement outcome of one stage. */
    STAGE,
    /** Human decision on an escalated stage, signed by the reviewer. */
    REVIEW
}
