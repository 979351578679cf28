package com.gateproof.receipt;

public enum Outcome {
    PROCEEDED,
    BLOCKED,
    APPROVED,
    REJECTED
}
