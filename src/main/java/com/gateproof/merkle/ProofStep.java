package com.gateproof.merkle;

public record ProofStep(String siblingHash, Side side) {
}
