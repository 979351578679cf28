package com.gateproof.merkle;

public class ProofVerificationException extends RuntimeException {
    public ProofVerificationException(String message) {
        super(message);
    }
}
