package com.gateproof.trust;

/**
 * No authorized signer could produce a signature right now. Transient: callers retry with backoff.
 */
public class SigningUnavailableException extends RuntimeException {
    public SigningUnavailableException(String message) {
        super(message);
    }

    public SigningUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
