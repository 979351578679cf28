package com.gateproof.policy;

import java.util.List;

public class PolicyValidationException extends RuntimeException {
    private final List<String> errors;

    public PolicyValidationException(List<String> errors) {
        super("Policy validation failed: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public PolicyValidationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    public List<String> errors() {
        return errors;
    }
}
