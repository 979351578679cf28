package com.gateproof.lifecycle;

public class InvalidParentException extends RuntimeException {
    private final String lifecycleId;
    private final Stage stage;

    public InvalidParentException(String lifecycleId, Stage stage, String message) {
        super("Invalid parent anchor for " + lifecycleId + "/" + stage.id() + ": " + message);
        this.lifecycleId = lifecycleId;
        this.stage = stage;
    }

    public String lifecycleId() {
        return lifecycleId;
    }

    public Stage stage() {
        return stage;
    }
}
