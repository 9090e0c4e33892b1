package com.github.salilvnair.convstage.engine.exception;

public enum ConvStageErrorCode {

    // =========================
    // Rule validation errors
    // =========================
    VALIDATION_FAILED(
            "Stage rule is missing required fields or is malformed",
            false
    ),

    DUPLICATE_STAGE_RULE(
            "A stage rule already exists for this device and stage",
            false
    ),

    UNKNOWN_DEVICE(
            "Device is not listed by the device registry",
            false
    ),

    STAGE_RULE_NOT_FOUND(
            "Stage rule not found",
            false
    ),

    // =========================
    // Resolution errors
    // =========================
    UNRESOLVED_FIELD(
            "Prospect record does not contain the configured column",
            false
    ),

    UNSUPPORTED_RULE_TYPE(
            "Stage rule input type is not supported",
            false
    ),

    // =========================
    // Store / registry errors
    // =========================
    STORE_UNAVAILABLE(
            "Stage rule store is unavailable",
            true
    ),

    DEVICE_REGISTRY_UNAVAILABLE(
            "Device registry is unavailable",
            true
    );

    private final String defaultMessage;
    private final boolean recoverable;

    ConvStageErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
