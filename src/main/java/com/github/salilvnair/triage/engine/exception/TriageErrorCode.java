package com.github.salilvnair.triage.engine.exception;

public enum TriageErrorCode {

    // =========================
    // External service errors (recovered inside the engine)
    // =========================
    CLASSIFICATION_FAILED(
            "Completion-based intent classification failed",
            true
    ),

    EXTRACTION_FAILED(
            "Field extraction returned no usable JSON",
            true
    ),

    // =========================
    // Run errors
    // =========================
    SNAPSHOT_LOAD_FAILED(
            "Failed to load rules, roster or synonym table",
            false
    ),

    STAGE_FAILED(
            "Triage stage execution failed",
            false
    ),

    NO_DECISION(
            "Triage pipeline completed without producing a decision",
            false
    ),

    TRIAGE_TIMEOUT(
            "Triage run timed out",
            true
    ),

    TRIAGE_CANCELLED(
            "Triage run was cancelled",
            true
    ),

    // =========================
    // Wiring errors
    // =========================
    DUPLICATE_TRIAGE_STEP(
            "More than one TriageStep bean registered for a stage",
            false
    ),

    INVALID_REQUEST(
            "Triage request is invalid",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    TriageErrorCode(String defaultMessage, boolean recoverable) {
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
