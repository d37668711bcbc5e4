package com.github.salilvnair.triage.model;

/**
 * States of one triage run, in pipeline order.
 */
public enum TriageStage {
    START,
    CLASSIFYING,
    DOCUMENT_PATH,
    EXTRACTING,
    NORMALIZING,
    SCORING,
    RULE_FALLBACK,
    ASSIGNED,
    DOCUMENT_ANSWERED,
    NEEDS_INFO,
    DONE;

    public static TriageStage terminalFor(TriageOutcome outcome) {
        return switch (outcome) {
            case ASSIGNED -> ASSIGNED;
            case DOCUMENT_ANSWERED -> DOCUMENT_ANSWERED;
            case NEEDS_INFO -> NEEDS_INFO;
        };
    }
}
