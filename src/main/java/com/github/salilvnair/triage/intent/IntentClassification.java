package com.github.salilvnair.triage.intent;

public record IntentClassification(
        boolean documentQuestion,
        Source source,
        String matchedPattern
) {
    public enum Source {
        /** decided by the keyword heuristics */
        HEURISTIC,
        /** decided by the completion service */
        COMPLETION,
        /** completion call failed or was disabled, heuristic verdict kept */
        HEURISTIC_FALLBACK
    }
}
