package com.github.salilvnair.triage.intent;

/**
 * Fast-path result. {@code conclusive=false} means the heuristics found nothing either way.
 */
public record HeuristicVerdict(
        boolean documentQuestion,
        boolean conclusive,
        String matchedPattern
) {

    static HeuristicVerdict notADocumentQuestion(String reason) {
        return new HeuristicVerdict(false, true, reason);
    }

    static HeuristicVerdict documentQuestion(String pattern) {
        return new HeuristicVerdict(true, true, pattern);
    }

    static HeuristicVerdict inconclusive() {
        return new HeuristicVerdict(false, false, null);
    }
}
