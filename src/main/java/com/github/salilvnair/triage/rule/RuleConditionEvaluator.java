package com.github.salilvnair.triage.rule;

import com.github.salilvnair.triage.model.ExtractedInfo;
import com.github.salilvnair.triage.model.TriageCondition;
import com.github.salilvnair.triage.util.TermText;

public final class RuleConditionEvaluator {

    private RuleConditionEvaluator() {}

    /**
     * Compares the canonical field value with the condition value, both lower-cased and trimmed.
     * Missing fields, unknown field names and unknown operators never match.
     */
    public static boolean evaluate(TriageCondition condition, ExtractedInfo info) {
        if (condition == null || info == null || condition.operator() == null) {
            return false;
        }
        String actual = info.get(condition.field());
        if (!TermText.hasText(actual) || condition.value() == null) {
            return false;
        }

        String value = TermText.fold(actual);
        String target = TermText.fold(condition.value());

        return switch (condition.operator()) {
            case EQUALS -> value.equals(target);
            case CONTAINS -> value.contains(target);
        };
    }
}
