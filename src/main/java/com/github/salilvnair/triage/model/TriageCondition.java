package com.github.salilvnair.triage.model;

public record TriageCondition(
        String field,
        ConditionOperator operator,
        String value
) {

    public static TriageCondition equalsTo(String field, String value) {
        return new TriageCondition(field, ConditionOperator.EQUALS, value);
    }

    public static TriageCondition containing(String field, String value) {
        return new TriageCondition(field, ConditionOperator.CONTAINS, value);
    }
}
