package com.github.salilvnair.triage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConditionOperator {
    EQUALS,
    CONTAINS;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConditionOperator fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return ConditionOperator.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
