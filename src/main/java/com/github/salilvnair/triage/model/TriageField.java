package com.github.salilvnair.triage.model;

import java.util.Optional;

/**
 * The user-facing fields a rule condition or the specialist scorer may look at.
 * Anything else, employee metadata included, is not matchable.
 */
public enum TriageField {
    REQUEST_TYPE("requestType", TermCategory.REQUEST_TYPE),
    LOCATION("location", TermCategory.LOCATION),
    DEPARTMENT("department", TermCategory.DEPARTMENT);

    private final String fieldName;
    private final TermCategory category;

    TriageField(String fieldName, TermCategory category) {
        this.fieldName = fieldName;
        this.category = category;
    }

    public String fieldName() {
        return fieldName;
    }

    public TermCategory category() {
        return category;
    }

    public static Optional<TriageField> fromFieldName(String fieldName) {
        if (fieldName == null || fieldName.isBlank()) {
            return Optional.empty();
        }
        String trimmed = fieldName.trim();
        for (TriageField value : values()) {
            if (value.fieldName.equals(trimmed)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
