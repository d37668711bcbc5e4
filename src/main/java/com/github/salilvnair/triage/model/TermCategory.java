package com.github.salilvnair.triage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Synonym table partitions. The code is the key used by the legal term library.
 */
public enum TermCategory {
    REQUEST_TYPE("request_type"),
    LOCATION("location"),
    DEPARTMENT("department");

    private final String code;

    TermCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static TermCategory fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TermCategory value : values()) {
            if (value.code.equalsIgnoreCase(code.trim()) || value.name().equalsIgnoreCase(code.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown term category: " + code);
    }
}
