package com.github.salilvnair.triage.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Sparse set of canonical request fields pulled out of a conversation.
 * Blank values are stored as {@code null}.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExtractedInfo {

    public static final String DOCUMENT_QUESTION_REQUEST_TYPE = "Document Question";

    String requestType;
    String location;
    String department;
    @JsonProperty("isDocumentQuestion")
    Boolean documentQuestion;

    public static ExtractedInfo empty() {
        return ExtractedInfo.builder().build();
    }

    public static ExtractedInfo forDocumentQuestion() {
        return ExtractedInfo.builder()
                .requestType(DOCUMENT_QUESTION_REQUEST_TYPE)
                .documentQuestion(true)
                .build();
    }

    public String get(TriageField field) {
        return switch (field) {
            case REQUEST_TYPE -> requestType;
            case LOCATION -> location;
            case DEPARTMENT -> department;
        };
    }

    /**
     * Looks a field up by its rule-facing name. Unknown names have no value.
     */
    public String get(String fieldName) {
        return TriageField.fromFieldName(fieldName).map(this::get).orElse(null);
    }

    public boolean has(TriageField field) {
        return hasText(get(field));
    }

    public boolean has(String fieldName) {
        return hasText(get(fieldName));
    }

    public ExtractedInfo with(TriageField field, String value) {
        String cleaned = hasText(value) ? value : null;
        return switch (field) {
            case REQUEST_TYPE -> toBuilder().requestType(cleaned).build();
            case LOCATION -> toBuilder().location(cleaned).build();
            case DEPARTMENT -> toBuilder().department(cleaned).build();
        };
    }

    @JsonIgnore
    public List<TriageField> presentFields() {
        List<TriageField> present = new ArrayList<>();
        for (TriageField field : TriageField.values()) {
            if (has(field)) {
                present.add(field);
            }
        }
        return present;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return presentFields().isEmpty() && documentQuestion == null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
