package com.github.salilvnair.triage.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Terminal output of one triage run. Only the static factories build one, so the three
 * outcomes never overlap: an assignment, a document answer, or a (possibly empty) list
 * of fields to ask for next.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TriageDecision {

    TriageOutcome outcome;
    ExtractedInfo extractedInfo;
    String assignedTo;
    @JsonProperty("isComplete")
    boolean complete;
    boolean needsMoreInfo;
    List<String> missingFields;
    String matchReason;
    Integer matchScore;
    String documentAnswer;
    List<DocumentSource> documentSources;
    EmployeeMetadata employee;

    public static TriageDecision assigned(ExtractedInfo info,
                                          String assignee,
                                          String matchReason,
                                          Integer matchScore,
                                          EmployeeMetadata employee) {
        if (assignee == null || assignee.isBlank()) {
            throw new IllegalArgumentException("assignee is required for an assignment");
        }
        return new TriageDecision(
                TriageOutcome.ASSIGNED,
                info,
                assignee,
                true,
                false,
                List.of(),
                matchReason,
                matchScore,
                null,
                null,
                employee
        );
    }

    public static TriageDecision documentAnswered(ExtractedInfo info,
                                                  String answer,
                                                  List<DocumentSource> sources,
                                                  EmployeeMetadata employee) {
        if (answer == null) {
            throw new IllegalArgumentException("answer is required for a document decision");
        }
        return new TriageDecision(
                TriageOutcome.DOCUMENT_ANSWERED,
                info,
                null,
                true,
                false,
                List.of(),
                null,
                null,
                answer,
                sources == null ? List.of() : List.copyOf(sources),
                employee
        );
    }

    public static TriageDecision needsInfo(ExtractedInfo info,
                                           List<String> missingFields,
                                           EmployeeMetadata employee) {
        List<String> missing = missingFields == null ? List.of() : List.copyOf(missingFields);
        return new TriageDecision(
                TriageOutcome.NEEDS_INFO,
                info,
                null,
                false,
                !missing.isEmpty(),
                missing,
                null,
                null,
                null,
                null,
                employee
        );
    }
}
