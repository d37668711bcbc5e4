package com.github.salilvnair.triage.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Advisory record of what happened inside a run: classification source, normalization hits,
 * rule evaluation counts and stage timings.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TriageTrace {
    String traceId;
    String conversationId;
    Instant startedAt;
    Instant completedAt;
    String intentSource;
    String matchedQuestionPattern;
    @Singular("normalizationMatch")
    Map<TriageField, NormalizationMatch> normalizationMatches;
    int candidatesScored;
    Integer bestScore;
    int rulesEvaluated;
    String matchedRuleId;
    @Singular
    List<StageTiming> stageTimings;
    TriageStage terminalStage;
    TriageStage errorStage;
    String errorMessage;
}
