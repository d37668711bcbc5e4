package com.github.salilvnair.triage.engine.core;

import com.github.salilvnair.triage.engine.snapshot.TriageSnapshot;
import com.github.salilvnair.triage.intent.IntentClassification;
import com.github.salilvnair.triage.model.ConversationMessage;
import com.github.salilvnair.triage.model.EmployeeContext;
import com.github.salilvnair.triage.model.EmployeeMetadata;
import com.github.salilvnair.triage.model.ExtractedInfo;
import com.github.salilvnair.triage.model.NormalizationMatch;
import com.github.salilvnair.triage.model.SpecialistMatch;
import com.github.salilvnair.triage.model.SpecialistScore;
import com.github.salilvnair.triage.model.StageTiming;
import com.github.salilvnair.triage.model.TriageDecision;
import com.github.salilvnair.triage.model.TriageField;
import com.github.salilvnair.triage.model.TriageRequest;
import com.github.salilvnair.triage.model.TriageRule;
import com.github.salilvnair.triage.model.TriageStage;
import com.github.salilvnair.triage.model.TriageTrace;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * State of one triage run. Owned by a single thread; only {@code stage} and
 * {@code cancelled} are read from outside.
 */
@Getter
@Setter
public class TriageRun {

    private final String traceId;
    private final String conversationId;
    private final List<ConversationMessage> messages;
    private final EmployeeContext employee;
    private final Instant startedAt;

    private volatile TriageStage stage = TriageStage.START;
    private volatile boolean cancelled;

    private TriageSnapshot snapshot;
    private IntentClassification intent;
    private ExtractedInfo extractedInfo = ExtractedInfo.empty();
    private Map<TriageField, NormalizationMatch> normalizationMatches = Map.of();
    private List<SpecialistScore> rankedSpecialists = List.of();
    private SpecialistMatch specialistMatch;
    private TriageRule matchedRule;
    private int rulesEvaluated;
    private TriageDecision decision;
    private TriageStage errorStage;
    private String errorMessage;
    private Instant completedAt;
    private final List<StageTiming> stageTimings = Collections.synchronizedList(new ArrayList<>());

    public TriageRun(TriageRequest request, Instant startedAt) {
        this.traceId = UUID.randomUUID().toString();
        this.conversationId = request.getConversationId();
        this.messages = request.getMessages() == null ? List.of() : List.copyOf(request.getMessages());
        this.employee = request.getEmployee();
        this.startedAt = startedAt;
    }

    public boolean isDocumentQuestion() {
        return intent != null && intent.documentQuestion();
    }

    public EmployeeMetadata employeeMetadata() {
        return employee == null ? null : employee.metadata();
    }

    public TriageTrace toTrace() {
        SpecialistScore best = rankedSpecialists.isEmpty() ? null : rankedSpecialists.get(0);
        List<StageTiming> timings;
        synchronized (stageTimings) {
            timings = List.copyOf(stageTimings);
        }
        return TriageTrace.builder()
                .traceId(traceId)
                .conversationId(conversationId)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .intentSource(intent == null ? null : intent.source().name())
                .matchedQuestionPattern(intent == null ? null : intent.matchedPattern())
                .normalizationMatches(normalizationMatches)
                .candidatesScored(rankedSpecialists.size())
                .bestScore(best == null ? null : best.score())
                .rulesEvaluated(rulesEvaluated)
                .matchedRuleId(matchedRule == null ? null : matchedRule.getId())
                .stageTimings(timings)
                .terminalStage(decision == null ? null : TriageStage.terminalFor(decision.getOutcome()))
                .errorStage(errorStage)
                .errorMessage(errorMessage)
                .build();
    }
}
