package com.github.salilvnair.triage.engine.hook;

import com.github.salilvnair.triage.engine.core.TriageRun;
import com.github.salilvnair.triage.engine.exception.TriageException;
import com.github.salilvnair.triage.engine.pipeline.StepResult;
import com.github.salilvnair.triage.model.TriageDecision;
import com.github.salilvnair.triage.model.TriageResult;
import com.github.salilvnair.triage.model.TriageStage;
import com.github.salilvnair.triage.service.RoutingExplanationFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class LoggingTriageStageHook implements TriageStageHook {

    private final RoutingExplanationFormatter explanationFormatter;

    @Override
    public void beforeStage(TriageStage stage, TriageRun run) {
        log.debug("Triage stage {} entered traceId={} convId={}", stage, run.getTraceId(), run.getConversationId());
    }

    @Override
    public void afterStage(TriageStage stage, TriageRun run, StepResult result) {
        log.debug("Triage stage {} exited with {} traceId={}",
                stage, result == null ? null : result.getClass().getSimpleName(), run.getTraceId());
    }

    @Override
    public void onStageError(TriageStage stage, TriageRun run, Throwable error) {
        log.error("Triage stage {} failed traceId={} convId={}: {}",
                stage, run.getTraceId(), run.getConversationId(), error.getMessage(), error);
    }

    @Override
    public void onComplete(TriageRun run, TriageResult result) {
        TriageDecision decision = result.decision();
        switch (decision.getOutcome()) {
            case ASSIGNED -> log.info("Triage {} assigned to {} (score: {}, reason: {})",
                    run.getTraceId(), decision.getAssignedTo(), decision.getMatchScore(), decision.getMatchReason());
            case DOCUMENT_ANSWERED -> log.info("Triage {} answered from {} document(s)",
                    run.getTraceId(), decision.getDocumentSources().size());
            case NEEDS_INFO -> log.info("Triage {} needs more info, missing: {}",
                    run.getTraceId(), decision.getMissingFields());
        }
        if (log.isDebugEnabled()) {
            log.debug("Routing explanation for {}:\n{}", run.getTraceId(), explanationFormatter.explain(run));
        }
    }

    @Override
    public void onFailure(TriageRun run, TriageException error) {
        log.warn("Triage {} failed [{}] at stage {}: {}",
                run.getTraceId(), error.getErrorCode(), run.getStage(), error.getMessage());
    }
}
