package com.github.salilvnair.triage.engine.hook;

import com.github.salilvnair.triage.engine.core.TriageRun;
import com.github.salilvnair.triage.engine.exception.TriageException;
import com.github.salilvnair.triage.engine.pipeline.StepResult;
import com.github.salilvnair.triage.model.TriageResult;
import com.github.salilvnair.triage.model.TriageStage;

/**
 * Observes a triage run. Failures thrown from a hook are logged and never change the decision.
 */
public interface TriageStageHook {

    default boolean supports(TriageStage stage, TriageRun run) {
        return true;
    }

    default void beforeStage(TriageStage stage, TriageRun run) {
    }

    default void afterStage(TriageStage stage, TriageRun run, StepResult result) {
    }

    default void onStageError(TriageStage stage, TriageRun run, Throwable error) {
    }

    default void onComplete(TriageRun run, TriageResult result) {
    }

    default void onFailure(TriageRun run, TriageException error) {
    }
}
