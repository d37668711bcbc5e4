package com.github.salilvnair.triage.engine.pipeline;

import com.github.salilvnair.triage.engine.core.TriageRun;
import com.github.salilvnair.triage.engine.exception.TriageErrorCode;
import com.github.salilvnair.triage.engine.exception.TriageException;
import com.github.salilvnair.triage.engine.exception.TriageTimeoutException;
import com.github.salilvnair.triage.model.TriageDecision;
import com.github.salilvnair.triage.model.TriageStage;

import java.util.List;

public final class TriagePipeline {

    private final List<TriageStep> steps;

    public TriagePipeline(List<TriageStep> steps) {
        this.steps = List.copyOf(steps);
    }

    public TriageDecision execute(TriageRun run) {
        for (TriageStep step : steps) {
            ensureNotCancelled(run, step.stage());
            StepResult r = step.execute(run);
            if (r instanceof StepResult.Stop stop) {
                ensureNotCancelled(run, step.stage());
                run.setDecision(stop.decision());
                run.setStage(TriageStage.terminalFor(stop.decision().getOutcome()));
                return stop.decision();
            }
        }
        throw new TriageException(TriageErrorCode.NO_DECISION);
    }

    public List<TriageStep> steps() {
        return steps;
    }

    private static void ensureNotCancelled(TriageRun run, TriageStage stage) {
        if (run.isCancelled() || Thread.currentThread().isInterrupted()) {
            throw new TriageTimeoutException(
                    TriageErrorCode.TRIAGE_CANCELLED,
                    stage,
                    "Triage run " + run.getTraceId() + " cancelled at stage " + stage
            );
        }
    }
}
