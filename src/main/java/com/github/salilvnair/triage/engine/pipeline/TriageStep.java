package com.github.salilvnair.triage.engine.pipeline;

import com.github.salilvnair.triage.engine.core.TriageRun;
import com.github.salilvnair.triage.model.TriageStage;

public interface TriageStep {

    /**
     * The state this step implements; pipeline order follows stage order.
     */
    TriageStage stage();

    StepResult execute(TriageRun run);
}
