package com.github.salilvnair.triage.engine.pipeline;

import com.github.salilvnair.triage.model.TriageDecision;

public sealed interface StepResult permits StepResult.Continue, StepResult.Stop {

    record Continue() implements StepResult {}
    record Stop(TriageDecision decision) implements StepResult {}
}
