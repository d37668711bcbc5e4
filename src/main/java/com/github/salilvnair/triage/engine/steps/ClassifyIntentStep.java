package com.github.salilvnair.triage.engine.steps;

import com.github.salilvnair.triage.engine.core.TriageRun;
import com.github.salilvnair.triage.engine.pipeline.StepResult;
import com.github.salilvnair.triage.engine.pipeline.TriageStep;
import com.github.salilvnair.triage.intent.IntentClassification;
import com.github.salilvnair.triage.intent.IntentClassifier;
import com.github.salilvnair.triage.model.TriageStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@RequiredArgsConstructor
@Component
public class ClassifyIntentStep implements TriageStep {

    private final IntentClassifier intentClassifier;

    @Override
    public TriageStage stage() {
        return TriageStage.CLASSIFYING;
    }

    @Override
    public StepResult execute(TriageRun run) {
        IntentClassification intent = intentClassifier.classify(run.getMessages());
        run.setIntent(intent);
        log.debug("Intent for traceId={}: documentQuestion={} source={}",
                run.getTraceId(), intent.documentQuestion(), intent.source());
        return new StepResult.Continue();
    }
}
