package com.github.salilvnair.triage.engine.steps;

import com.github.salilvnair.triage.engine.core.TriageRun;
import com.github.salilvnair.triage.engine.pipeline.StepResult;
import com.github.salilvnair.triage.engine.pipeline.TriageStep;
import com.github.salilvnair.triage.model.NormalizationOutcome;
import com.github.salilvnair.triage.model.TriageStage;
import com.github.salilvnair.triage.normalize.TermNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@RequiredArgsConstructor
@Component
public class NormalizeFieldsStep implements TriageStep {

    private final TermNormalizer termNormalizer;

    @Override
    public TriageStage stage() {
        return TriageStage.NORMALIZING;
    }

    @Override
    public StepResult execute(TriageRun run) {
        NormalizationOutcome outcome = termNormalizer.normalizeExtractedInfo(
                run.getExtractedInfo(),
                run.getSnapshot().legalTerms()
        );
        run.setExtractedInfo(outcome.normalized());
        run.setNormalizationMatches(outcome.matches());
        return new StepResult.Continue();
    }
}
