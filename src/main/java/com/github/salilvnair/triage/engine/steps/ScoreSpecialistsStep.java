package com.github.salilvnair.triage.engine.steps;

import com.github.salilvnair.triage.engine.core.TriageRun;
import com.github.salilvnair.triage.engine.pipeline.StepResult;
import com.github.salilvnair.triage.engine.pipeline.TriageStep;
import com.github.salilvnair.triage.model.SpecialistMatch;
import com.github.salilvnair.triage.model.SpecialistScore;
import com.github.salilvnair.triage.model.TriageDecision;
import com.github.salilvnair.triage.model.TriageStage;
import com.github.salilvnair.triage.scoring.SpecialistScorer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@RequiredArgsConstructor
@Component
public class ScoreSpecialistsStep implements TriageStep {

    private final SpecialistScorer specialistScorer;

    @Override
    public TriageStage stage() {
        return TriageStage.SCORING;
    }

    @Override
    public StepResult execute(TriageRun run) {
        List<SpecialistScore> ranked = specialistScorer.scoreAndRank(
                run.getExtractedInfo(),
                run.getEmployee(),
                run.getSnapshot().specialists()
        );
        run.setRankedSpecialists(ranked);

        Optional<SpecialistMatch> match = specialistScorer.selectFromRanked(
                run.getExtractedInfo(), run.getEmployee(), ranked);
        if (match.isEmpty()) {
            return new StepResult.Continue();
        }
        SpecialistMatch best = match.get();
        run.setSpecialistMatch(best);
        return new StepResult.Stop(TriageDecision.assigned(
                run.getExtractedInfo(),
                best.specialist().getEmail(),
                best.reason(),
                best.score(),
                run.employeeMetadata()
        ));
    }
}
