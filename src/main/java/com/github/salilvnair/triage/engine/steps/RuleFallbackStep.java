package com.github.salilvnair.triage.engine.steps;

import com.github.salilvnair.triage.engine.core.TriageRun;
import com.github.salilvnair.triage.engine.pipeline.StepResult;
import com.github.salilvnair.triage.engine.pipeline.TriageStep;
import com.github.salilvnair.triage.model.ExtractedInfo;
import com.github.salilvnair.triage.model.TriageDecision;
import com.github.salilvnair.triage.model.TriageRule;
import com.github.salilvnair.triage.model.TriageStage;
import com.github.salilvnair.triage.rule.RuleMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Last stage: a matching rule assigns, otherwise the run asks for the next missing field.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class RuleFallbackStep implements TriageStep {

    private final RuleMatcher ruleMatcher;

    @Override
    public TriageStage stage() {
        return TriageStage.RULE_FALLBACK;
    }

    @Override
    public StepResult execute(TriageRun run) {
        ExtractedInfo info = run.getExtractedInfo();
        List<TriageRule> rules = run.getSnapshot().rules();
        run.setRulesEvaluated(rules.size());

        Optional<TriageRule> rule = ruleMatcher.findMatchingRule(info, rules);
        if (rule.isPresent()) {
            TriageRule matched = rule.get();
            run.setMatchedRule(matched);
            log.info("Rule fallback matched {} ({}) -> {}", matched.getId(), matched.getName(), matched.getAssignee());
            return new StepResult.Stop(
                    TriageDecision.assigned(info, matched.getAssignee(), null, null, run.employeeMetadata())
            );
        }

        List<String> missing = ruleMatcher.missingFieldsFor(info, rules);
        return new StepResult.Stop(TriageDecision.needsInfo(info, missing, run.employeeMetadata()));
    }
}
