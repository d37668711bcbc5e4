package com.github.salilvnair.triage.engine.snapshot;

import com.github.salilvnair.triage.engine.exception.TriageErrorCode;
import com.github.salilvnair.triage.engine.exception.TriageStageException;
import com.github.salilvnair.triage.model.TriageStage;
import com.github.salilvnair.triage.rule.RuleMatcher;
import com.github.salilvnair.triage.store.LegalTermStore;
import com.github.salilvnair.triage.store.SpecialistRoster;
import com.github.salilvnair.triage.store.TriageRuleStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@RequiredArgsConstructor
@Component
public class TriageSnapshotLoader {

    private final TriageRuleStore ruleStore;
    private final SpecialistRoster specialistRoster;
    private final LegalTermStore legalTermStore;

    public TriageSnapshot load() {
        try {
            return new TriageSnapshot(
                    RuleMatcher.orderByPriority(ruleStore.findAll()),
                    specialistRoster.findAll(),
                    legalTermStore.findAll()
            );
        } catch (RuntimeException e) {
            throw new TriageStageException(
                    TriageStage.START,
                    TriageErrorCode.SNAPSHOT_LOAD_FAILED,
                    TriageErrorCode.SNAPSHOT_LOAD_FAILED.defaultMessage() + ": " + e.getMessage(),
                    e
            );
        }
    }
}
