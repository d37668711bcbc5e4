package com.github.salilvnair.triage.engine.snapshot;

import com.github.salilvnair.triage.model.LegalTerm;
import com.github.salilvnair.triage.model.Specialist;
import com.github.salilvnair.triage.model.TriageRule;

import java.util.List;

/**
 * Rules, roster and synonym table as read at the start of one run. Edits made while a run
 * is in flight are only seen by the next run.
 */
public record TriageSnapshot(
        List<TriageRule> rules,
        List<Specialist> specialists,
        List<LegalTerm> legalTerms
) {

    public TriageSnapshot {
        rules = rules == null ? List.of() : List.copyOf(rules);
        specialists = specialists == null ? List.of() : List.copyOf(specialists);
        legalTerms = legalTerms == null ? List.of() : List.copyOf(legalTerms);
    }
}
