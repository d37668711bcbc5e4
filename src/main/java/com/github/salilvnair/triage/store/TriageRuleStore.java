package com.github.salilvnair.triage.store;

import com.github.salilvnair.triage.model.TriageRule;

import java.util.List;

/**
 * Read-only view of the configured routing rules. Ordering is applied by the engine.
 */
@FunctionalInterface
public interface TriageRuleStore {
    List<TriageRule> findAll();
}
