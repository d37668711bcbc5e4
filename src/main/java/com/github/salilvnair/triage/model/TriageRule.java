package com.github.salilvnair.triage.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Static routing rule. Conditions are AND-combined; lower priority wins.
 */
@Value
@Builder(toBuilder = true)
public class TriageRule {
    String id;
    String name;
    @Singular
    List<TriageCondition> conditions;
    String assignee;
    int priority;
    @Builder.Default
    boolean enabled = true;
}
