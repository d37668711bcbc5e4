package com.github.salilvnair.triage.rule;

import com.github.salilvnair.triage.model.ExtractedInfo;
import com.github.salilvnair.triage.model.TriageCondition;
import com.github.salilvnair.triage.model.TriageRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Component
public class RuleMatcher {

    /**
     * Ascending priority; equal priorities keep their original order (List.sort is stable).
     */
    public static List<TriageRule> orderByPriority(List<TriageRule> rules) {
        if (rules == null || rules.isEmpty()) {
            return List.of();
        }
        List<TriageRule> ordered = new ArrayList<>(rules);
        ordered.removeIf(Objects::isNull);
        ordered.sort(Comparator.comparingInt(TriageRule::getPriority));
        return List.copyOf(ordered);
    }

    public Optional<TriageRule> findMatchingRule(ExtractedInfo info, List<TriageRule> rules) {
        for (TriageRule rule : orderByPriority(rules)) {
            if (matches(rule, info)) {
                log.debug("Rule matched: id={}, name={}, assignee={}", rule.getId(), rule.getName(), rule.getAssignee());
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    /**
     * A disabled rule or a rule without conditions never matches.
     */
    public boolean matches(TriageRule rule, ExtractedInfo info) {
        if (rule == null || !rule.isEnabled()) {
            return false;
        }
        List<TriageCondition> conditions = rule.getConditions();
        if (conditions == null || conditions.isEmpty()) {
            return false;
        }
        for (TriageCondition condition : conditions) {
            if (!RuleConditionEvaluator.evaluate(condition, info)) {
                return false;
            }
        }
        return true;
    }

    /**
     * The single field most likely to complete a match, or nothing if a rule already matches.
     * One field at a time keeps the follow-up question conversational.
     * Disabled rules never match but still count when choosing which field to ask for.
     */
    public List<String> missingFieldsFor(ExtractedInfo info, List<TriageRule> rules) {
        ExtractedInfo current = info == null ? ExtractedInfo.empty() : info;
        List<TriageRule> ordered = orderByPriority(rules);
        if (findMatchingRule(current, ordered).isPresent()) {
            return List.of();
        }

        Set<String> missing = new LinkedHashSet<>();
        for (TriageRule rule : ordered) {
            Set<String> ruleFields = fieldsOf(rule);
            List<String> missingForRule = ruleFields.stream()
                    .filter(field -> !current.has(field))
                    .toList();
            if (!missingForRule.isEmpty() && missingForRule.size() < ruleFields.size()) {
                missing.addAll(missingForRule);
            }
        }

        if (missing.isEmpty()) {
            return requiredFields(ordered).stream()
                    .filter(field -> !current.has(field))
                    .limit(1)
                    .toList();
        }
        return List.of(missing.iterator().next());
    }

    /**
     * Every field referenced by any rule, in priority then condition order.
     */
    public Set<String> requiredFields(List<TriageRule> rules) {
        Set<String> fields = new LinkedHashSet<>();
        for (TriageRule rule : orderByPriority(rules)) {
            fields.addAll(fieldsOf(rule));
        }
        return fields;
    }

    private static Set<String> fieldsOf(TriageRule rule) {
        Set<String> fields = new LinkedHashSet<>();
        if (rule.getConditions() == null) {
            return fields;
        }
        for (TriageCondition condition : rule.getConditions()) {
            if (condition != null && condition.field() != null && !condition.field().isBlank()) {
                fields.add(condition.field().trim());
            }
        }
        return fields;
    }
}
