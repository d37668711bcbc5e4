package com.github.salilvnair.triage.rule;

import com.github.salilvnair.triage.model.ExtractedInfo;
import com.github.salilvnair.triage.model.TriageCondition;
import com.github.salilvnair.triage.model.TriageRule;
import com.github.salilvnair.triage.support.TriageFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.github.salilvnair.triage.support.TestConstants.DEPARTMENT_SALES;
import static com.github.salilvnair.triage.support.TestConstants.FIELD_DEPARTMENT;
import static com.github.salilvnair.triage.support.TestConstants.FIELD_LOCATION;
import static com.github.salilvnair.triage.support.TestConstants.FIELD_REQUEST_TYPE;
import static com.github.salilvnair.triage.support.TestConstants.LOCATION_AUSTRALIA;
import static com.github.salilvnair.triage.support.TestConstants.REQUEST_TYPE_NDA;
import static com.github.salilvnair.triage.support.TestConstants.REQUEST_TYPE_SALES_CONTRACT;
import static com.github.salilvnair.triage.support.TestConstants.RULE_ASSIGNEE_JOHN;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuleMatcherTest {

    private final RuleMatcher matcher = new RuleMatcher();

    @Test
    void findMatchingRuleReturnsRuleWhenAllConditionsMatch() {
        ExtractedInfo info = ExtractedInfo.builder()
                .requestType(REQUEST_TYPE_SALES_CONTRACT)
                .location(LOCATION_AUSTRALIA)
                .build();

        Optional<TriageRule> rule = matcher.findMatchingRule(info, List.of(TriageFixtures.salesAustraliaRule()));

        assertTrue(rule.isPresent());
        assertEquals(RULE_ASSIGNEE_JOHN, rule.get().getAssignee());
    }

    @Test
    void findMatchingRuleReturnsNothingAndAsksForLocation() {
        ExtractedInfo info = ExtractedInfo.builder().requestType(REQUEST_TYPE_SALES_CONTRACT).build();
        List<TriageRule> rules = List.of(TriageFixtures.salesAustraliaRule());

        assertTrue(matcher.findMatchingRule(info, rules).isEmpty());
        assertEquals(List.of(FIELD_LOCATION), matcher.missingFieldsFor(info, rules));
    }

    @Test
    void findMatchingRulePrefersLowerPriorityAndKeepsTableOrderOnTies() {
        TriageRule second = rule("second", 5, "b@x", TriageCondition.equalsTo(FIELD_REQUEST_TYPE, REQUEST_TYPE_NDA));
        TriageRule firstTie = rule("first-tie", 2, "c@x", TriageCondition.containing(FIELD_REQUEST_TYPE, "nd"));
        TriageRule secondTie = rule("second-tie", 2, "d@x", TriageCondition.equalsTo(FIELD_REQUEST_TYPE, REQUEST_TYPE_NDA));
        ExtractedInfo info = ExtractedInfo.builder().requestType(REQUEST_TYPE_NDA).build();

        Optional<TriageRule> rule = matcher.findMatchingRule(info, List.of(second, firstTie, secondTie));

        assertEquals("first-tie", rule.orElseThrow().getId());
    }

    @Test
    void disabledRulesAndRulesWithoutConditionsNeverMatch() {
        TriageRule disabled = rule("disabled", 1, "a@x", TriageCondition.equalsTo(FIELD_REQUEST_TYPE, REQUEST_TYPE_NDA))
                .toBuilder().enabled(false).build();
        TriageRule empty = TriageRule.builder().id("empty").priority(0).assignee("e@x").build();
        ExtractedInfo info = ExtractedInfo.builder().requestType(REQUEST_TYPE_NDA).build();

        assertFalse(matcher.matches(disabled, info));
        assertFalse(matcher.matches(empty, info));
        assertTrue(matcher.findMatchingRule(info, List.of(disabled, empty)).isEmpty());
    }

    @Test
    void missingFieldsForIsEmptyWhenARuleAlreadyMatches() {
        ExtractedInfo info = ExtractedInfo.builder()
                .requestType(REQUEST_TYPE_SALES_CONTRACT)
                .location(LOCATION_AUSTRALIA)
                .build();

        assertTrue(matcher.missingFieldsFor(info, List.of(TriageFixtures.salesAustraliaRule())).isEmpty());
    }

    @Test
    void missingFieldsForFallsBackToFirstReferencedFieldWhenNoRuleIsClose() {
        TriageRule departmentRule = rule("dept", 1, "s@x", TriageCondition.equalsTo(FIELD_DEPARTMENT, DEPARTMENT_SALES));

        List<String> missing = matcher.missingFieldsFor(
                ExtractedInfo.empty(),
                List.of(departmentRule, TriageFixtures.salesAustraliaRule()));

        assertEquals(List.of(FIELD_DEPARTMENT), missing);
    }

    @Test
    void missingFieldsForReturnsOneFieldAtATime() {
        TriageRule threeFields = rule("three", 1, "t@x",
                TriageCondition.equalsTo(FIELD_REQUEST_TYPE, REQUEST_TYPE_SALES_CONTRACT),
                TriageCondition.equalsTo(FIELD_DEPARTMENT, DEPARTMENT_SALES),
                TriageCondition.equalsTo(FIELD_LOCATION, LOCATION_AUSTRALIA));
        ExtractedInfo info = ExtractedInfo.builder().requestType(REQUEST_TYPE_SALES_CONTRACT).build();

        assertEquals(List.of(FIELD_DEPARTMENT), matcher.missingFieldsFor(info, List.of(threeFields)));
    }

    @Test
    void missingFieldsForCountsDisabledRulesInPriorityOrder() {
        TriageRule disabledNda = rule("nda-sales", 1, "a@x",
                TriageCondition.equalsTo(FIELD_REQUEST_TYPE, REQUEST_TYPE_NDA),
                TriageCondition.equalsTo(FIELD_DEPARTMENT, DEPARTMENT_SALES))
                .toBuilder().enabled(false).build();
        List<TriageRule> rules = List.of(disabledNda, TriageFixtures.salesAustraliaRule().toBuilder().priority(2).build());
        ExtractedInfo info = ExtractedInfo.builder().requestType(REQUEST_TYPE_SALES_CONTRACT).build();

        assertTrue(matcher.findMatchingRule(info, rules).isEmpty());
        assertEquals(List.of(FIELD_DEPARTMENT), matcher.missingFieldsFor(info, rules));
        assertEquals(List.of(FIELD_REQUEST_TYPE, FIELD_DEPARTMENT, FIELD_LOCATION),
                List.copyOf(matcher.requiredFields(rules)));
    }

    @Test
    void missingFieldsForIsEmptyWithoutRules() {
        assertTrue(matcher.missingFieldsFor(ExtractedInfo.empty(), List.of()).isEmpty());
    }

    private static TriageRule rule(String id, int priority, String assignee, TriageCondition... conditions) {
        TriageRule.TriageRuleBuilder builder = TriageRule.builder()
                .id(id)
                .name(id)
                .priority(priority)
                .assignee(assignee);
        for (TriageCondition condition : conditions) {
            builder.condition(condition);
        }
        return builder.build();
    }
}
