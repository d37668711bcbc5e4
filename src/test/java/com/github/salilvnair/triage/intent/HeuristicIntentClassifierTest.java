package com.github.salilvnair.triage.intent;

import com.github.salilvnair.triage.model.ConversationMessage;
import com.github.salilvnair.triage.support.TriageFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.salilvnair.triage.support.TestConstants.USER_TEXT_HELLO;
import static com.github.salilvnair.triage.support.TestConstants.USER_TEXT_NDA_POLICY;
import static com.github.salilvnair.triage.support.TestConstants.USER_TEXT_NDA_REQUEST;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HeuristicIntentClassifierTest {

    private final HeuristicIntentClassifier classifier = new HeuristicIntentClassifier();

    @Test
    void questionPatternIsConclusiveDocumentQuestion() {
        HeuristicVerdict verdict = classifier.evaluate(TriageFixtures.conversation(USER_TEXT_NDA_POLICY));

        assertTrue(verdict.conclusive());
        assertTrue(verdict.documentQuestion());
        assertEquals("what is", verdict.matchedPattern());
    }

    @Test
    void whWordWithPolicyNounIsDocumentQuestion() {
        HeuristicVerdict verdict = classifier.evaluate(
                TriageFixtures.conversation("When does the compliance deadline apply to vendors?"));

        assertTrue(verdict.documentQuestion());
        assertEquals("wh-word + compliance", verdict.matchedPattern());
    }

    @Test
    void policyNounWithoutWhWordIsInconclusive() {
        HeuristicVerdict verdict = classifier.evaluate(TriageFixtures.conversation("Send me the travel policy"));

        assertFalse(verdict.conclusive());
    }

    @Test
    void serviceRequestIsInconclusive() {
        HeuristicVerdict verdict = classifier.evaluate(TriageFixtures.conversation(USER_TEXT_NDA_REQUEST));

        assertFalse(verdict.conclusive());
        assertFalse(verdict.documentQuestion());
    }

    @Test
    void greetingsAndShortMessagesAreConclusivelyNotDocumentQuestions() {
        assertTrue(classifier.evaluate(TriageFixtures.conversation(USER_TEXT_HELLO)).conclusive());
        assertFalse(classifier.evaluate(TriageFixtures.conversation(USER_TEXT_HELLO)).documentQuestion());
        assertTrue(classifier.evaluate(TriageFixtures.conversation("  Good Morning ")).conclusive());
        assertTrue(classifier.evaluate(TriageFixtures.conversation("ok?")).conclusive());
    }

    @Test
    void onlyLatestUserMessageCounts() {
        List<ConversationMessage> conversation = List.of(
                ConversationMessage.user(USER_TEXT_NDA_POLICY),
                ConversationMessage.assistant("Here is what I found about the NDA policy."),
                ConversationMessage.user(USER_TEXT_NDA_REQUEST)
        );

        assertFalse(classifier.evaluate(conversation).conclusive());
    }

    @Test
    void conversationWithoutUserMessageIsNotADocumentQuestion() {
        HeuristicVerdict verdict = classifier.evaluate(List.of(ConversationMessage.assistant("What is your request?")));

        assertTrue(verdict.conclusive());
        assertFalse(verdict.documentQuestion());
    }
}
