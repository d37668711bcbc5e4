package com.github.salilvnair.triage.intent;

import com.github.salilvnair.triage.config.TriageEngineProperties;
import com.github.salilvnair.triage.engine.exception.ClassificationException;
import com.github.salilvnair.triage.model.ConversationMessage;
import com.github.salilvnair.triage.support.TriageFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.github.salilvnair.triage.support.TestConstants.BOOM;
import static com.github.salilvnair.triage.support.TestConstants.USER_TEXT_NDA_POLICY;
import static com.github.salilvnair.triage.support.TestConstants.USER_TEXT_NDA_REQUEST;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompositeIntentClassifierTest {

    @Mock
    private HeuristicIntentClassifier heuristic;

    @Mock
    private CompletionIntentClassifier completion;

    private TriageEngineProperties properties;
    private CompositeIntentClassifier classifier;

    @BeforeEach
    void setUp() {
        properties = new TriageEngineProperties();
        classifier = new CompositeIntentClassifier(heuristic, completion, properties);
    }

    @Test
    void conclusiveHeuristicSkipsCompletionCall() {
        List<ConversationMessage> conversation = TriageFixtures.conversation(USER_TEXT_NDA_POLICY);
        when(heuristic.evaluate(conversation)).thenReturn(HeuristicVerdict.documentQuestion("what is"));

        IntentClassification result = classifier.classify(conversation);

        assertTrue(result.documentQuestion());
        assertEquals(IntentClassification.Source.HEURISTIC, result.source());
        assertEquals("what is", result.matchedPattern());
        verify(completion, never()).isDocumentQuestion(conversation);
    }

    @Test
    void inconclusiveHeuristicDelegatesToCompletion() {
        List<ConversationMessage> conversation = TriageFixtures.conversation(USER_TEXT_NDA_REQUEST);
        when(heuristic.evaluate(conversation)).thenReturn(HeuristicVerdict.inconclusive());
        when(completion.isDocumentQuestion(conversation)).thenReturn(true);

        IntentClassification result = classifier.classify(conversation);

        assertTrue(result.documentQuestion());
        assertEquals(IntentClassification.Source.COMPLETION, result.source());
    }

    @Test
    void completionFailureFallsBackToHeuristicVerdict() {
        List<ConversationMessage> conversation = TriageFixtures.conversation(USER_TEXT_NDA_REQUEST);
        when(heuristic.evaluate(conversation)).thenReturn(HeuristicVerdict.inconclusive());
        when(completion.isDocumentQuestion(conversation))
                .thenThrow(new ClassificationException(BOOM, new IllegalStateException(BOOM)));

        IntentClassification result = classifier.classify(conversation);

        assertFalse(result.documentQuestion());
        assertEquals(IntentClassification.Source.HEURISTIC_FALLBACK, result.source());
    }

    @Test
    void disabledFallbackNeverCallsCompletion() {
        properties.getClassification().setCompletionFallbackEnabled(false);
        List<ConversationMessage> conversation = TriageFixtures.conversation(USER_TEXT_NDA_REQUEST);
        when(heuristic.evaluate(conversation)).thenReturn(HeuristicVerdict.inconclusive());

        IntentClassification result = classifier.classify(conversation);

        assertFalse(result.documentQuestion());
        assertEquals(IntentClassification.Source.HEURISTIC_FALLBACK, result.source());
        verify(completion, never()).isDocumentQuestion(conversation);
    }
}
