package com.github.salilvnair.triage.intent;

import com.github.salilvnair.triage.config.TriageEngineProperties;
import com.github.salilvnair.triage.engine.exception.ClassificationException;
import com.github.salilvnair.triage.llm.core.CompletionClient;
import com.github.salilvnair.triage.model.ConversationMessage;
import com.github.salilvnair.triage.util.TermText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Slow path: asks the completion service to label the latest user utterance.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CompletionIntentClassifier {

    static final String LABEL_DOCUMENT = "document";

    static final String SYSTEM_PROMPT = """
            You are a classifier. Determine if the user is asking a QUESTION ABOUT a policy/document/procedure
            OR if they are REQUESTING legal help/service.

            DOCUMENT QUESTIONS (asking to learn/understand):
            - "What is the NDA policy?"
            - "Tell me about data retention"
            - "What do I need to know about NDAs?"
            - "How does the patent process work?"
            - "Explain the IP policy"

            LEGAL REQUESTS (asking for help/action):
            - "I need an NDA for a vendor"
            - "Help me with a contract"
            - "I need legal review"
            - "Can you draft an agreement?"
            - "Can someone help me with X?"

            GREETINGS/SMALL TALK (also NOT document questions):
            - "Hello"
            - "Hi there"
            - "Thanks"

            Return ONLY "document", "request" or "greeting", nothing else.""";

    private final CompletionClient completionClient;
    private final TriageEngineProperties properties;

    /**
     * @throws ClassificationException when the completion service fails or answers nothing
     */
    public boolean isDocumentQuestion(List<ConversationMessage> conversation) {
        String utterance = ConversationUtterances.latestUserText(conversation);
        String response;
        try {
            response = completionClient.complete(
                    SYSTEM_PROMPT,
                    List.of(ConversationMessage.user(utterance)),
                    0d,
                    properties.getClassification().getMaxTokens()
            );
        } catch (RuntimeException e) {
            throw new ClassificationException("Completion service failed during intent classification", e);
        }
        if (!TermText.hasText(response)) {
            throw new ClassificationException("Completion service returned an empty classification", null);
        }
        String label = firstWord(response);
        log.debug("Completion classified utterance as '{}'", label);
        return LABEL_DOCUMENT.equals(label);
    }

    private static String firstWord(String response) {
        String folded = TermText.fold(response).replaceAll("[^a-z\\s]", " ").trim();
        int space = folded.indexOf(' ');
        return space < 0 ? folded : folded.substring(0, space);
    }
}
