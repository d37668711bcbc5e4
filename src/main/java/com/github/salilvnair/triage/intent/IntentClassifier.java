package com.github.salilvnair.triage.intent;

import com.github.salilvnair.triage.model.ConversationMessage;

import java.util.List;

public interface IntentClassifier {
    /**
     * Decide whether the latest user utterance asks about documents or requests a service.
     * Never throws.
     */
    IntentClassification classify(List<ConversationMessage> conversation);

    default boolean isDocumentQuestion(List<ConversationMessage> conversation) {
        return classify(conversation).documentQuestion();
    }
}
