package com.github.salilvnair.triage.intent;

import com.github.salilvnair.triage.model.ConversationMessage;

import java.util.List;
import java.util.Optional;

public final class ConversationUtterances {

    private ConversationUtterances() {}

    public static Optional<ConversationMessage> latestUserMessage(List<ConversationMessage> conversation) {
        if (conversation == null) {
            return Optional.empty();
        }
        for (int i = conversation.size() - 1; i >= 0; i--) {
            ConversationMessage message = conversation.get(i);
            if (message != null && message.isUser() && message.content() != null) {
                return Optional.of(message);
            }
        }
        return Optional.empty();
    }

    public static String latestUserText(List<ConversationMessage> conversation) {
        return latestUserMessage(conversation).map(ConversationMessage::content).orElse("");
    }
}
