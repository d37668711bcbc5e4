package com.github.salilvnair.triage.llm.core;

import com.github.salilvnair.triage.model.ConversationMessage;

import java.util.List;

/**
 * Chat-completion service supplied by the host application. Retries, if any, belong here.
 */
public interface CompletionClient {
    String complete(String systemPrompt, List<ConversationMessage> messages, double temperature, int maxTokens);
}
