package com.github.salilvnair.triage.model;

public record ConversationMessage(
        MessageRole role,
        String content
) {

    public static ConversationMessage user(String content) {
        return new ConversationMessage(MessageRole.USER, content);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage(MessageRole.ASSISTANT, content);
    }

    public static ConversationMessage system(String content) {
        return new ConversationMessage(MessageRole.SYSTEM, content);
    }

    public boolean isUser() {
        return role == MessageRole.USER;
    }
}
