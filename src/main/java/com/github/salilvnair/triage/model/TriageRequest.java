package com.github.salilvnair.triage.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class TriageRequest {
    String conversationId;
    @Singular
    List<ConversationMessage> messages;
    EmployeeContext employee;
    /**
     * Per-run deadline; the configured default applies when null.
     */
    Duration timeout;
}
