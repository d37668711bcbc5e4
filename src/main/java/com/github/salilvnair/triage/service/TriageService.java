package com.github.salilvnair.triage.service;

import com.github.salilvnair.triage.engine.core.TriageEngine;
import com.github.salilvnair.triage.model.ConversationMessage;
import com.github.salilvnair.triage.model.EmployeeContext;
import com.github.salilvnair.triage.model.IncomingEmail;
import com.github.salilvnair.triage.model.TriageRequest;
import com.github.salilvnair.triage.model.TriageResult;
import com.github.salilvnair.triage.store.EmployeeDirectory;
import com.github.salilvnair.triage.util.TermText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for the chat and email channels: resolves the employee, then runs the engine.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TriageService {

    private final TriageEngine triageEngine;
    private final EmployeeDirectory employeeDirectory;
    private final EmailMessageFormatter emailMessageFormatter;

    public TriageResult triageConversation(String conversationId,
                                           List<ConversationMessage> messages,
                                           String employeeEmail) {
        EmployeeContext employee = lookup(employeeEmail);
        return triageEngine.triage(TriageRequest.builder()
                .conversationId(conversationId)
                .messages(messages == null ? List.of() : messages)
                .employee(employee)
                .build());
    }

    public TriageResult triageEmail(IncomingEmail email) {
        log.info("Triaging email from {}: \"{}\"", email.getFrom(), email.getSubject());
        EmployeeContext employee = lookup(email.getFrom());
        if (employee == null) {
            log.warn("Email from unknown sender {}, triaging without employee context", email.getFrom());
        }
        String conversationId = TermText.hasText(email.getMessageId()) ? email.getMessageId() : email.getFrom();
        return triageEngine.triage(TriageRequest.builder()
                .conversationId(conversationId)
                .message(ConversationMessage.user(emailMessageFormatter.format(email)))
                .employee(employee)
                .build());
    }

    private EmployeeContext lookup(String email) {
        if (!TermText.hasText(email)) {
            return null;
        }
        return employeeDirectory.findByEmail(email.trim()).orElse(null);
    }
}
