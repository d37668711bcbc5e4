package com.github.salilvnair.triage.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.triage.config.TriageEngineProperties;
import com.github.salilvnair.triage.engine.exception.ExtractionException;
import com.github.salilvnair.triage.llm.core.CompletionClient;
import com.github.salilvnair.triage.model.ConversationMessage;
import com.github.salilvnair.triage.model.ExtractedInfo;
import com.github.salilvnair.triage.model.TriageField;
import com.github.salilvnair.triage.util.JsonUtil;
import com.github.salilvnair.triage.util.TermText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Pulls requestType/location/department out of a conversation through the completion service.
 * Best effort: anything unusable comes back as an empty extraction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FieldExtractor {

    static final String SYSTEM_PROMPT = """
            You are a legal triage assistant. You extract routing information from an employee's request.""";

    static final String EXTRACTION_PROMPT = """
            Based on the conversation above, extract any information about the user's legal request.
            Return ONLY a JSON object with these fields (use null for unknown fields):
            {
              "requestType": "type of legal request",
              "location": "user's location",
              "department": "user's department"
            }

            Normalize the values:
            - Request types: "Sales Contract", "Employment Contract", "NDA", "Marketing Review", "General Question"
            - Locations: Full country names like "United States", "Australia", "United Kingdom"
            - Departments: "Engineering", "Sales", "Marketing", "Finance", "HR", "Legal"

            Return ONLY the JSON, no other text.""";

    private final CompletionClient completionClient;
    private final TriageEngineProperties properties;

    public ExtractedInfo extract(List<ConversationMessage> conversation) {
        try {
            return parse(requestExtraction(conversation));
        } catch (ExtractionException e) {
            log.warn("Field extraction recovered as empty: {}", e.getMessage());
            return ExtractedInfo.empty();
        }
    }

    private String requestExtraction(List<ConversationMessage> conversation) {
        List<ConversationMessage> messages = new ArrayList<>();
        if (conversation != null) {
            messages.addAll(conversation);
        }
        messages.add(ConversationMessage.user(EXTRACTION_PROMPT));
        try {
            return completionClient.complete(
                    SYSTEM_PROMPT,
                    messages,
                    0d,
                    properties.getExtraction().getMaxTokens()
            );
        } catch (RuntimeException e) {
            throw new ExtractionException("Completion service failed during field extraction", e);
        }
    }

    /**
     * Only non-blank string values of recognized fields survive; the literal "null" counts as absent.
     */
    static ExtractedInfo parse(String content) {
        if (!TermText.hasText(content)) {
            throw new ExtractionException("Completion service returned no content");
        }
        ObjectNode node = JsonUtil.extractObject(content);
        if (node.isEmpty()) {
            throw new ExtractionException("No JSON object in extraction response");
        }
        ExtractedInfo info = ExtractedInfo.empty();
        for (TriageField field : TriageField.values()) {
            JsonNode value = node.get(field.fieldName());
            if (value == null || !value.isTextual()) {
                continue;
            }
            String text = value.asText().trim();
            if (text.isEmpty() || "null".equalsIgnoreCase(text)) {
                continue;
            }
            info = info.with(field, text);
        }
        return info;
    }
}
