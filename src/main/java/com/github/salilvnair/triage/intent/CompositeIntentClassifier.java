package com.github.salilvnair.triage.intent;

import com.github.salilvnair.triage.config.TriageEngineProperties;
import com.github.salilvnair.triage.engine.exception.ClassificationException;
import com.github.salilvnair.triage.model.ConversationMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@RequiredArgsConstructor
@Component
public class CompositeIntentClassifier implements IntentClassifier {

    private final HeuristicIntentClassifier heuristic;
    private final CompletionIntentClassifier completion;
    private final TriageEngineProperties properties;

    @Override
    public IntentClassification classify(List<ConversationMessage> conversation) {

        HeuristicVerdict verdict = heuristic.evaluate(conversation);

        if (verdict.conclusive()) {
            return new IntentClassification(
                    verdict.documentQuestion(),
                    IntentClassification.Source.HEURISTIC,
                    verdict.matchedPattern()
            );
        }

        if (!properties.getClassification().isCompletionFallbackEnabled()) {
            return new IntentClassification(
                    verdict.documentQuestion(),
                    IntentClassification.Source.HEURISTIC_FALLBACK,
                    null
            );
        }

        try {
            boolean documentQuestion = completion.isDocumentQuestion(conversation);
            return new IntentClassification(documentQuestion, IntentClassification.Source.COMPLETION, null);
        } catch (ClassificationException e) {
            log.warn("Intent classification fell back to heuristics: {}", e.getMessage());
            return new IntentClassification(
                    verdict.documentQuestion(),
                    IntentClassification.Source.HEURISTIC_FALLBACK,
                    null
            );
        }
    }
}
