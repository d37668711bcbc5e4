package com.github.salilvnair.triage.intent;

import com.github.salilvnair.triage.model.ConversationMessage;
import com.github.salilvnair.triage.util.TermText;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword fast path. "what is the NDA policy?" is a document question,
 * "I need an NDA for a vendor" is not.
 */
@Component
public class HeuristicIntentClassifier {

    private static final int MIN_LENGTH = 5;

    private static final Set<String> GREETINGS = Set.of(
            "hi", "hello", "hey", "greetings", "good morning", "good afternoon", "good evening"
    );

    private static final List<String> QUESTION_PATTERNS = List.of(
            "what is", "what are", "what's", "explain", "tell me about", "how does", "how do",
            "what do i need to know", "what should i know", "wondering what", "want to know about",
            "define", "definition of", "can you explain",
            "regarding the", "about the", "regarding our", "about our"
    );

    private static final List<String> POLICY_TERMS = List.of(
            "policy", "policies", "procedure", "guideline", "compliance", "regulation", "requirement"
    );

    private static final Pattern WH_WORD = Pattern.compile("\\b(what|how|why|when|where|which|who)\\b");

    public HeuristicVerdict evaluate(List<ConversationMessage> conversation) {
        Optional<ConversationMessage> latest = ConversationUtterances.latestUserMessage(conversation);
        if (latest.isEmpty()) {
            return HeuristicVerdict.notADocumentQuestion("no user message");
        }
        String content = TermText.fold(latest.get().content());

        if (GREETINGS.contains(content) || content.length() < MIN_LENGTH) {
            return HeuristicVerdict.notADocumentQuestion("greeting or short message");
        }

        for (String pattern : QUESTION_PATTERNS) {
            if (content.contains(pattern)) {
                return HeuristicVerdict.documentQuestion(pattern);
            }
        }

        String policyTerm = null;
        for (String term : POLICY_TERMS) {
            if (content.contains(term)) {
                policyTerm = term;
                break;
            }
        }
        if (policyTerm != null && WH_WORD.matcher(content).find()) {
            return HeuristicVerdict.documentQuestion("wh-word + " + policyTerm);
        }
        return HeuristicVerdict.inconclusive();
    }
}
