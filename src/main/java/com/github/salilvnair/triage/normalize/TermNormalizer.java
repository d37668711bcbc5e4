package com.github.salilvnair.triage.normalize;

import com.github.salilvnair.triage.config.TriageEngineProperties;
import com.github.salilvnair.triage.model.ExtractedInfo;
import com.github.salilvnair.triage.model.LegalTerm;
import com.github.salilvnair.triage.model.NormalizationMatch;
import com.github.salilvnair.triage.model.NormalizationOutcome;
import com.github.salilvnair.triage.model.NormalizedTerm;
import com.github.salilvnair.triage.model.TermCategory;
import com.github.salilvnair.triage.model.TriageField;
import com.github.salilvnair.triage.util.TermText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps noisy user terms onto the canonical vocabulary of the legal term library.
 * Pure over the term list it is handed; never throws to the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TermNormalizer {

    private final TriageEngineProperties properties;

    public NormalizedTerm normalize(String rawValue, TermCategory category, List<LegalTerm> terms) {
        return normalize(rawValue, category, terms, properties.getNormalizer().getThreshold());
    }

    public NormalizedTerm normalize(String rawValue,
                                    TermCategory category,
                                    List<LegalTerm> terms,
                                    double threshold) {
        if (rawValue == null) {
            return NormalizedTerm.unchanged(null);
        }
        if (terms == null || category == null) {
            return NormalizedTerm.unchanged(rawValue);
        }
        try {
            return bestMatch(rawValue, category, terms, threshold);
        } catch (RuntimeException e) {
            log.warn("Term normalization failed for '{}' ({}), keeping raw value", rawValue, category.code(), e);
            return NormalizedTerm.unchanged(rawValue);
        }
    }

    /**
     * Normalizes each recognized field. Only values at or above the threshold replace the raw value;
     * the returned matches are for observability only.
     */
    public NormalizationOutcome normalizeExtractedInfo(ExtractedInfo info, List<LegalTerm> terms) {
        if (info == null) {
            return new NormalizationOutcome(ExtractedInfo.empty(), Map.of());
        }
        double threshold = properties.getNormalizer().getThreshold();
        ExtractedInfo normalized = info;
        Map<TriageField, NormalizationMatch> matches = new EnumMap<>(TriageField.class);

        for (TriageField field : TriageField.values()) {
            String raw = info.get(field);
            if (!TermText.hasText(raw)) {
                continue;
            }
            NormalizedTerm result = normalize(raw, field.category(), terms, threshold);
            if (result.isApplied() && result.confidence() >= threshold) {
                normalized = normalized.with(field, result.canonical());
                matches.put(field, new NormalizationMatch(raw, result.canonical(), result.confidence()));
                log.debug("{} normalized '{}' -> '{}' ({})",
                        field.fieldName(), raw, result.canonical(), String.format("%.2f", result.confidence()));
            }
        }
        return new NormalizationOutcome(normalized, Collections.unmodifiableMap(matches));
    }

    private NormalizedTerm bestMatch(String rawValue,
                                     TermCategory category,
                                     List<LegalTerm> terms,
                                     double threshold) {
        String input = TermText.fold(rawValue);
        String bestCanonical = null;
        double bestConfidence = 0d;

        for (LegalTerm term : terms) {
            if (term == null || term.category() != category || term.canonicalTerm() == null) {
                continue;
            }
            String canonical = term.canonicalTerm();
            String canonicalFolded = canonical.toLowerCase(Locale.ROOT);
            if (input.equals(canonicalFolded)) {
                return new NormalizedTerm(canonical, 1d);
            }
            double termSimilarity = StringSimilarity.similarity(input, canonicalFolded);
            if (termSimilarity > bestConfidence) {
                bestCanonical = canonical;
                bestConfidence = termSimilarity;
            }

            for (String synonym : term.synonyms()) {
                if (synonym == null) {
                    continue;
                }
                String synonymFolded = synonym.toLowerCase(Locale.ROOT);
                if (input.equals(synonymFolded)) {
                    return new NormalizedTerm(canonical, 1d);
                }
                double synonymSimilarity = StringSimilarity.similarity(input, synonymFolded);
                if (synonymSimilarity > bestConfidence) {
                    bestCanonical = canonical;
                    bestConfidence = synonymSimilarity;
                }
            }
        }

        if (bestCanonical != null && bestConfidence >= threshold) {
            return new NormalizedTerm(bestCanonical, bestConfidence);
        }
        return NormalizedTerm.unchanged(rawValue);
    }
}
