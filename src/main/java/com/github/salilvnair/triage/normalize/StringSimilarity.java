package com.github.salilvnair.triage.normalize;

import lombok.experimental.UtilityClass;
import org.apache.commons.text.similarity.LevenshteinDistance;

@UtilityClass
public final class StringSimilarity {

    private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

    /**
     * {@code 1 - levenshtein(a, b) / max(len(a), len(b))}; two empty strings are identical.
     */
    public static double similarity(String left, String right) {
        String a = left == null ? "" : left;
        String b = right == null ? "" : right;
        int maxLength = Math.max(a.length(), b.length());
        if (maxLength == 0) {
            return 1d;
        }
        int distance = LEVENSHTEIN.apply(a, b);
        return 1d - (double) distance / maxLength;
    }
}
