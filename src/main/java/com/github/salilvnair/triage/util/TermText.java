package com.github.salilvnair.triage.util;

import lombok.experimental.UtilityClass;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

@UtilityClass
public final class TermText {

    /** Lower-cased, trimmed form used for every case-insensitive comparison. */
    public static String fold(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public static boolean containsFolded(Collection<String> values, String candidate) {
        if (values == null || !hasText(candidate)) {
            return false;
        }
        String folded = fold(candidate);
        for (String value : values) {
            if (hasText(value) && fold(value).equals(folded)) {
                return true;
            }
        }
        return false;
    }

    public static Set<String> foldAll(Collection<String> values) {
        Set<String> folded = new LinkedHashSet<>();
        if (values == null) {
            return folded;
        }
        for (String value : values) {
            if (hasText(value)) {
                folded.add(fold(value));
            }
        }
        return folded;
    }
}
