package com.github.salilvnair.triage.model;

/**
 * Result of normalizing one raw value. A confidence of zero means no normalization applied
 * and {@code canonical} is the raw input.
 */
public record NormalizedTerm(
        String canonical,
        double confidence
) {

    public static NormalizedTerm unchanged(String raw) {
        return new NormalizedTerm(raw, 0d);
    }

    public boolean isApplied() {
        return confidence > 0d;
    }
}
