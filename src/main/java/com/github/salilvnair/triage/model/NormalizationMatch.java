package com.github.salilvnair.triage.model;

public record NormalizationMatch(
        String original,
        String matched,
        double confidence
) {}
