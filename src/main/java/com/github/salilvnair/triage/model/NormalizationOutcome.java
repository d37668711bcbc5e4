package com.github.salilvnair.triage.model;

import java.util.Map;

public record NormalizationOutcome(
        ExtractedInfo normalized,
        Map<TriageField, NormalizationMatch> matches
) {}
