package com.github.salilvnair.triage.model;

public record SpecialistMatch(
        Specialist specialist,
        int score,
        String reason
) {}
