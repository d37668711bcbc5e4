package com.github.salilvnair.triage.model;

public record SpecialistScore(
        Specialist specialist,
        int score
) {}
