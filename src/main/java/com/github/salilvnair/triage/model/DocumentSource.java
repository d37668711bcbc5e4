package com.github.salilvnair.triage.model;

public record DocumentSource(
        String title,
        String category
) {}
