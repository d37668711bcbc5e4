package com.github.salilvnair.triage.model;

import java.time.LocalDate;

public record AvailabilityDay(
        LocalDate date,
        int slots
) {}
