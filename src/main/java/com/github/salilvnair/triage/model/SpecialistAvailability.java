package com.github.salilvnair.triage.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Calendar summary supplied by the scheduling integration.
 */
public record SpecialistAvailability(
        List<AvailabilityDay> upcomingAvailability
) {

    public static SpecialistAvailability none() {
        return new SpecialistAvailability(List.of());
    }

    /**
     * Counts open slots on days between {@code today} and {@code today + days}, both inclusive.
     */
    public int slotsWithin(LocalDate today, int days) {
        if (upcomingAvailability == null || today == null) {
            return 0;
        }
        LocalDate last = today.plusDays(days);
        int total = 0;
        for (AvailabilityDay day : upcomingAvailability) {
            if (day == null || day.date() == null || day.slots() <= 0) {
                continue;
            }
            if (!day.date().isBefore(today) && !day.date().isAfter(last)) {
                total += day.slots();
            }
        }
        return total;
    }
}
