package com.github.salilvnair.triage.model;

/**
 * Internal employee details carried next to, never inside, {@link ExtractedInfo}.
 */
public record EmployeeMetadata(
        String employeeId,
        String displayName,
        String role
) {}
