package com.github.salilvnair.triage.model;

public enum TriageOutcome {
    ASSIGNED,
    DOCUMENT_ANSWERED,
    NEEDS_INFO
}
