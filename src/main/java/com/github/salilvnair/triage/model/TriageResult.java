package com.github.salilvnair.triage.model;

/**
 * The decision plus advisory trace data. Callers must not branch on the trace.
 */
public record TriageResult(
        TriageDecision decision,
        TriageTrace trace
) {}
