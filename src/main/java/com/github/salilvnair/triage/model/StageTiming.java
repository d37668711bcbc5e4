package com.github.salilvnair.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageTiming {
    private TriageStage stage;
    private String stepName;
    private long durationMs;
    private boolean success;
    private String outcome;
}
