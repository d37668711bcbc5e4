package com.github.salilvnair.triage.engine.exception;

import com.github.salilvnair.triage.model.TriageStage;
import lombok.Getter;

/**
 * Unexpected failure inside a run, tagged with the stage it happened in.
 * Never retried by the engine.
 */
@Getter
public class TriageStageException extends TriageException {

    private final TriageStage stage;

    public TriageStageException(TriageStage stage, Throwable cause) {
        super(TriageErrorCode.STAGE_FAILED,
                "Triage failed at stage " + stage + ": " + (cause == null ? "unknown" : cause.getMessage()),
                cause);
        this.stage = stage;
    }

    public TriageStageException(TriageStage stage, TriageErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
        this.stage = stage;
    }
}
