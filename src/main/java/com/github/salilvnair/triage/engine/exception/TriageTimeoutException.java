package com.github.salilvnair.triage.engine.exception;

import com.github.salilvnair.triage.model.TriageStage;
import lombok.Getter;

@Getter
public class TriageTimeoutException extends TriageException {

    private final TriageStage stage;

    public TriageTimeoutException(TriageErrorCode code, TriageStage stage, String message) {
        super(code, message);
        this.stage = stage;
    }
}
