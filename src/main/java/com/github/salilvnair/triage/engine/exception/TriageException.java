package com.github.salilvnair.triage.engine.exception;

import lombok.Getter;

@Getter
public class TriageException extends RuntimeException {

    private final String errorCode;
    private final boolean recoverable;

    public TriageException(TriageErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public TriageException(TriageErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public TriageException(TriageErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public boolean is(TriageErrorCode code) {
        return code != null && code.name().equals(errorCode);
    }
}
