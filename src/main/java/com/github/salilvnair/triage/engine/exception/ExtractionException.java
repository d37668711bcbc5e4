package com.github.salilvnair.triage.engine.exception;

public class ExtractionException extends TriageException {

    public ExtractionException(String message) {
        super(TriageErrorCode.EXTRACTION_FAILED, message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(TriageErrorCode.EXTRACTION_FAILED, message, cause);
    }
}
