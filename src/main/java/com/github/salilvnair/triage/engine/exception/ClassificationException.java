package com.github.salilvnair.triage.engine.exception;

public class ClassificationException extends TriageException {

    public ClassificationException(String message, Throwable cause) {
        super(TriageErrorCode.CLASSIFICATION_FAILED, message, cause);
    }
}
