package com.github.salilvnair.triage.engine.core;

import com.github.salilvnair.triage.model.TriageRequest;
import com.github.salilvnair.triage.model.TriageResult;

import java.util.concurrent.Future;

public interface TriageEngine {

    /**
     * Runs one triage and blocks until it finishes or the request timeout expires.
     *
     * @throws com.github.salilvnair.triage.engine.exception.TriageTimeoutException when the deadline passes
     * @throws com.github.salilvnair.triage.engine.exception.TriageStageException on an unexpected stage failure
     */
    TriageResult triage(TriageRequest request);

    /**
     * Starts a triage in the background. Cancelling the future stops the run at the next stage boundary.
     */
    Future<TriageResult> submit(TriageRequest request);
}
