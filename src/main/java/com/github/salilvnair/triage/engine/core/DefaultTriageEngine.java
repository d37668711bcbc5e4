package com.github.salilvnair.triage.engine.core;

import com.github.salilvnair.triage.config.TriageEngineProperties;
import com.github.salilvnair.triage.engine.exception.TriageErrorCode;
import com.github.salilvnair.triage.engine.exception.TriageException;
import com.github.salilvnair.triage.engine.exception.TriageStageException;
import com.github.salilvnair.triage.engine.exception.TriageTimeoutException;
import com.github.salilvnair.triage.engine.hook.TriageStageHook;
import com.github.salilvnair.triage.engine.pipeline.TriagePipelineFactory;
import com.github.salilvnair.triage.engine.snapshot.TriageSnapshotLoader;
import com.github.salilvnair.triage.model.TriageDecision;
import com.github.salilvnair.triage.model.TriageRequest;
import com.github.salilvnair.triage.model.TriageResult;
import com.github.salilvnair.triage.model.TriageStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

@Slf4j
@Component
public class DefaultTriageEngine implements TriageEngine {

    private final TriagePipelineFactory pipelineFactory;
    private final TriageSnapshotLoader snapshotLoader;
    private final List<TriageStageHook> stageHooks;
    private final AsyncTaskExecutor executor;
    private final TriageEngineProperties properties;
    private final Clock clock;

    public DefaultTriageEngine(TriagePipelineFactory pipelineFactory,
                               TriageSnapshotLoader snapshotLoader,
                               List<TriageStageHook> stageHooks,
                               @Qualifier("triageTaskExecutor") AsyncTaskExecutor executor,
                               TriageEngineProperties properties,
                               Clock clock) {
        this.pipelineFactory = pipelineFactory;
        this.snapshotLoader = snapshotLoader;
        this.stageHooks = stageHooks == null ? List.of() : stageHooks;
        this.executor = executor;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public TriageResult triage(TriageRequest request) {
        validate(request);
        TriageRun run = new TriageRun(request, clock.instant());
        Future<TriageResult> future = start(run);
        Duration timeout = timeoutFor(request);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            run.setCancelled(true);
            future.cancel(true);
            log.warn("Triage {} timed out after {} ms at stage {}", run.getTraceId(), timeout.toMillis(), run.getStage());
            TriageTimeoutException timeoutException = new TriageTimeoutException(
                    TriageErrorCode.TRIAGE_TIMEOUT,
                    run.getStage(),
                    "Triage timed out after " + timeout.toMillis() + " ms at stage " + run.getStage()
            );
            fail(run, timeoutException);
            throw timeoutException;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.setCancelled(true);
            future.cancel(true);
            throw new TriageTimeoutException(
                    TriageErrorCode.TRIAGE_CANCELLED,
                    run.getStage(),
                    "Caller interrupted while waiting for triage " + run.getTraceId()
            );
        } catch (CancellationException e) {
            throw new TriageTimeoutException(
                    TriageErrorCode.TRIAGE_CANCELLED,
                    run.getStage(),
                    "Triage " + run.getTraceId() + " was cancelled"
            );
        } catch (ExecutionException e) {
            throw unwrap(e.getCause(), run);
        }
    }

    @Override
    public Future<TriageResult> submit(TriageRequest request) {
        validate(request);
        return start(new TriageRun(request, clock.instant()));
    }

    /**
     * Runs the pipeline on the calling thread without a deadline.
     */
    public TriageResult execute(TriageRun run) {
        try {
            run.setSnapshot(snapshotLoader.load());
            TriageDecision decision = pipelineFactory.create().execute(run);
            run.setCompletedAt(clock.instant());
            run.setStage(TriageStage.DONE);
            TriageResult result = new TriageResult(decision, run.toTrace());
            if (!run.isCancelled()) {
                notifyHooks(hook -> hook.onComplete(run, result), "onComplete", run);
            }
            return result;
        } catch (TriageException e) {
            if (e instanceof TriageStageException stageException && run.getErrorStage() == null) {
                run.setErrorStage(stageException.getStage());
                run.setErrorMessage(e.getMessage());
            }
            if (!e.is(TriageErrorCode.TRIAGE_TIMEOUT) && !run.isCancelled()) {
                fail(run, e);
            }
            throw e;
        }
    }

    private Future<TriageResult> start(TriageRun run) {
        FutureTask<TriageResult> task = new FutureTask<>(() -> execute(run)) {
            @Override
            public boolean cancel(boolean mayInterruptIfRunning) {
                run.setCancelled(true);
                return super.cancel(mayInterruptIfRunning);
            }
        };
        executor.execute(task);
        return task;
    }

    private void fail(TriageRun run, TriageException error) {
        run.setCompletedAt(clock.instant());
        if (run.getErrorStage() == null) {
            run.setErrorStage(run.getStage());
            run.setErrorMessage(error.getMessage());
        }
        notifyHooks(hook -> hook.onFailure(run, error), "onFailure", run);
    }

    private void notifyHooks(Consumer<TriageStageHook> call, String phase, TriageRun run) {
        for (TriageStageHook hook : stageHooks) {
            try {
                call.accept(hook);
            } catch (Exception ex) {
                log.warn("TriageStageHook {} failed during {} traceId={}: {}",
                        hook.getClass().getSimpleName(), phase, run.getTraceId(), ex.getMessage());
            }
        }
    }

    private Duration timeoutFor(TriageRequest request) {
        Duration timeout = request.getTimeout();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            timeout = properties.getExecution().getTimeout();
        }
        return timeout;
    }

    private static RuntimeException unwrap(Throwable cause, TriageRun run) {
        if (cause instanceof TriageException triageException) {
            return triageException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new TriageStageException(run.getStage(), cause);
    }

    private static void validate(TriageRequest request) {
        if (request == null) {
            throw new TriageException(TriageErrorCode.INVALID_REQUEST, "Triage request is required");
        }
        if (request.getMessages() == null || request.getMessages().isEmpty()) {
            throw new TriageException(TriageErrorCode.INVALID_REQUEST, "Triage request has no messages");
        }
    }
}
