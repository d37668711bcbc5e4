package com.github.salilvnair.triage.engine.pipeline;

import com.github.salilvnair.triage.engine.core.TriageRun;
import com.github.salilvnair.triage.engine.exception.TriageErrorCode;
import com.github.salilvnair.triage.engine.exception.TriageException;
import com.github.salilvnair.triage.engine.exception.TriageStageException;
import com.github.salilvnair.triage.engine.exception.TriageTimeoutException;
import com.github.salilvnair.triage.engine.hook.TriageStageHook;
import com.github.salilvnair.triage.model.StageTiming;
import com.github.salilvnair.triage.model.TriageStage;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RequiredArgsConstructor
@Component
public class TriagePipelineFactory {

    private final List<TriageStep> discoveredSteps;
    private final List<TriageStageHook> stageHooks;

    private TriagePipeline pipeline;

    @PostConstruct
    public void init() {
        List<TriageStep> ordered = orderByStage(discoveredSteps);
        log.info(
                "Triage pipeline order: {}",
                ordered.stream()
                        .map(s -> s.stage() + "(" + s.getClass().getSimpleName() + ")")
                        .collect(Collectors.joining(" -> "))
        );
        this.pipeline = new TriagePipeline(wrapWithTiming(ordered));
    }

    public TriagePipeline create() {
        return pipeline;
    }

    private List<TriageStep> orderByStage(List<TriageStep> steps) {
        Map<TriageStage, TriageStep> stepByStage = new EnumMap<>(TriageStage.class);
        for (TriageStep s : steps) {
            TriageStep previous = stepByStage.put(s.stage(), s);
            if (previous != null) {
                throw new TriageException(
                        TriageErrorCode.DUPLICATE_TRIAGE_STEP,
                        "Duplicate TriageStep for stage " + s.stage() + ": "
                                + previous.getClass().getName() + ", " + s.getClass().getName()
                );
            }
        }
        List<TriageStep> ordered = new ArrayList<>(stepByStage.values());
        ordered.sort(Comparator.comparingInt(s -> s.stage().ordinal()));
        return ordered;
    }

    private List<TriageStep> wrapWithTiming(List<TriageStep> steps) {
        List<TriageStageHook> hooks = stageHooks == null ? List.of() : stageHooks;
        return steps.stream()
                .<TriageStep>map(s -> new TimingTriageStep(s, hooks))
                .toList();
    }

    private static final class TimingTriageStep implements TriageStep {

        private final TriageStep delegate;
        private final List<TriageStageHook> hooks;

        private TimingTriageStep(TriageStep delegate, List<TriageStageHook> hooks) {
            this.delegate = delegate;
            this.hooks = hooks;
        }

        @Override
        public TriageStage stage() {
            return delegate.stage();
        }

        @Override
        public StepResult execute(TriageRun run) {
            TriageStage stage = delegate.stage();
            String stepName = delegate.getClass().getSimpleName();
            run.setStage(stage);
            long start = System.nanoTime();

            StageTiming timing = StageTiming.builder()
                    .stage(stage)
                    .stepName(stepName)
                    .success(false)
                    .build();

            for (TriageStageHook hook : hooks) {
                runHookSafely(() -> {
                    if (hook.supports(stage, run)) {
                        hook.beforeStage(stage, run);
                    }
                }, hook, "beforeStage", stage, run);
            }

            try {
                StepResult r = delegate.execute(run);
                timing.setDurationMs((System.nanoTime() - start) / 1_000_000);
                timing.setSuccess(true);
                timing.setOutcome(r.getClass().getSimpleName());
                run.getStageTimings().add(timing);
                for (TriageStageHook hook : hooks) {
                    runHookSafely(() -> {
                        if (hook.supports(stage, run)) {
                            hook.afterStage(stage, run, r);
                        }
                    }, hook, "afterStage", stage, run);
                }
                return r;
            } catch (RuntimeException e) {
                timing.setDurationMs((System.nanoTime() - start) / 1_000_000);
                timing.setOutcome(e.getClass().getSimpleName());
                run.getStageTimings().add(timing);
                run.setErrorStage(stage);
                run.setErrorMessage(e.getClass().getSimpleName() + ": " + e.getMessage());
                for (TriageStageHook hook : hooks) {
                    runHookSafely(() -> {
                        if (hook.supports(stage, run)) {
                            hook.onStageError(stage, run, e);
                        }
                    }, hook, "onStageError", stage, run);
                }
                if (e instanceof TriageStageException || e instanceof TriageTimeoutException) {
                    throw e;
                }
                throw new TriageStageException(stage, e);
            }
        }

        private void runHookSafely(Runnable hookCall,
                                   TriageStageHook hook,
                                   String phase,
                                   TriageStage stage,
                                   TriageRun run) {
            try {
                hookCall.run();
            } catch (Exception ex) {
                log.warn(
                        "TriageStageHook {} failed during {} for stage {} traceId={}: {}",
                        hook.getClass().getSimpleName(),
                        phase,
                        stage,
                        run.getTraceId(),
                        ex.getMessage()
                );
            }
        }
    }
}
