package com.github.salilvnair.triage.engine.hook;

import com.github.salilvnair.triage.config.TriageEngineProperties;
import com.github.salilvnair.triage.engine.core.TriageRun;
import com.github.salilvnair.triage.engine.exception.TriageException;
import com.github.salilvnair.triage.model.TriageResult;
import com.github.salilvnair.triage.model.TriageTrace;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Keeps the most recent traces in memory, oldest evicted first.
 */
@Component
public class TriageTraceRecorder implements TriageStageHook {

    private final int capacity;
    private final Deque<TriageTrace> traces = new ArrayDeque<>();

    public TriageTraceRecorder(TriageEngineProperties properties) {
        this.capacity = Math.max(1, properties.getTrace().getCapacity());
    }

    @Override
    public void onComplete(TriageRun run, TriageResult result) {
        record(result.trace());
    }

    @Override
    public void onFailure(TriageRun run, TriageException error) {
        record(run.toTrace());
    }

    public synchronized void record(TriageTrace trace) {
        if (trace == null) {
            return;
        }
        traces.addFirst(trace);
        while (traces.size() > capacity) {
            traces.removeLast();
        }
    }

    /**
     * Newest first.
     */
    public synchronized List<TriageTrace> recent(int limit) {
        List<TriageTrace> out = new ArrayList<>();
        Iterator<TriageTrace> it = traces.iterator();
        while (it.hasNext() && out.size() < limit) {
            out.add(it.next());
        }
        return out;
    }

    public synchronized Optional<TriageTrace> find(String traceId) {
        return traces.stream()
                .filter(t -> t.getTraceId().equals(traceId))
                .findFirst();
    }

    public synchronized int size() {
        return traces.size();
    }

    public synchronized void clear() {
        traces.clear();
    }
}
