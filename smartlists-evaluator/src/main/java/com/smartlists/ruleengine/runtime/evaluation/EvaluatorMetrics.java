package com.smartlists.ruleengine.runtime.evaluation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Cumulative counters of a {@code ListEvaluator} across runs.
 *
 * <p>Lock-free ({@link LongAdder}); runs on different threads record concurrently.
 */
public final class EvaluatorMetrics {

    private final LongAdder runs = new LongAdder();
    private final LongAdder cancelledRuns = new LongAdder();
    private final LongAdder failedRuns = new LongAdder();
    private final LongAdder candidates = new LongAdder();
    private final LongAdder phase1Survivors = new LongAdder();
    private final LongAdder matched = new LongAdder();
    private final LongAdder returned = new LongAdder();
    private final LongAdder itemErrors = new LongAdder();
    private final LongAdder totalRunTimeNanos = new LongAdder();

    public void recordRun(long candidateCount, long survivorCount, long matchedCount, long returnedCount,
                          int errorCount, long elapsedNanos) {
        runs.increment();
        candidates.add(candidateCount);
        phase1Survivors.add(survivorCount);
        matched.add(matchedCount);
        returned.add(returnedCount);
        itemErrors.add(errorCount);
        totalRunTimeNanos.add(elapsedNanos);
    }

    public void recordCancelled() {
        cancelledRuns.increment();
    }

    public void recordFailed() {
        failedRuns.increment();
    }

    /**
     * Creates a new map on every call.
     */
    public Map<String, Object> getSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();

        long completed = runs.sum();
        long candidateTotal = candidates.sum();

        snapshot.put("completedRuns", completed);
        snapshot.put("cancelledRuns", cancelledRuns.sum());
        snapshot.put("failedRuns", failedRuns.sum());
        snapshot.put("avgRunTimeNanos", completed > 0 ? totalRunTimeNanos.sum() / completed : 0);
        snapshot.put("candidates", candidateTotal);
        snapshot.put("phase1Survivors", phase1Survivors.sum());
        snapshot.put("survivorRate", candidateTotal > 0 ? (double) phase1Survivors.sum() / candidateTotal * 100.0 : 0.0);
        snapshot.put("matched", matched.sum());
        snapshot.put("returned", returned.sum());
        snapshot.put("itemErrors", itemErrors.sum());

        return snapshot;
    }
}
