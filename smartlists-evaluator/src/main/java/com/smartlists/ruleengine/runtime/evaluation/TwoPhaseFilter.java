/*
 * Copyright (c) 2025 SmartLists Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.smartlists.ruleengine.runtime.evaluation;

import com.smartlists.ruleengine.api.exceptions.EvaluationRunException;
import com.smartlists.ruleengine.api.model.MediaItem;
import com.smartlists.ruleengine.runtime.model.ExpressionSet;
import com.smartlists.ruleengine.runtime.model.RuleGroups;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.IntConsumer;

/**
 * Filters candidate batches against the OR of expression sets.
 *
 * <h2>Two-phase evaluation</h2>
 * <ol>
 *   <li><b>Phase 1:</b> only cheap rules run. Sets without expensive rules are decided
 *       outright; a mixed set whose cheap rules pass stays pending.</li>
 *   <li><b>Phase 2:</b> items with a pending set (the survivors) evaluate the expensive
 *       rules of those sets, which is where host lookups happen.</li>
 * </ol>
 * A cheap rule that fails already fails its set, so phase 1 can only over-admit and the
 * result equals a single pass over all rules.
 *
 * <h2>Failures</h2>
 * <p>An {@link ItemEvaluationException} (or any other runtime failure) while evaluating
 * an item drops that item and is counted; the batch carries on.
 *
 * <h2>Threading</h2>
 * <p>Items of a batch are split into chunks evaluated on the run's worker pool. Each
 * item's state is written by exactly one task and read after the join.
 */
public final class TwoPhaseFilter {
    private static final Logger logger = LoggerFactory.getLogger(TwoPhaseFilter.class);

    private final RuleGroups ruleGroups;
    private final ExpressionMatcher matcher;
    private final boolean twoPhase;
    private final ExecutorService pool;
    private final int parallelism;
    private final Tracer tracer;

    /**
     * @param twoPhase    whether to split cheap and expensive rules; callers pass false
     *                    when no expensive rule exists
     * @param pool        worker pool, or null to evaluate on the calling thread
     * @param parallelism number of chunks a batch is split into
     */
    public TwoPhaseFilter(RuleGroups ruleGroups, ExpressionMatcher matcher, boolean twoPhase,
                          ExecutorService pool, int parallelism, Tracer tracer) {
        this.ruleGroups = Objects.requireNonNull(ruleGroups, "ruleGroups must not be null");
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
        this.twoPhase = twoPhase;
        this.pool = pool;
        this.parallelism = Math.max(1, parallelism);
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    public boolean isTwoPhase() {
        return twoPhase;
    }

    /**
     * Filters one batch.
     *
     * @param batch    eligible items of the batch
     * @param ordinals candidate ordinal of each item
     * @throws EvaluationRunException if the worker pool fails
     */
    public BatchOutcome filter(List<MediaItem> batch, int[] ordinals) {
        ItemState[] states = new ItemState[batch.size()];
        for (int i = 0; i < states.length; i++) {
            states[i] = new ItemState();
        }

        RoaringBitmap survivors = new RoaringBitmap();
        if (twoPhase) {
            runPhase("phase1-filter", batch.size(), i -> phase1(batch.get(i), states[i]));
            for (int i = 0; i < states.length; i++) {
                if (!states[i].failed && !states[i].pending.isEmpty()) {
                    survivors.add(i);
                }
            }
            int[] survivorIndices = survivors.toArray();
            runPhase("phase2-filter", survivorIndices.length,
                    k -> phase2(batch.get(survivorIndices[k]), states[survivorIndices[k]]));
        } else {
            survivors.add(0L, batch.size());
            runPhase("phase1-filter", batch.size(), i -> singlePass(batch.get(i), states[i]));
        }

        List<MatchedItem> matches = new ArrayList<>();
        int errors = 0;
        for (int i = 0; i < states.length; i++) {
            ItemState state = states[i];
            if (state.failed) {
                errors++;
            } else if (!state.matched.isEmpty()) {
                IntArrays.quickSort(state.matched.elements(), 0, state.matched.size());
                matches.add(new MatchedItem(ordinals[i], batch.get(i), state.matched));
            }
        }
        return new BatchOutcome(matches, survivors.getCardinality(), errors);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // PER-ITEM EVALUATION
    // ════════════════════════════════════════════════════════════════════════════════

    private void phase1(MediaItem item, ItemState state) {
        guarded(item, state, () -> {
            for (int g = 0; g < ruleGroups.size(); g++) {
                ExpressionSet set = ruleGroups.get(g);
                if (!set.hasExpensiveExpressions()) {
                    if (matcher.matchesSet(set, item, ExpressionMatcher.Phase.ALL)) {
                        state.matched.add(g);
                    }
                } else if (matcher.matchesSet(set, item, ExpressionMatcher.Phase.CHEAP)) {
                    state.pending.add(g);
                }
            }
        });
    }

    private void phase2(MediaItem item, ItemState state) {
        guarded(item, state, () -> {
            for (int k = 0; k < state.pending.size(); k++) {
                int g = state.pending.getInt(k);
                if (matcher.matchesSet(ruleGroups.get(g), item, ExpressionMatcher.Phase.EXPENSIVE)) {
                    state.matched.add(g);
                }
            }
        });
    }

    private void singlePass(MediaItem item, ItemState state) {
        guarded(item, state, () -> {
            for (int g = 0; g < ruleGroups.size(); g++) {
                if (matcher.matchesSet(ruleGroups.get(g), item, ExpressionMatcher.Phase.ALL)) {
                    state.matched.add(g);
                }
            }
        });
    }

    private static void guarded(MediaItem item, ItemState state, Runnable evaluation) {
        try {
            evaluation.run();
        } catch (ItemEvaluationException e) {
            logger.debug("Excluding item {}: {}", item.id(), e.getMessage());
            state.fail();
        } catch (RuntimeException e) {
            logger.warn("Unexpected failure evaluating item {}, excluding it", item.id(), e);
            state.fail();
        }
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // SCHEDULING
    // ════════════════════════════════════════════════════════════════════════════════

    private void runPhase(String spanName, int count, IntConsumer task) {
        Span span = tracer.spanBuilder(spanName).startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("items", count);
            if (pool == null || parallelism == 1 || count < 2) {
                for (int i = 0; i < count; i++) {
                    task.accept(i);
                }
                return;
            }

            int chunks = Math.min(parallelism, count);
            int chunkSize = (count + chunks - 1) / chunks;
            List<CompletableFuture<Void>> futures = new ArrayList<>(chunks);
            for (int start = 0; start < count; start += chunkSize) {
                int from = start;
                int to = Math.min(count, start + chunkSize);
                futures.add(CompletableFuture.runAsync(() -> {
                    for (int i = from; i < to; i++) {
                        task.accept(i);
                    }
                }, pool));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException | RejectedExecutionException e) {
            span.recordException(e);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new EvaluationRunException(EvaluationRunException.Reason.RESOURCE_FAILURE,
                    "Worker pool failed during " + spanName + ": " + cause.getMessage(), cause);
        } finally {
            span.end();
        }
    }

    /**
     * Result of filtering one batch.
     *
     * @param matches   matched items in batch order
     * @param survivors items that needed expensive evaluation
     * @param errors    items dropped because their evaluation failed
     */
    public record BatchOutcome(List<MatchedItem> matches, int survivors, int errors) {
    }

    private static final class ItemState {
        final IntArrayList matched = new IntArrayList(2);
        final IntArrayList pending = new IntArrayList(2);
        boolean failed;

        void fail() {
            failed = true;
            matched.clear();
        }
    }
}
