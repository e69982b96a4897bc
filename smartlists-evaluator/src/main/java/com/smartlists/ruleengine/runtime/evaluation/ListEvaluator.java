/*
 * Copyright (c) 2025 SmartLists Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.smartlists.ruleengine.runtime.evaluation;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.smartlists.ruleengine.api.CancellationSignal;
import com.smartlists.ruleengine.api.CandidateSource;
import com.smartlists.ruleengine.api.CatalogLookups;
import com.smartlists.ruleengine.api.ExternalListProvider;
import com.smartlists.ruleengine.api.IListEvaluator;
import com.smartlists.ruleengine.api.ProgressSink;
import com.smartlists.ruleengine.api.exceptions.EvaluationRunException;
import com.smartlists.ruleengine.api.exceptions.RunCancelledException;
import com.smartlists.ruleengine.api.model.EvaluationStats;
import com.smartlists.ruleengine.api.model.ListEvaluationResult;
import com.smartlists.ruleengine.api.model.ListLimits;
import com.smartlists.ruleengine.api.model.MediaItem;
import com.smartlists.ruleengine.api.model.ResultItem;
import com.smartlists.ruleengine.cache.EvaluationCache;
import com.smartlists.ruleengine.infra.config.EngineConfig;
import com.smartlists.ruleengine.runtime.external.ExternalListIndex;
import com.smartlists.ruleengine.runtime.external.ExternalListService;
import com.smartlists.ruleengine.runtime.extraction.FieldExtractor;
import com.smartlists.ruleengine.runtime.model.CompiledExpression;
import com.smartlists.ruleengine.runtime.model.EvaluationContext;
import com.smartlists.ruleengine.runtime.model.FieldValueType;
import com.smartlists.ruleengine.runtime.model.RuleGroups;
import com.smartlists.ruleengine.runtime.model.SortSpec;
import com.smartlists.ruleengine.runtime.operators.OperatorEvaluator;
import com.smartlists.ruleengine.runtime.ordering.OrderingStage;
import com.smartlists.ruleengine.runtime.ordering.SortKeyResolver;
import com.smartlists.ruleengine.runtime.similarity.SimilarityScorer;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Evaluates rule sets against a batched candidate source.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>External lists referenced by rules are fetched, and when SimilarTo rules exist a
 *       first pass over the source collects their reference items.</li>
 *   <li>Candidates are pulled in batches of {@link EngineConfig#getProcessingBatchSize()},
 *       filtered by media type and extras, then run through the {@link TwoPhaseFilter}.</li>
 *   <li>Matches go through the {@link OrderingStage}.</li>
 * </ol>
 *
 * <h2>Run state</h2>
 * <p>Every run gets its own {@link EvaluationCache} and worker pool, both discarded when
 * the run ends. The evaluator itself only holds configuration and cumulative metrics, so
 * concurrent runs on one instance are safe.
 *
 * <h2>Cancellation</h2>
 * <p>The signal is checked before every batch and once more before ordering. A
 * cancelled run throws {@link RunCancelledException}; nothing of it is returned.
 */
public final class ListEvaluator implements IListEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(ListEvaluator.class);

    private final CatalogLookups lookups;
    private final ExternalListService externalLists;
    private final EngineConfig config;
    private final Tracer tracer;
    private final EvaluatorMetrics metrics = new EvaluatorMetrics();

    // ════════════════════════════════════════════════════════════════════════════════
    // CONSTRUCTORS
    // ════════════════════════════════════════════════════════════════════════════════

    public ListEvaluator(CatalogLookups lookups, List<ExternalListProvider> providers,
                         EngineConfig config, Tracer tracer) {
        this.lookups = Objects.requireNonNull(lookups, "lookups must not be null");
        this.externalLists = new ExternalListService(providers);
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        logger.info("ListEvaluator initialized: {}", config);
    }

    public ListEvaluator(CatalogLookups lookups, List<ExternalListProvider> providers, EngineConfig config) {
        this(lookups, providers, config, OpenTelemetry.noop().getTracer("smartlists-evaluator"));
    }

    /**
     * Creates an evaluator without external list providers, configured from
     * {@code smartlists.properties}.
     */
    public ListEvaluator(CatalogLookups lookups) {
        this(lookups, List.of(), EngineConfig.loadDefault());
    }

    public EvaluatorMetrics getMetrics() {
        return metrics;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // IListEvaluator INTERFACE IMPLEMENTATION
    // ════════════════════════════════════════════════════════════════════════════════

    @Override
    public ListEvaluationResult evaluate(RuleGroups ruleGroups, CandidateSource candidates,
                                         EvaluationContext context, SortSpec sortSpec, ListLimits limits) {
        return evaluate(ruleGroups, candidates, context, sortSpec, limits, ProgressSink.NONE, CancellationSignal.NONE);
    }

    @Override
    public ListEvaluationResult evaluate(RuleGroups ruleGroups, CandidateSource candidates,
                                         EvaluationContext context, SortSpec sortSpec, ListLimits limits,
                                         ProgressSink progress, CancellationSignal cancellation) {
        Objects.requireNonNull(ruleGroups, "ruleGroups must not be null");
        Objects.requireNonNull(candidates, "candidates must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(sortSpec, "sortSpec must not be null");
        Objects.requireNonNull(limits, "limits must not be null");
        Objects.requireNonNull(progress, "progress must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");

        Span span = tracer.spanBuilder("evaluate-list").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("expressionSetCount", ruleGroups.size());
            ListEvaluationResult result = run(ruleGroups, candidates, context, sortSpec, limits, progress,
                    cancellation);
            span.setAttribute("candidates", result.stats().candidates());
            span.setAttribute("returned", result.size());
            span.setAttribute("itemErrors", result.perItemErrorCount());
            return result;
        } catch (RunCancelledException e) {
            metrics.recordCancelled();
            span.recordException(e);
            logger.info("List evaluation cancelled: {}", e.getMessage());
            throw e;
        } catch (EvaluationRunException e) {
            metrics.recordFailed();
            span.recordException(e);
            logger.warn("List evaluation aborted ({}): {}", e.getReason(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordFailed();
            span.recordException(e);
            logger.error("List evaluation failed unexpectedly", e);
            throw new EvaluationRunException(EvaluationRunException.Reason.RESOURCE_FAILURE,
                    "List evaluation failed: " + e.getMessage(), e);
        } finally {
            span.end();
        }
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // RUN
    // ════════════════════════════════════════════════════════════════════════════════

    private ListEvaluationResult run(RuleGroups ruleGroups, CandidateSource candidates, EvaluationContext context,
                                     SortSpec sortSpec, ListLimits limits, ProgressSink progress,
                                     CancellationSignal cancellation) {
        long start = System.nanoTime();
        long total = totalCount(candidates);

        if (ruleGroups.size() == 0) {
            // Zero sets match nothing.
            logger.debug("Rule set has no expression sets, nothing can match");
            EvaluationStats stats = new EvaluationStats(0, 0, 0, 0, 0, false, System.nanoTime() - start);
            metrics.recordRun(0, 0, 0, 0, 0, stats.elapsedNanos());
            return new ListEvaluationResult(List.of(), 0, stats);
        }

        EvaluationCache cache = new EvaluationCache(lookups);
        OperatorEvaluator operators = new OperatorEvaluator(context.now(), config.getRegexTimeoutMillis());
        FieldExtractor extractor = new FieldExtractor(cache, context);

        Set<String> urls = ExternalListService.referencedUrls(ruleGroups);
        ExternalListIndex externalIndex = urls.isEmpty() ? null : externalLists.prefetch(urls, cache);

        SimilarityScorer similarity = collectSimilarityReferences(ruleGroups, candidates, total, context, cache,
                operators, cancellation);

        ExpressionMatcher matcher = new ExpressionMatcher(extractor, operators, similarity, externalIndex);
        boolean twoPhase = config.isTwoPhaseFiltering() && ruleGroups.usesExpensiveFields();
        int workers = config.getWorkerThreads();
        ExecutorService pool = workers > 1 ? newPool(workers) : null;

        try {
            TwoPhaseFilter filter = new TwoPhaseFilter(ruleGroups, matcher, twoPhase, pool, workers, tracer);
            RunTally tally = new RunTally();

            readBatches(candidates, total, cancellation, (batch, offset) -> {
                List<MediaItem> eligible = new ArrayList<>(batch.size());
                List<Integer> ordinals = new ArrayList<>(batch.size());
                for (int i = 0; i < batch.size(); i++) {
                    MediaItem item = batch.get(i);
                    if (context.admitsType(item.itemType()) && (context.includeExtras() || !item.isExtra())) {
                        eligible.add(item);
                        ordinals.add((int) (offset + i));
                    }
                }
                TwoPhaseFilter.BatchOutcome outcome =
                        filter.filter(eligible, ordinals.stream().mapToInt(Integer::intValue).toArray());

                tally.candidates += batch.size();
                tally.eligible += eligible.size();
                tally.survivors += outcome.survivors();
                tally.errors += outcome.errors();
                tally.matches.addAll(outcome.matches());
                reportProgress(progress, offset + batch.size(), total);
            });
            checkCancellation(cancellation);

            SortKeyResolver resolver = new SortKeyResolver(extractor, similarity, externalIndex, context.randomSeed());
            List<ResultItem> items = new OrderingStage(resolver, tracer)
                    .orderAndLimit(tally.matches, ruleGroups, sortSpec, limits);

            long elapsed = System.nanoTime() - start;
            EvaluationStats stats = new EvaluationStats(tally.candidates, tally.eligible, tally.survivors,
                    tally.matches.size(), items.size(), twoPhase, elapsed);
            metrics.recordRun(tally.candidates, tally.survivors, tally.matches.size(), items.size(), tally.errors,
                    elapsed);

            if (tally.errors > 0) {
                logger.warn("{} item(s) excluded because their evaluation failed", tally.errors);
            }
            if (logger.isDebugEnabled()) {
                Map<String, Object> cacheStats = cache.getSnapshot();
                logger.debug("Evaluated {} candidates ({} eligible, {} survivors): {} matched, {} returned in {} ms; cache {}",
                        tally.candidates, tally.eligible, tally.survivors, tally.matches.size(), items.size(),
                        elapsed / 1_000_000, cacheStats);
            }
            return new ListEvaluationResult(items, tally.errors, stats);
        } finally {
            if (pool != null) {
                pool.shutdownNow();
            }
        }
    }

    /**
     * Reference pass over the whole source, before media type filtering, so that a
     * reference may be of a different type than the items it selects.
     *
     * @return the scorer, or null when no SimilarTo rule exists
     */
    private SimilarityScorer collectSimilarityReferences(RuleGroups ruleGroups, CandidateSource candidates, long total,
                                                         EvaluationContext context, EvaluationCache cache,
                                                         OperatorEvaluator operators, CancellationSignal cancellation) {
        List<CompiledExpression> rules = ruleGroups.allExpressions().stream()
                .filter(e -> e.field().valueType() == FieldValueType.SIMILARITY)
                .collect(Collectors.toList());
        if (rules.isEmpty()) {
            return null;
        }

        SimilarityScorer scorer = new SimilarityScorer(cache, context.similarityFields(), operators, rules);
        readBatches(candidates, total, cancellation, (batch, offset) -> {
            for (MediaItem item : batch) {
                try {
                    scorer.offerReference(item);
                } catch (RuntimeException e) {
                    logger.debug("Skipping similarity reference candidate {}: {}", item.id(), e.getMessage());
                }
            }
        });
        scorer.logReferences();
        return scorer;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // CANDIDATE SOURCE
    // ════════════════════════════════════════════════════════════════════════════════

    private static long totalCount(CandidateSource candidates) {
        try {
            return Math.max(0, candidates.totalCount());
        } catch (RuntimeException e) {
            throw new EvaluationRunException(EvaluationRunException.Reason.SOURCE_FAILURE,
                    "Candidate source failed to report its size: " + e.getMessage(), e);
        }
    }

    private void readBatches(CandidateSource candidates, long total, CancellationSignal cancellation,
                             BatchConsumer consumer) {
        int batchSize = config.getProcessingBatchSize();
        long offset = 0;
        while (offset < total) {
            checkCancellation(cancellation);
            int limit = (int) Math.min(batchSize, total - offset);

            List<MediaItem> batch;
            try {
                batch = candidates.fetchBatch(offset, limit);
            } catch (RuntimeException e) {
                throw new EvaluationRunException(EvaluationRunException.Reason.SOURCE_FAILURE,
                        "Candidate source failed at offset " + offset + ": " + e.getMessage(), e);
            }
            if (batch == null || batch.isEmpty()) {
                throw new EvaluationRunException(EvaluationRunException.Reason.SOURCE_EXHAUSTED,
                        "Candidate source returned no items at offset " + offset + " of " + total);
            }
            if (batch.size() > limit) {
                batch = batch.subList(0, limit);
            }

            consumer.accept(batch, offset);
            offset += batch.size();
        }
    }

    private static void reportProgress(ProgressSink progress, long processed, long total) {
        try {
            progress.onBatchProcessed(processed, total);
        } catch (RuntimeException e) {
            throw new EvaluationRunException(EvaluationRunException.Reason.RESOURCE_FAILURE,
                    "Progress sink failed after " + processed + " of " + total + " items: " + e.getMessage(), e);
        }
    }

    private static void checkCancellation(CancellationSignal cancellation) {
        if (cancellation.isCancellationRequested()) {
            throw new RunCancelledException("List evaluation was cancelled");
        }
    }

    private static ExecutorService newPool(int workers) {
        return Executors.newFixedThreadPool(workers,
                new ThreadFactoryBuilder()
                        .setNameFormat("smartlists-eval-%d")
                        .setDaemon(true)
                        .build());
    }

    @FunctionalInterface
    private interface BatchConsumer {
        void accept(List<MediaItem> batch, long offset);
    }

    /** Mutable counters of one run, touched only by the run's thread. */
    private static final class RunTally {
        long candidates;
        long eligible;
        long survivors;
        int errors;
        final List<MatchedItem> matches = new ArrayList<>();
    }
}
