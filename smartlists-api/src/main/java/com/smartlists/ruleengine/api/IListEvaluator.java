/*
 * Copyright (c) 2025 SmartLists Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.smartlists.ruleengine.api;

import com.smartlists.ruleengine.api.exceptions.EvaluationRunException;
import com.smartlists.ruleengine.api.model.ListEvaluationResult;
import com.smartlists.ruleengine.api.model.ListLimits;
import com.smartlists.ruleengine.runtime.model.CompiledListDefinition;
import com.smartlists.ruleengine.runtime.model.EvaluationContext;
import com.smartlists.ruleengine.runtime.model.RuleGroups;
import com.smartlists.ruleengine.runtime.model.SortSpec;

/**
 * Contract for evaluating a rule set against a candidate catalog.
 *
 * <p>A run pulls candidates in batches, filters them (cheap predicates first,
 * expensive lookups only for survivors), then sorts, groups and trims the matches.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CompiledListDefinition list = compiler.compileJson(json);
 * IListEvaluator evaluator = new ListEvaluator(lookups, providers, EngineConfig.loadDefault());
 *
 * ListEvaluationResult result = evaluator.evaluate(list, candidates,
 *         EvaluationContext.builder().userId("u1"));
 *
 * result.itemIds().forEach(playlist::add);
 * }</pre>
 *
 * <h2>Failure model</h2>
 * <ul>
 *   <li>Per-item failures drop that item and are counted in the result</li>
 *   <li>Run-level failures throw {@link EvaluationRunException}; no partial result exists</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations are thread-safe; concurrent runs share no mutable state.
 */
public interface IListEvaluator {

    /**
     * Evaluates a rule set.
     *
     * @param ruleGroups OR of AND-ed expression sets
     * @param candidates batched candidate source
     * @param context    per-run context
     * @param sortSpec   ordering of the output
     * @param limits     per-group, global and playtime limits
     * @return ordered, bounded result
     * @throws EvaluationRunException on cancellation or candidate source failure
     */
    ListEvaluationResult evaluate(RuleGroups ruleGroups,
                                  CandidateSource candidates,
                                  EvaluationContext context,
                                  SortSpec sortSpec,
                                  ListLimits limits) throws EvaluationRunException;

    /**
     * Same as {@link #evaluate(RuleGroups, CandidateSource, EvaluationContext, SortSpec, ListLimits)}
     * with a progress sink and cancellation signal.
     */
    ListEvaluationResult evaluate(RuleGroups ruleGroups,
                                  CandidateSource candidates,
                                  EvaluationContext context,
                                  SortSpec sortSpec,
                                  ListLimits limits,
                                  ProgressSink progress,
                                  CancellationSignal cancellation) throws EvaluationRunException;

    /**
     * Evaluates a compiled definition; the context is derived from the definition
     * and completed by the given builder (clock, seed).
     */
    default ListEvaluationResult evaluate(CompiledListDefinition definition,
                                          CandidateSource candidates,
                                          EvaluationContext.Builder context) throws EvaluationRunException {
        return evaluate(definition.ruleGroups(), candidates, definition.toContext(context),
                definition.sortSpec(), definition.limits());
    }
}
