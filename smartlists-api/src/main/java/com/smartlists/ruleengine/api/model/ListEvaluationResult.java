package com.smartlists.ruleengine.api.model;

import java.util.List;

/**
 * Ordered, bounded output of a successful run.
 *
 * @param items             final list in output order
 * @param perItemErrorCount items dropped because their evaluation failed
 * @param stats             run counters
 */
public record ListEvaluationResult(
        List<ResultItem> items,
        int perItemErrorCount,
        EvaluationStats stats
) {

    public ListEvaluationResult {
        items = List.copyOf(items);
    }

    public List<String> itemIds() {
        return items.stream().map(ResultItem::itemId).toList();
    }

    public int size() {
        return items.size();
    }

    public boolean hasItemErrors() {
        return perItemErrorCount > 0;
    }
}
