package com.smartlists.ruleengine.runtime.model;

import java.util.List;

/**
 * Ordered rules combined with AND, plus an optional per-group item limit.
 *
 * <p>An empty set matches every item.
 *
 * @param expressions rules of the group
 * @param maxItems    per-group limit; null or non-positive means unlimited
 */
public record ExpressionSet(List<CompiledExpression> expressions, Integer maxItems) {

    public ExpressionSet {
        expressions = expressions != null ? List.copyOf(expressions) : List.of();
    }

    public static ExpressionSet of(CompiledExpression... expressions) {
        return new ExpressionSet(List.of(expressions), null);
    }

    public boolean isEmpty() {
        return expressions.isEmpty();
    }

    public boolean hasLimit() {
        return maxItems != null && maxItems > 0;
    }

    public boolean hasExpensiveExpressions() {
        for (CompiledExpression expression : expressions) {
            if (expression.isExpensive()) {
                return true;
            }
        }
        return false;
    }

    public int extractionMask() {
        int mask = ExtractionGroup.NONE;
        for (CompiledExpression expression : expressions) {
            mask |= expression.extractionMask();
        }
        return mask;
    }

    public ExpressionSet withMaxItems(Integer limit) {
        return new ExpressionSet(expressions, limit);
    }
}
