package com.smartlists.ruleengine.runtime.model;

import java.util.List;

/**
 * Top-level OR of expression sets. An item matches iff it matches at least one set;
 * with zero sets nothing matches. Set order is significant for rule block ordering
 * and per-group limits.
 */
public record RuleGroups(List<ExpressionSet> sets) {

    public RuleGroups {
        sets = sets != null ? List.copyOf(sets) : List.of();
    }

    public static RuleGroups of(ExpressionSet... sets) {
        return new RuleGroups(List.of(sets));
    }

    public static RuleGroups empty() {
        return new RuleGroups(List.of());
    }

    public int size() {
        return sets.size();
    }

    public ExpressionSet get(int index) {
        return sets.get(index);
    }

    public int extractionMask() {
        int mask = ExtractionGroup.NONE;
        for (ExpressionSet set : sets) {
            mask |= set.extractionMask();
        }
        return mask;
    }

    /**
     * Whether any rule needs an expensive lookup, which enables two-phase filtering.
     */
    public boolean usesExpensiveFields() {
        return ExtractionGroup.isExpensive(extractionMask());
    }

    public boolean anyGroupLimited() {
        for (ExpressionSet set : sets) {
            if (set.hasLimit()) {
                return true;
            }
        }
        return false;
    }

    public List<CompiledExpression> allExpressions() {
        return sets.stream().flatMap(s -> s.expressions().stream()).toList();
    }
}
