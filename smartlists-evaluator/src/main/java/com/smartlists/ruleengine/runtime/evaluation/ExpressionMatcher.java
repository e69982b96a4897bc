package com.smartlists.ruleengine.runtime.evaluation;

import com.smartlists.ruleengine.api.model.MediaItem;
import com.smartlists.ruleengine.runtime.external.ExternalListIndex;
import com.smartlists.ruleengine.runtime.extraction.FieldExtractor;
import com.smartlists.ruleengine.runtime.model.CompiledExpression;
import com.smartlists.ruleengine.runtime.model.ExpressionSet;
import com.smartlists.ruleengine.runtime.model.FieldValueType;
import com.smartlists.ruleengine.runtime.model.Operator;
import com.smartlists.ruleengine.runtime.model.TargetValue;
import com.smartlists.ruleengine.runtime.operators.OperatorEvaluator;
import com.smartlists.ruleengine.runtime.similarity.SimilarityScorer;

import java.util.Objects;

/**
 * Decides single rules and whole expression sets for one item.
 *
 * <p>Any failure while deciding a rule (host lookup, regex timeout, unexpected value)
 * is rethrown as an {@link ItemEvaluationException} carrying the item id.
 */
public final class ExpressionMatcher {

    private final FieldExtractor extractor;
    private final OperatorEvaluator operators;
    private final SimilarityScorer similarity;
    private final ExternalListIndex externalLists;

    public ExpressionMatcher(FieldExtractor extractor, OperatorEvaluator operators,
                             SimilarityScorer similarity, ExternalListIndex externalLists) {
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.operators = Objects.requireNonNull(operators, "operators must not be null");
        this.similarity = similarity;
        this.externalLists = externalLists;
    }

    /**
     * AND of the selected rules of a set.
     *
     * @param phase which rules to evaluate
     */
    public boolean matchesSet(ExpressionSet set, MediaItem item, Phase phase) {
        for (CompiledExpression expression : set.expressions()) {
            if (phase.includes(expression) && !matches(expression, item)) {
                return false;
            }
        }
        return true;
    }

    public boolean matches(CompiledExpression expression, MediaItem item) {
        try {
            if (expression.field().valueType() == FieldValueType.SIMILARITY) {
                return similarity != null && similarity.matches(expression, item);
            }
            if (expression.target() instanceof TargetValue.ExternalList) {
                return matchesExternalList(expression, item);
            }
            return operators.evaluate(expression, extractor.extract(expression, item));
        } catch (ItemEvaluationException e) {
            throw e.getItemId() != null ? e : new ItemEvaluationException(item.id(), e.getMessage(), e.getCause());
        } catch (RuntimeException e) {
            throw new ItemEvaluationException(item.id(),
                    "Rule " + expression + " failed for item " + item.id() + ": " + e.getMessage(), e);
        }
    }

    private boolean matchesExternalList(CompiledExpression expression, MediaItem item) {
        String url = ((TargetValue.ExternalList) expression.target()).url();
        boolean listed = externalLists != null && externalLists.position(item, url) != null;
        return expression.operator() == Operator.NOT_EQUAL ? !listed : listed;
    }

    /**
     * Rule subsets evaluated in each filtering pass.
     */
    public enum Phase {
        CHEAP,
        EXPENSIVE,
        ALL;

        boolean includes(CompiledExpression expression) {
            switch (this) {
                case CHEAP:
                    return !expression.isExpensive();
                case EXPENSIVE:
                    return expression.isExpensive();
                default:
                    return true;
            }
        }
    }
}
