package com.smartlists.ruleengine.runtime.model;

import java.util.Objects;

/**
 * A validated rule: field, operator and parsed target.
 *
 * @param field          registry metadata of the referenced field
 * @param operator       operator, guaranteed to be allowed for the field
 * @param rawTarget      target as written in the definition
 * @param target         parsed target
 * @param options        field-specific options
 * @param extractionMask field group plus bits added by options
 * @param setIndex       index of the owning expression set
 * @param ruleIndex      index inside the owning set
 */
public record CompiledExpression(
        FieldMetadata field,
        Operator operator,
        String rawTarget,
        TargetValue target,
        ExpressionOptions options,
        int extractionMask,
        int setIndex,
        int ruleIndex
) {

    public CompiledExpression {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(target, "target must not be null");
        options = options != null ? options : ExpressionOptions.DEFAULTS;
    }

    public boolean isExpensive() {
        return ExtractionGroup.isExpensive(extractionMask);
    }

    public String fieldName() {
        return field.name();
    }

    /**
     * Location used in diagnostics, one-based like the definition editor shows it.
     */
    public String location() {
        return "set " + (setIndex + 1) + ", rule " + (ruleIndex + 1);
    }

    @Override
    public String toString() {
        return field.name() + " " + operator.label() + " '" + rawTarget + "'";
    }
}
