package com.smartlists.ruleengine.runtime.model;

import java.util.Locale;

/**
 * Comparison operators understood by the engine.
 *
 * <p>Each operator carries the identifier used in list definitions
 * ({@code "Equal"}, {@code "IsIn"}, ...) and a lower-case label for messages.
 */
public enum Operator {
    EQUAL("Equal", "equals"),
    NOT_EQUAL("NotEqual", "not equals"),
    CONTAINS("Contains", "contains"),
    NOT_CONTAINS("NotContains", "not contains"),
    IS_IN("IsIn", "is in"),
    IS_NOT_IN("IsNotIn", "is not in"),
    GREATER_THAN("GreaterThan", "greater than"),
    LESS_THAN("LessThan", "less than"),
    GREATER_THAN_OR_EQUAL("GreaterThanOrEqual", "greater than or equal"),
    LESS_THAN_OR_EQUAL("LessThanOrEqual", "less than or equal"),
    MATCH_REGEX("MatchRegex", "matches regex"),
    AFTER("After", "after"),
    BEFORE("Before", "before"),
    NEWER_THAN("NewerThan", "newer than"),
    OLDER_THAN("OlderThan", "older than"),
    WEEKDAY("Weekday", "weekday");

    private final String id;
    private final String label;

    Operator(String id, String label) {
        this.id = id;
        this.label = label;
    }

    public String id() {
        return id;
    }

    public String label() {
        return label;
    }

    /**
     * Safely converts a string to an Operator.
     *
     * <p>Accepts the definition identifier ({@code "NotEqual"}) as well as the
     * constant name ({@code "NOT_EQUAL"}), case-insensitively.
     *
     * @param text the operator string
     * @return the operator, or null if not found
     */
    public static Operator fromString(String text) {
        if (text == null) return null;
        String trimmed = text.trim();
        for (Operator op : values()) {
            if (op.id.equalsIgnoreCase(trimmed)) {
                return op;
            }
        }
        try {
            return Operator.valueOf(trimmed.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null; // Unknown operator
        }
    }

    /**
     * Operators whose target is a semicolon separated list of values.
     */
    public boolean isMultiValue() {
        return this == IS_IN || this == IS_NOT_IN;
    }

    /**
     * Negative operators hold when no element of a list satisfies the positive test.
     */
    public boolean isNegated() {
        return this == NOT_EQUAL || this == NOT_CONTAINS || this == IS_NOT_IN;
    }

    /**
     * The positive counterpart of a negated operator, or this operator itself.
     */
    public Operator positive() {
        switch (this) {
            case NOT_EQUAL:
                return EQUAL;
            case NOT_CONTAINS:
                return CONTAINS;
            case IS_NOT_IN:
                return IS_IN;
            default:
                return this;
        }
    }

    public boolean isRelativeDate() {
        return this == NEWER_THAN || this == OLDER_THAN;
    }
}
