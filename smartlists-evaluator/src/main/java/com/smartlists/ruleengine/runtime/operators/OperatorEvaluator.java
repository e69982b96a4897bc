package com.smartlists.ruleengine.runtime.operators;

import com.smartlists.ruleengine.runtime.model.CompiledExpression;
import com.smartlists.ruleengine.runtime.model.FieldValueType;
import com.smartlists.ruleengine.runtime.model.Operator;
import com.smartlists.ruleengine.runtime.model.TargetValue;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;

/**
 * Applies an operator to an extracted value.
 *
 * <p>Dispatch is a switch over {@link FieldValueType}; extracted values arrive in the
 * shape their type prescribes:
 * <ul>
 *   <li>TEXT, SIMPLE, USER_DATA: {@link String} (null when absent)</li>
 *   <li>LIST: {@code List<String>}</li>
 *   <li>NUMERIC, RESOLUTION, FRAMERATE: {@link Number}</li>
 *   <li>DATE: {@link Instant}</li>
 *   <li>BOOLEAN: {@link Boolean}</li>
 * </ul>
 *
 * <p>Negative operators are the complement of their positive counterpart, which is
 * what gives lists their "no element matches" semantics.
 */
public final class OperatorEvaluator {

    static final double FRAMERATE_TOLERANCE = 0.01;

    private final Instant now;
    private final long regexTimeoutMillis;

    public OperatorEvaluator(Instant now, long regexTimeoutMillis) {
        this.now = now;
        this.regexTimeoutMillis = regexTimeoutMillis;
    }

    public boolean evaluate(CompiledExpression expression, Object value) {
        Operator operator = expression.operator();
        TargetValue target = expression.target();
        FieldValueType type = expression.field().valueType();

        switch (type) {
            case TEXT:
            case SIMPLE:
            case USER_DATA:
            case SIMILARITY:
                return evaluateText(operator, target, (String) value);
            case LIST:
                return evaluateList(operator, target, asList(value));
            case NUMERIC:
            case RESOLUTION:
                return evaluateNumeric(operator, target, (Number) value, 0.0);
            case FRAMERATE:
                return evaluateNumeric(operator, target, (Number) value, FRAMERATE_TOLERANCE);
            case DATE:
                return evaluateDate(operator, target, (Instant) value);
            case BOOLEAN:
                return evaluateBoolean(operator, target, (Boolean) value);
            default:
                throw new IllegalStateException("Unhandled value type: " + type);
        }
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // TEXT AND LISTS
    // ════════════════════════════════════════════════════════════════════════════════

    /**
     * Single-value text test. A missing value reads as the empty string.
     */
    public boolean evaluateText(Operator operator, TargetValue target, String value) {
        boolean positive = textMatches(operator.positive(), target, value != null ? value : "");
        return operator.isNegated() != positive;
    }

    private boolean evaluateList(Operator operator, TargetValue target, List<String> values) {
        Operator positive = operator.positive();
        boolean any = false;
        for (String element : values) {
            if (element != null && textMatches(positive, target, element)) {
                any = true;
                break;
            }
        }
        return operator.isNegated() != any;
    }

    private boolean textMatches(Operator positive, TargetValue target, String value) {
        switch (positive) {
            case EQUAL:
                return value.toLowerCase(Locale.ROOT).equals(((TargetValue.Text) target).folded());
            case CONTAINS:
                return value.toLowerCase(Locale.ROOT).contains(((TargetValue.Text) target).folded());
            case IS_IN:
                return ((TargetValue.Terms) target).folded().contains(value.trim().toLowerCase(Locale.ROOT));
            case MATCH_REGEX:
                return BoundedRegex.find(((TargetValue.Regex) target).pattern(), value, regexTimeoutMillis);
            default:
                throw new IllegalStateException("Operator " + positive + " does not apply to text");
        }
    }

    @SuppressWarnings("unchecked")
    private static List<String> asList(Object value) {
        return value != null ? (List<String>) value : List.of();
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // NUMBERS, DATES, BOOLEANS
    // ════════════════════════════════════════════════════════════════════════════════

    /**
     * A missing number satisfies no comparison, NotEqual included.
     */
    private static boolean evaluateNumeric(Operator operator, TargetValue target, Number value, double tolerance) {
        if (value == null) {
            return false;
        }
        double actual = value.doubleValue();
        double wanted = ((TargetValue.Numeric) target).value();
        if (Double.isNaN(actual)) {
            return false;
        }
        switch (operator) {
            case EQUAL:
                return tolerance > 0 ? Math.abs(actual - wanted) <= tolerance : Double.compare(actual, wanted) == 0;
            case NOT_EQUAL:
                return tolerance > 0 ? Math.abs(actual - wanted) > tolerance : Double.compare(actual, wanted) != 0;
            case GREATER_THAN:
                return Double.compare(actual, wanted) > 0;
            case LESS_THAN:
                return Double.compare(actual, wanted) < 0;
            case GREATER_THAN_OR_EQUAL:
                return Double.compare(actual, wanted) >= 0;
            case LESS_THAN_OR_EQUAL:
                return Double.compare(actual, wanted) <= 0;
            default:
                throw new IllegalStateException("Operator " + operator + " does not apply to numbers");
        }
    }

    private boolean evaluateDate(Operator operator, TargetValue target, Instant value) {
        if (value == null) {
            return false;
        }
        switch (operator) {
            case EQUAL:
                return utcDay(value).equals(((TargetValue.Date) target).day());
            case NOT_EQUAL:
                return !utcDay(value).equals(((TargetValue.Date) target).day());
            case AFTER:
                return utcDay(value).isAfter(((TargetValue.Date) target).day());
            case BEFORE:
                return utcDay(value).isBefore(((TargetValue.Date) target).day());
            case NEWER_THAN:
                return value.isAfter(threshold((TargetValue.Relative) target));
            case OLDER_THAN:
                return value.isBefore(threshold((TargetValue.Relative) target));
            case WEEKDAY:
                return utcDay(value).getDayOfWeek() == ((TargetValue.Weekday) target).day();
            default:
                throw new IllegalStateException("Operator " + operator + " does not apply to dates");
        }
    }

    private Instant threshold(TargetValue.Relative relative) {
        // Months and years are calendar units, so go through a zoned date-time.
        return ZonedDateTime.ofInstant(now, ZoneOffset.UTC).minus(relative.amount(), relative.unit()).toInstant();
    }

    private static LocalDate utcDay(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC).toLocalDate();
    }

    private static boolean evaluateBoolean(Operator operator, TargetValue target, Boolean value) {
        boolean actual = value != null && value;
        boolean wanted = ((TargetValue.Bool) target).value();
        return operator == Operator.NOT_EQUAL ? actual != wanted : actual == wanted;
    }
}
