package com.smartlists.ruleengine.runtime.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A rule's target value, parsed once at compile time into the shape its operator needs.
 *
 * <p>Evaluation never re-parses strings: a numeric comparison receives a
 * {@link Numeric}, a relative date test a {@link Relative}, and so on.
 */
public interface TargetValue {

    /**
     * Single text value, with its case-folded form precomputed.
     */
    record Text(String raw, String folded) implements TargetValue {
        public static Text of(String raw) {
            return new Text(raw, raw.toLowerCase(Locale.ROOT));
        }
    }

    /**
     * Semicolon separated set of case-folded values (IsIn / IsNotIn).
     */
    record Terms(List<String> folded) implements TargetValue {
        public Terms {
            folded = List.copyOf(folded);
        }
    }

    record Numeric(double value) implements TargetValue {}

    /**
     * Absolute calendar day, compared in UTC.
     */
    record Date(LocalDate day) implements TargetValue {}

    /**
     * Relative age such as {@code 7:days}, measured back from the evaluation clock.
     */
    record Relative(long amount, ChronoUnit unit) implements TargetValue {
        public Relative {
            Objects.requireNonNull(unit, "unit must not be null");
        }
    }

    record Weekday(DayOfWeek day) implements TargetValue {}

    record Bool(boolean value) implements TargetValue {}

    /**
     * Pre-compiled pattern; matched with a per-match timeout.
     */
    record Regex(Pattern pattern) implements TargetValue {}

    /**
     * Location of a fetched external list.
     */
    record ExternalList(String url) implements TargetValue {}
}
