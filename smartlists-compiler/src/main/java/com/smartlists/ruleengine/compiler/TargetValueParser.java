package com.smartlists.ruleengine.compiler;

import com.smartlists.ruleengine.api.exceptions.RuleDefinitionException;
import com.smartlists.ruleengine.api.model.PlaybackStatus;
import com.smartlists.ruleengine.registry.ResolutionTypes;
import com.smartlists.ruleengine.runtime.model.FieldMetadata;
import com.smartlists.ruleengine.runtime.model.Operator;
import com.smartlists.ruleengine.runtime.model.TargetValue;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Parses rule target strings into {@link TargetValue}s.
 *
 * <p>Every malformed target is rejected here so that evaluation never has to coerce
 * a value or silently treat a bad target as "no match".
 */
final class TargetValueParser {

    private static final Pattern RELATIVE = Pattern.compile("^\\s*(\\d+)\\s*(?:[:\\s]\\s*([A-Za-z]+))?\\s*$");

    private TargetValueParser() {
    }

    static TargetValue parse(FieldMetadata field, Operator operator, String raw, String location) {
        if (raw == null) {
            throw new RuleDefinitionException("Rule at " + location + " (" + field.name() + ") has no value");
        }

        if (operator == Operator.MATCH_REGEX) {
            return regex(raw, location);
        }
        if ("ExternalList".equalsIgnoreCase(field.name())) {
            if (raw.isBlank()) {
                throw new RuleDefinitionException("Rule at " + location + " requires an external list URL");
            }
            return new TargetValue.ExternalList(raw.trim());
        }
        if (operator.isMultiValue()) {
            return terms(raw, location);
        }

        switch (field.valueType()) {
            case NUMERIC:
            case FRAMERATE:
                return new TargetValue.Numeric(number(raw, field, location));
            case RESOLUTION:
                return resolution(raw, location);
            case DATE:
                return date(operator, raw, location);
            case BOOLEAN:
                return bool(raw, location);
            case USER_DATA:
                if (PlaybackStatus.fromString(raw) == null) {
                    throw new RuleDefinitionException("Rule at " + location + " has unknown playback status: " + raw
                            + " (expected Played, Unplayed or InProgress)");
                }
                return TargetValue.Text.of(PlaybackStatus.fromString(raw).id());
            default:
                return TargetValue.Text.of(raw.trim());
        }
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // SHAPES
    // ════════════════════════════════════════════════════════════════════════════════

    private static TargetValue regex(String raw, String location) {
        if (raw.length() > InputLimits.MAX_REGEX_PATTERN_LENGTH) {
            throw new RuleDefinitionException("Rule at " + location + " has a regex pattern longer than "
                    + InputLimits.MAX_REGEX_PATTERN_LENGTH + " characters");
        }
        try {
            return new TargetValue.Regex(Pattern.compile(raw));
        } catch (PatternSyntaxException e) {
            throw new RuleDefinitionException("Rule at " + location + " has invalid regex pattern: "
                    + e.getDescription(), e);
        }
    }

    private static TargetValue terms(String raw, String location) {
        List<String> terms = splitTerms(raw);
        if (terms.isEmpty()) {
            throw new RuleDefinitionException("Rule at " + location + " needs at least one value separated by ';'");
        }
        return new TargetValue.Terms(terms);
    }

    /**
     * Splits a semicolon delimited target, trimming and dropping blank parts.
     */
    static List<String> splitTerms(String raw) {
        List<String> terms = new ArrayList<>();
        for (String part : raw.split(";")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                terms.add(trimmed.toLowerCase(Locale.ROOT));
            }
        }
        return terms;
    }

    private static double number(String raw, FieldMetadata field, String location) {
        try {
            double value = Double.parseDouble(raw.trim());
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new NumberFormatException("not finite");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new RuleDefinitionException("Rule at " + location + " requires a numeric value for "
                    + field.name() + ", got: '" + raw + "'", e);
        }
    }

    private static TargetValue resolution(String raw, String location) {
        OptionalInt height = ResolutionTypes.heightOf(raw);
        if (height.isEmpty()) {
            throw new RuleDefinitionException("Rule at " + location + " has unknown resolution: " + raw);
        }
        return new TargetValue.Numeric(height.getAsInt());
    }

    private static TargetValue bool(String raw, String location) {
        String value = raw.trim();
        if (value.equalsIgnoreCase("true")) return new TargetValue.Bool(true);
        if (value.equalsIgnoreCase("false")) return new TargetValue.Bool(false);
        throw new RuleDefinitionException("Rule at " + location + " requires true or false, got: '" + raw + "'");
    }

    private static TargetValue date(Operator operator, String raw, String location) {
        switch (operator) {
            case NEWER_THAN:
            case OLDER_THAN:
                return relative(raw, location);
            case WEEKDAY:
                return new TargetValue.Weekday(weekday(raw, location));
            default:
                return new TargetValue.Date(absoluteDay(raw, location));
        }
    }

    static TargetValue.Relative relative(String raw, String location) {
        Matcher m = RELATIVE.matcher(raw);
        if (!m.matches()) {
            throw new RuleDefinitionException("Rule at " + location
                    + " requires a relative age like '7:days', got: '" + raw + "'");
        }
        long amount;
        try {
            amount = Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            throw new RuleDefinitionException("Rule at " + location + " has an out of range amount: " + raw, e);
        }
        String unit = m.group(2) == null ? "days" : m.group(2).toLowerCase(Locale.ROOT);
        if (unit.endsWith("s")) {
            unit = unit.substring(0, unit.length() - 1);
        }
        ChronoUnit chronoUnit;
        switch (unit) {
            case "hour":
                chronoUnit = ChronoUnit.HOURS;
                break;
            case "day":
                chronoUnit = ChronoUnit.DAYS;
                break;
            case "week":
                chronoUnit = ChronoUnit.WEEKS;
                break;
            case "month":
                chronoUnit = ChronoUnit.MONTHS;
                break;
            case "year":
                chronoUnit = ChronoUnit.YEARS;
                break;
            default:
                throw new RuleDefinitionException("Rule at " + location + " has unknown time unit: " + m.group(2));
        }
        checkReachable(amount, chronoUnit, raw, location);
        return new TargetValue.Relative(amount, chronoUnit);
    }

    /**
     * Rejects ages whose threshold falls outside the supported date range. Any evaluation
     * clock is later than the epoch, so an age that is reachable from the epoch is reachable
     * from every clock.
     */
    private static void checkReachable(long amount, ChronoUnit unit, String raw, String location) {
        try {
            ZonedDateTime.ofInstant(Instant.EPOCH, ZoneOffset.UTC).minus(amount, unit);
        } catch (DateTimeException | ArithmeticException e) {
            throw new RuleDefinitionException("Rule at " + location + " has an out of range amount: " + raw, e);
        }
    }

    static DayOfWeek weekday(String raw, String location) {
        String value = raw.trim();
        try {
            int index = Integer.parseInt(value);
            if (index >= 0 && index <= 6) {
                // 0 is Sunday
                return index == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(index);
            }
        } catch (NumberFormatException e) {
            for (DayOfWeek day : DayOfWeek.values()) {
                if (day.getDisplayName(TextStyle.FULL, Locale.ENGLISH).equalsIgnoreCase(value)
                        || day.getDisplayName(TextStyle.SHORT, Locale.ENGLISH).equalsIgnoreCase(value)) {
                    return day;
                }
            }
        }
        throw new RuleDefinitionException("Rule at " + location + " has unknown weekday: '" + raw + "'");
    }

    static LocalDate absoluteDay(String raw, String location) {
        String value = raw.trim();
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException ignored) {
            // fall through to date-time forms
        }
        try {
            return OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDate();
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return LocalDateTime.parse(value).toLocalDate();
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return Instant.parse(value).atOffset(ZoneOffset.UTC).toLocalDate();
        } catch (DateTimeParseException e) {
            throw new RuleDefinitionException("Rule at " + location
                    + " requires a date like 2024-01-31, got: '" + raw + "'", e);
        }
    }
}
