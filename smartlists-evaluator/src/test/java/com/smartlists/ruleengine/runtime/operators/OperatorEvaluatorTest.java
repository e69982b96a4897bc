package com.smartlists.ruleengine.runtime.operators;

import com.smartlists.ruleengine.compiler.RuleCompiler;
import com.smartlists.ruleengine.runtime.model.CompiledExpression;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OperatorEvaluator")
class OperatorEvaluatorTest {

    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

    private final RuleCompiler compiler = new RuleCompiler(OpenTelemetry.noop().getTracer("test"));
    private final OperatorEvaluator operators = new OperatorEvaluator(NOW, 100);

    private CompiledExpression rule(String field, String operator, String value) {
        String json = """
                {"expression_sets": [{"expressions": [{"field": "%s", "operator": "%s", "value": "%s"}]}]}
                """.formatted(field, operator, value.replace("\\", "\\\\"));
        return compiler.compileJson(json).ruleGroups().get(0).expressions().get(0);
    }

    @Nested
    @DisplayName("Text")
    class Text {

        @Test
        void equalIgnoresCase() {
            assertThat(operators.evaluate(rule("Name", "Equal", "the matrix"), "The Matrix")).isTrue();
            assertThat(operators.evaluate(rule("Name", "Equal", "Matrix"), "The Matrix")).isFalse();
        }

        @Test
        void containsIgnoresCase() {
            assertThat(operators.evaluate(rule("Name", "Contains", "MATRIX"), "The Matrix")).isTrue();
            assertThat(operators.evaluate(rule("Name", "NotContains", "MATRIX"), "The Matrix")).isFalse();
        }

        @Test
        void isInMatchesAnyTerm() {
            CompiledExpression expr = rule("OfficialRating", "IsIn", "PG; PG-13 ;R");
            assertThat(operators.evaluate(expr, "pg-13")).isTrue();
            assertThat(operators.evaluate(expr, "PG-1")).isFalse();
        }

        @Test
        void regexUsesFindSemantics() {
            assertThat(operators.evaluate(rule("Name", "MatchRegex", "Matr"), "The Matrix")).isTrue();
            assertThat(operators.evaluate(rule("Name", "MatchRegex", "^Matr"), "The Matrix")).isFalse();
        }

        @Test
        @DisplayName("A missing value reads as the empty string")
        void missingTextIsEmpty() {
            assertThat(operators.evaluate(rule("Overview", "Contains", "space"), null)).isFalse();
            assertThat(operators.evaluate(rule("Overview", "NotContains", "space"), null)).isTrue();
            assertThat(operators.evaluate(rule("Overview", "MatchRegex", "^$"), null)).isTrue();
        }
    }

    @Nested
    @DisplayName("Lists")
    class Lists {

        @Test
        @DisplayName("Positive operators need one matching element")
        void anyElement() {
            assertThat(operators.evaluate(rule("Genres", "Contains", "act"), List.of("Drama", "Action"))).isTrue();
            assertThat(operators.evaluate(rule("Genres", "IsIn", "comedy;action"), List.of("Action"))).isTrue();
        }

        @Test
        @DisplayName("Negated operators require that no element matches")
        void noElement() {
            CompiledExpression notIn = rule("Genres", "IsNotIn", "Horror;Thriller");
            assertThat(operators.evaluate(notIn, List.of("Drama", "Comedy"))).isTrue();
            assertThat(operators.evaluate(notIn, List.of("Drama", "Horror"))).isFalse();
            assertThat(operators.evaluate(notIn, List.of())).isTrue();
        }

        @Test
        void emptyListMatchesNoPositiveOperator() {
            assertThat(operators.evaluate(rule("Tags", "Contains", "x"), List.of())).isFalse();
            assertThat(operators.evaluate(rule("Tags", "MatchRegex", ".*"), null)).isFalse();
        }
    }

    @Nested
    @DisplayName("Numbers")
    class Numbers {

        @Test
        void comparisons() {
            assertThat(operators.evaluate(rule("ProductionYear", "GreaterThan", "1999"), 2000.0)).isTrue();
            assertThat(operators.evaluate(rule("ProductionYear", "LessThanOrEqual", "1999"), 1999.0)).isTrue();
            assertThat(operators.evaluate(rule("CommunityRating", "Equal", "7.5"), 7.5)).isTrue();
            assertThat(operators.evaluate(rule("CommunityRating", "NotEqual", "7.5"), 7.4)).isTrue();
        }

        @Test
        @DisplayName("A missing number fails every operator, NotEqual included")
        void missingNumber() {
            assertThat(operators.evaluate(rule("CommunityRating", "NotEqual", "5"), null)).isFalse();
            assertThat(operators.evaluate(rule("CommunityRating", "LessThan", "5"), null)).isFalse();
        }

        @Test
        void framerateUsesTolerance() {
            CompiledExpression expr = rule("Framerate", "Equal", "23.976");
            assertThat(operators.evaluate(expr, 23.98)).isTrue();
            assertThat(operators.evaluate(expr, 24.0)).isFalse();
        }

        @Test
        void resolutionComparesHeights() {
            CompiledExpression expr = rule("Resolution", "GreaterThanOrEqual", "1080p");
            assertThat(operators.evaluate(expr, 2160)).isTrue();
            assertThat(operators.evaluate(expr, 720)).isFalse();
        }
    }

    @Nested
    @DisplayName("Dates")
    class Dates {

        @Test
        @DisplayName("Absolute comparisons work on the UTC calendar day")
        void absoluteDay() {
            Instant lateEvening = Instant.parse("2024-03-10T23:30:00Z");
            assertThat(operators.evaluate(rule("ReleaseDate", "Equal", "2024-03-10"), lateEvening)).isTrue();
            assertThat(operators.evaluate(rule("ReleaseDate", "After", "2024-03-09"), lateEvening)).isTrue();
            assertThat(operators.evaluate(rule("ReleaseDate", "Before", "2024-03-10"), lateEvening)).isFalse();
        }

        @Test
        @DisplayName("Relative ages are measured back from the evaluation clock")
        void relative() {
            CompiledExpression newer = rule("DateCreated", "NewerThan", "7:days");
            assertThat(operators.evaluate(newer, NOW.minusSeconds(6 * 86_400))).isTrue();
            assertThat(operators.evaluate(newer, NOW.minusSeconds(8 * 86_400))).isFalse();

            CompiledExpression older = rule("DateCreated", "OlderThan", "1:month");
            assertThat(operators.evaluate(older, Instant.parse("2025-05-14T12:00:00Z"))).isTrue();
            assertThat(operators.evaluate(older, Instant.parse("2025-05-16T12:00:00Z"))).isFalse();
        }

        @Test
        @DisplayName("Weekday 0 is Sunday")
        void weekday() {
            // 2025-06-15 is a Sunday
            assertThat(operators.evaluate(rule("ReleaseDate", "Weekday", "0"), NOW)).isTrue();
            assertThat(operators.evaluate(rule("ReleaseDate", "Weekday", "Monday"), NOW)).isFalse();
        }

        @Test
        void missingDateFailsEveryOperator() {
            assertThat(operators.evaluate(rule("ReleaseDate", "NotEqual", "2024-01-01"), null)).isFalse();
            assertThat(operators.evaluate(rule("ReleaseDate", "OlderThan", "30"), null)).isFalse();
        }
    }

    @Nested
    @DisplayName("Booleans")
    class Booleans {

        @Test
        void missingBooleanReadsAsFalse() {
            assertThat(operators.evaluate(rule("IsFavorite", "Equal", "false"), null)).isTrue();
            assertThat(operators.evaluate(rule("IsFavorite", "NotEqual", "true"), false)).isTrue();
            assertThat(operators.evaluate(rule("IsFavorite", "Equal", "true"), true)).isTrue();
        }
    }

    @Test
    @DisplayName("A runaway regex raises a timeout instead of hanging")
    void regexTimeout() {
        OperatorEvaluator strict = new OperatorEvaluator(NOW, 20);
        CompiledExpression expr = rule("Name", "MatchRegex", "a*a*a*a*a*b");

        assertThatThrownBy(() -> strict.evaluate(expr, "a".repeat(3000)))
                .isInstanceOf(BoundedRegex.RegexTimeoutException.class);
    }
}
