package com.smartlists.ruleengine.runtime.similarity;

import com.smartlists.ruleengine.api.CatalogLookups;
import com.smartlists.ruleengine.api.model.MediaItem;
import com.smartlists.ruleengine.api.model.PersonCredit;
import com.smartlists.ruleengine.cache.EvaluationCache;
import com.smartlists.ruleengine.compiler.RuleCompiler;
import com.smartlists.ruleengine.runtime.model.CompiledExpression;
import com.smartlists.ruleengine.runtime.model.SimilarityField;
import com.smartlists.ruleengine.runtime.operators.OperatorEvaluator;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SimilarityScorerTest {

    @Mock
    private CatalogLookups lookups;

    private final RuleCompiler compiler = new RuleCompiler(OpenTelemetry.noop().getTracer("test"));
    private final OperatorEvaluator operators = new OperatorEvaluator(Instant.parse("2025-01-01T00:00:00Z"), 100);

    private CompiledExpression similarTo(String operator, String value) {
        return compiler.compileJson("""
                {"expression_sets": [{"expressions": [{"field": "SimilarTo", "operator": "%s", "value": "%s"}]}]}
                """.formatted(operator, value)).ruleGroups().get(0).expressions().get(0);
    }

    private SimilarityScorer scorer(List<SimilarityField> fields, CompiledExpression... rules) {
        return new SimilarityScorer(new EvaluationCache(lookups), fields, operators, List.of(rules));
    }

    private static MediaItem item(String id, String name, List<String> genres, List<String> tags, Integer year) {
        return MediaItem.builder(id).name(name).itemType("Movie").genres(genres).tags(tags).productionYear(year)
                .build();
    }

    @Test
    @DisplayName("Should count shared values across fields, ignoring case")
    void shouldCountSharedValues() {
        CompiledExpression rule = similarTo("Equal", "Alien");
        SimilarityScorer scorer = scorer(SimilarityField.DEFAULTS, rule);
        scorer.offerReference(item("ref", "Alien", List.of("Horror", "Sci-Fi"), List.of("space"), 1979));

        MediaItem close = item("a", "Aliens", List.of("sci-fi", "horror"), List.of("Space"), 1986);
        MediaItem far = item("b", "Heat", List.of("Crime"), List.of(), 1995);

        assertThat(scorer.referenceCount()).isEqualTo(1);
        assertThat(scorer.score(close)).isEqualTo(3.0);
        assertThat(scorer.matches(rule, close)).isTrue();
        assertThat(scorer.score(far)).isEqualTo(0.0);
        assertThat(scorer.matches(rule, far)).isFalse();
    }

    @Test
    @DisplayName("Should never match a reference against its own rule")
    void shouldExcludeReferences() {
        CompiledExpression rule = similarTo("Contains", "alien");
        SimilarityScorer scorer = scorer(SimilarityField.DEFAULTS, rule);
        MediaItem alien = item("r1", "Alien", List.of("Horror"), List.of(), null);
        MediaItem aliens = item("r2", "Aliens", List.of("Horror"), List.of(), null);
        scorer.offerReference(alien);
        scorer.offerReference(aliens);

        assertThat(scorer.referenceCount()).isEqualTo(2);
        assertThat(scorer.matches(rule, alien)).isFalse();
        assertThat(scorer.matches(rule, aliens)).isFalse();
    }

    @Test
    @DisplayName("Should count production years within the window as shared")
    void shouldCompareYearsWithinWindow() {
        CompiledExpression rule = similarTo("Equal", "Ref");
        SimilarityScorer scorer = scorer(List.of(SimilarityField.PRODUCTION_YEAR), rule);
        scorer.offerReference(item("ref", "Ref", List.of(), List.of(), 2000));

        assertThat(scorer.score(item("a", "A", List.of(), List.of(), 2002))).isEqualTo(1.0);
        assertThat(scorer.score(item("b", "B", List.of(), List.of(), 2003))).isEqualTo(0.0);
        assertThat(scorer.score(item("c", "C", List.of(), List.of(), null))).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should compare people through the lookup cache")
    void shouldComparePeople() {
        when(lookups.people("ref")).thenReturn(List.of(new PersonCredit("Ridley Scott", "Director", null)));
        when(lookups.people("a")).thenReturn(List.of(new PersonCredit("ridley scott", "Director", null)));
        when(lookups.people("b")).thenReturn(List.of(new PersonCredit("Ridley Scott", "Actor", "Cameo")));
        CompiledExpression rule = similarTo("Equal", "Alien");
        SimilarityScorer scorer = scorer(List.of(SimilarityField.DIRECTORS), rule);
        scorer.offerReference(item("ref", "Alien", List.of(), List.of(), null));

        assertThat(scorer.matches(rule, item("a", "Gladiator", List.of(), List.of(), null))).isTrue();
        assertThat(scorer.matches(rule, item("b", "Other", List.of(), List.of(), null))).isFalse();
    }

    @Test
    @DisplayName("Should score null without references")
    void shouldScoreNullWithoutReferences() {
        SimilarityScorer scorer = scorer(SimilarityField.DEFAULTS, similarTo("Equal", "Nothing"));
        scorer.offerReference(item("x", "Something", List.of("Drama"), List.of(), null));

        assertThat(scorer.referenceCount()).isZero();
        assertThat(scorer.score(item("y", "Y", List.of("Drama"), List.of(), null))).isNull();
    }
}
