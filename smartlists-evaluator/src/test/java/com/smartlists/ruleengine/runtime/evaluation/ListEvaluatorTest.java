package com.smartlists.ruleengine.runtime.evaluation;

import com.smartlists.ruleengine.api.CandidateSource;
import com.smartlists.ruleengine.api.CatalogLookups;
import com.smartlists.ruleengine.api.ExternalListProvider;
import com.smartlists.ruleengine.api.ProgressSink;
import com.smartlists.ruleengine.api.exceptions.EvaluationRunException;
import com.smartlists.ruleengine.api.exceptions.RunCancelledException;
import com.smartlists.ruleengine.api.model.ExternalListResult;
import com.smartlists.ruleengine.api.model.ListEvaluationResult;
import com.smartlists.ruleengine.api.model.ListLimits;
import com.smartlists.ruleengine.api.model.MediaItem;
import com.smartlists.ruleengine.api.model.PersonCredit;
import com.smartlists.ruleengine.api.model.ResultItem;
import com.smartlists.ruleengine.api.model.SeriesInfo;
import com.smartlists.ruleengine.api.model.UserItemData;
import com.smartlists.ruleengine.compiler.RuleCompiler;
import com.smartlists.ruleengine.infra.config.EngineConfig;
import com.smartlists.ruleengine.runtime.model.CompiledListDefinition;
import com.smartlists.ruleengine.runtime.model.EvaluationContext;
import com.smartlists.ruleengine.runtime.model.RuleGroups;
import com.smartlists.ruleengine.runtime.model.SortSpec;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ListEvaluatorTest {

    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");
    private static final UserItemData PLAYED = new UserItemData(false, true, 1, 0L, NOW);

    @Mock
    private CatalogLookups lookups;

    private RuleCompiler compiler;
    private EvaluationContext context;

    @BeforeEach
    void setUp() {
        compiler = new RuleCompiler(OpenTelemetry.noop().getTracer("test"));
        context = EvaluationContext.builder().now(NOW).randomSeed(42L).build();
    }

    private ListEvaluator evaluator(EngineConfig config) {
        return new ListEvaluator(lookups, List.of(), config, OpenTelemetry.noop().getTracer("test"));
    }

    private static EngineConfig sequential() {
        return EngineConfig.builder().workerThreads(1).processingBatchSize(4).build();
    }

    private CompiledListDefinition compile(String json) {
        return compiler.compileJson(json);
    }

    private ListEvaluationResult run(ListEvaluator evaluator, CompiledListDefinition list, List<MediaItem> items,
                                     ListLimits limits) {
        return evaluator.evaluate(list.ruleGroups(), CandidateSource.of(items), context, list.sortSpec(), limits);
    }

    private static MediaItem movie(String id, String name, String... genres) {
        return MediaItem.builder(id).name(name).itemType("Movie").genres(List.of(genres)).build();
    }

    private static MediaItem movie(String id, String name, double runtimeMinutes) {
        return MediaItem.builder(id).name(name).itemType("Movie").runtimeMinutes(runtimeMinutes).build();
    }

    @Nested
    @DisplayName("Example scenarios")
    class Scenarios {

        @Test
        @DisplayName("Genre and playback status narrow ten candidates to five")
        void genreAndPlaybackStatus() {
            List<MediaItem> items = new ArrayList<>();
            for (int i = 0; i < 5; i++) items.add(movie("au" + i, "Action Unplayed " + i, "Action"));
            for (int i = 0; i < 3; i++) items.add(movie("ap" + i, "Action Played " + i, "Action"));
            for (int i = 0; i < 2; i++) items.add(movie("cu" + i, "Comedy Unplayed " + i, "Comedy"));
            when(lookups.userData(anyString(), any())).thenAnswer(inv ->
                    ((String) inv.getArgument(0)).startsWith("ap") ? PLAYED : UserItemData.unplayed());

            CompiledListDefinition list = compile("""
                    {"expression_sets": [{"expressions": [
                        {"field": "Genres", "operator": "Contains", "value": "Action"},
                        {"field": "PlaybackStatus", "operator": "Equal", "value": "Unplayed"}]}]}
                    """);

            ListEvaluationResult result = run(evaluator(sequential()), list, items, ListLimits.unlimited());

            assertThat(result.size()).isEqualTo(5);
            assertThat(result.itemIds()).allMatch(id -> id.startsWith("au"));
            assertThat(result.perItemErrorCount()).isZero();
        }

        @Test
        @DisplayName("Per-group limits keep the first two of each group in rule block order")
        void perGroupLimitsWithRuleBlockOrder() {
            List<MediaItem> items = new ArrayList<>();
            for (char c = 'J'; c >= 'A'; c--) {
                items.add(movie("a" + c, "Action " + c, "Action"));
                items.add(movie("c" + c, "Comedy " + c, "Comedy"));
            }
            CompiledListDefinition list = compile("""
                    {"expression_sets": [
                        {"max_items": 2, "expressions": [{"field": "Genres", "operator": "Contains", "value": "Action"}]},
                        {"max_items": 2, "expressions": [{"field": "Genres", "operator": "Contains", "value": "Comedy"}]}],
                     "order": [{"field": "Rule Block Order"}, {"field": "Name", "direction": "Ascending"}]}
                    """);

            ListEvaluationResult result = run(evaluator(sequential()), list, items, ListLimits.unlimited());

            assertThat(result.itemIds()).containsExactly("aA", "aB", "cA", "cB");
            assertThat(result.items()).extracting(ResultItem::groupIndex).containsExactly(0, 0, 1, 1);
        }

        @Test
        @DisplayName("Case-insensitive regex keeps names starting with 'the'")
        void regexOnName() {
            List<MediaItem> items = List.of(
                    movie("1", "The Matrix"), movie("2", "Matrix Reloaded"), movie("3", "the Hobbit"));
            CompiledListDefinition list = compile("""
                    {"expression_sets": [{"expressions": [
                        {"field": "Name", "operator": "MatchRegex", "value": "(?i)^the"}]}]}
                    """);

            ListEvaluationResult result = run(evaluator(sequential()), list, items, ListLimits.unlimited());

            assertThat(result.items()).extracting(r -> r.item().name()).containsExactly("The Matrix", "the Hobbit");
        }

        @Test
        @DisplayName("Playtime cap stops before the first item that would exceed it")
        void playtimeCap() {
            List<MediaItem> items = List.of(
                    movie("1", "A", 40), movie("2", "B", 30), movie("3", "C", 25), movie("4", "D", 50));
            CompiledListDefinition list = compile("""
                    {"expression_sets": [{"expressions": []}], "order": [{"field": "Name"}]}
                    """);

            ListEvaluationResult result = run(evaluator(sequential()), list, items, new ListLimits(null, null, 90));

            assertThat(result.itemIds()).containsExactly("1", "2");
            assertThat(result.items().stream().mapToDouble(ResultItem::runtimeMinutes).sum()).isLessThanOrEqualTo(90.0);
        }

        @Test
        @DisplayName("IsIn matches any element of a list field")
        void isInOnGenres() {
            List<MediaItem> items = List.of(
                    movie("1", "One", "Drama", "Comedy"), movie("2", "Two", "Drama", "Horror"));
            CompiledListDefinition list = compile("""
                    {"expression_sets": [{"expressions": [
                        {"field": "Genres", "operator": "IsIn", "value": "Action;Comedy"}]}]}
                    """);

            ListEvaluationResult result = run(evaluator(sequential()), list, items, ListLimits.unlimited());

            assertThat(result.itemIds()).containsExactly("1");
        }
    }

    @Nested
    @DisplayName("Boolean structure")
    class Structure {

        @Test
        @DisplayName("An empty expression set matches every candidate")
        void emptySetMatchesAll() {
            List<MediaItem> items = List.of(movie("1", "A"), movie("2", "B"), movie("3", "C"));
            CompiledListDefinition list = compile("""
                    {"expression_sets": [{"expressions": []}]}
                    """);

            assertThat(run(evaluator(sequential()), list, items, ListLimits.unlimited()).size()).isEqualTo(3);
        }

        @Test
        @DisplayName("Zero expression sets match nothing")
        void zeroSetsMatchNothing() {
            ListEvaluationResult result = evaluator(sequential()).evaluate(RuleGroups.empty(),
                    CandidateSource.of(List.of(movie("1", "A"))), context, SortSpec.none(), ListLimits.unlimited());

            assertThat(result.items()).isEmpty();
        }

        @Test
        @DisplayName("Items are attributed to the first set they match")
        void attributesFirstMatchingSet() {
            List<MediaItem> items = List.of(movie("1", "A", "Comedy", "Action"));
            CompiledListDefinition list = compile("""
                    {"expression_sets": [
                        {"expressions": [{"field": "Genres", "operator": "Contains", "value": "Drama"}]},
                        {"expressions": [{"field": "Genres", "operator": "Contains", "value": "Action"}]},
                        {"expressions": [{"field": "Genres", "operator": "Contains", "value": "Comedy"}]}]}
                    """);

            ListEvaluationResult result = run(evaluator(sequential()), list, items, ListLimits.unlimited());

            assertThat(result.items()).extracting(ResultItem::groupIndex).containsExactly(1);
        }

        @Test
        @DisplayName("Media types and extras are filtered before evaluation")
        void mediaTypeAndExtrasFilter() {
            List<MediaItem> items = List.of(
                    movie("1", "Movie"),
                    MediaItem.builder("2").name("Episode").itemType("Episode").build(),
                    MediaItem.builder("3").name("Trailer").itemType("Movie").extraType("Trailer").build());
            CompiledListDefinition list = compile("""
                    {"expression_sets": [{"expressions": []}], "media_types": ["movie"]}
                    """);

            ListEvaluationResult result = evaluator(sequential()).evaluate(list, CandidateSource.of(items),
                    EvaluationContext.builder().now(NOW));

            assertThat(result.itemIds()).containsExactly("1");
            assertThat(result.stats().candidates()).isEqualTo(3);
            assertThat(result.stats().eligible()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Two-phase filtering")
    class TwoPhase {

        private final String definition = """
                {"expression_sets": [
                    {"expressions": [
                        {"field": "Genres", "operator": "Contains", "value": "Action"},
                        {"field": "Actors", "operator": "Contains", "value": "Keanu"}]},
                    {"expressions": [{"field": "ProductionYear", "operator": "LessThan", "value": "1980"}]},
                    {"expressions": [{"field": "Directors", "operator": "IsNotIn", "value": "Nobody"}]}],
                 "order": [{"field": "Name"}]}
                """;

        private List<MediaItem> catalog() {
            List<MediaItem> items = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                items.add(MediaItem.builder("m" + i)
                        .name("Movie " + i)
                        .itemType("Movie")
                        .productionYear(1970 + i)
                        .genres(i % 3 == 0 ? List.of("Action") : List.of("Drama"))
                        .build());
            }
            return items;
        }

        @BeforeEach
        void stubPeople() {
            when(lookups.people(anyString())).thenAnswer(inv -> {
                int n = Integer.parseInt(((String) inv.getArgument(0)).substring(1));
                List<PersonCredit> credits = new ArrayList<>();
                if (n % 2 == 0) credits.add(new PersonCredit("Keanu Reeves", "Actor", "Neo"));
                if (n % 5 == 0) credits.add(new PersonCredit("Nobody", "Director", null));
                return credits;
            });
        }

        @Test
        @DisplayName("Produces the same result as single-phase evaluation")
        void equalsSinglePhase() {
            CompiledListDefinition list = compile(definition);
            EngineConfig twoPhase = EngineConfig.builder().workerThreads(1).processingBatchSize(7).build();
            EngineConfig singlePhase = EngineConfig.builder().workerThreads(1).processingBatchSize(7)
                    .twoPhaseFiltering(false).build();

            ListEvaluationResult a = run(evaluator(twoPhase), list, catalog(), ListLimits.unlimited());
            ListEvaluationResult b = run(evaluator(singlePhase), list, catalog(), ListLimits.unlimited());

            assertThat(a.itemIds()).isEqualTo(b.itemIds());
            assertThat(a.items()).extracting(ResultItem::groupIndex)
                    .containsExactlyElementsOf(b.items().stream().map(ResultItem::groupIndex).toList());
            assertThat(a.stats().twoPhase()).isTrue();
            assertThat(b.stats().twoPhase()).isFalse();
        }

        @Test
        @DisplayName("Parallel workers give the same result as a single worker")
        void parallelEqualsSequential() {
            CompiledListDefinition list = compile(definition);
            EngineConfig parallel = EngineConfig.builder().workerThreads(4).processingBatchSize(16).build();

            ListEvaluationResult a = run(evaluator(parallel), list, catalog(), ListLimits.unlimited());
            ListEvaluationResult b = run(evaluator(sequential()), list, catalog(), ListLimits.unlimited());

            assertThat(a.itemIds()).isEqualTo(b.itemIds());
        }

        @Test
        @DisplayName("Cheap-only rule sets need no people lookup")
        void cheapRulesSkipLookups() {
            CompiledListDefinition list = compile("""
                    {"expression_sets": [{"expressions": [
                        {"field": "Genres", "operator": "Contains", "value": "Action"},
                        {"field": "Actors", "operator": "Contains", "value": "Keanu"}]}]}
                    """);

            ListEvaluationResult result = run(evaluator(sequential()), list, catalog(), ListLimits.unlimited());

            // Only the 14 action movies survive phase 1.
            assertThat(result.stats().phase1Survivors()).isEqualTo(14);
            verify(lookups, never()).people("m1");
            verify(lookups, times(1)).people("m0");
        }
    }

    @Nested
    @DisplayName("Evaluation cache")
    class Memoization {

        @Test
        @DisplayName("A lookup key is computed once however many rules use it")
        void peopleLookedUpOnce() {
            when(lookups.people("m1")).thenReturn(List.of(new PersonCredit("Jane", "Director", null)));
            CompiledListDefinition list = compile("""
                    {"expression_sets": [
                        {"expressions": [{"field": "Actors", "operator": "Contains", "value": "Jane"}]},
                        {"expressions": [{"field": "Writers", "operator": "Contains", "value": "Jane"}]},
                        {"expressions": [{"field": "Directors", "operator": "Contains", "value": "Jane"}]}],
                     "order": [{"field": "Name"}]}
                    """);

            ListEvaluationResult result = run(evaluator(sequential()), list, List.of(movie("m1", "One")),
                    ListLimits.unlimited());

            assertThat(result.itemIds()).containsExactly("m1");
            verify(lookups, times(1)).people("m1");
        }

        @Test
        @DisplayName("Concurrent workers share one series lookup")
        void seriesLookedUpOnceAcrossWorkers() {
            when(lookups.series("s1")).thenReturn(Optional.of(
                    new SeriesInfo("s1", "Lost", List.of(), List.of(), List.of(), null, Map.of())));
            List<MediaItem> episodes = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                episodes.add(MediaItem.builder("e" + i).name("Episode " + i).itemType("Episode").seriesId("s1").build());
            }
            CompiledListDefinition list = compile("""
                    {"expression_sets": [{"expressions": [
                        {"field": "SeriesName", "operator": "Equal", "value": "lost"}]}]}
                    """);
            EngineConfig parallel = EngineConfig.builder().workerThreads(8).processingBatchSize(100).build();

            ListEvaluationResult result = run(evaluator(parallel), list, episodes, ListLimits.unlimited());

            assertThat(result.size()).isEqualTo(200);
            verify(lookups, times(1)).series("s1");
        }
    }

    @Nested
    @DisplayName("Ordering and limits")
    class Ordering {

        @Test
        @DisplayName("Items with equal sort keys keep their input order")
        void stableSort() {
            List<MediaItem> items = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                items.add(MediaItem.builder("m" + i).name("Movie " + i).itemType("Movie")
                        .productionYear(i % 2 == 0 ? 2000 : 1990).build());
            }
            CompiledListDefinition list = compile("""
                    {"expression_sets": [{"expressions": []}], "order": [{"field": "ProductionYear"}]}
                    """);

            ListEvaluationResult result = run(evaluator(sequential()), list, items, ListLimits.unlimited());

            assertThat(result.itemIds()).containsExactly(
                    "m1", "m3", "m5", "m7", "m9", "m11", "m0", "m2", "m4", "m6", "m8", "m10");
        }

        @Test
        @DisplayName("Runs are deterministic for a fixed clock and seed, Random included")
        void deterministic() {
            List<MediaItem> items = new ArrayList<>();
            for (int i = 0; i < 30; i++) items.add(movie("m" + i, "Movie " + i));
            CompiledListDefinition list = compile("""
                    {"expression_sets": [{"expressions": []}], "order": [{"field": "Random"}]}
                    """);

            ListEvaluationResult a = run(evaluator(sequential()), list, items, ListLimits.unlimited());
            ListEvaluationResult b = run(evaluator(sequential()), list, items, ListLimits.unlimited());

            assertThat(a.itemIds()).isEqualTo(b.itemIds());
            assertThat(a.itemIds()).containsExactlyInAnyOrderElementsOf(items.stream().map(MediaItem::id).toList());
        }

        @Test
        @DisplayName("Per-group then global limits never exceed either bound")
        void perGroupThenGlobal() {
            List<MediaItem> items = new ArrayList<>();
            for (int i = 0; i < 20; i++) items.add(movie("m" + i, "Movie " + i, i % 2 == 0 ? "Action" : "Comedy"));
            CompiledListDefinition list = compile("""
                    {"expression_sets": [
                        {"max_items": 4, "expressions": [{"field": "Genres", "operator": "Contains", "value": "Action"}]},
                        {"max_items": 3, "expressions": [{"field": "Genres", "operator": "Contains", "value": "Comedy"}]}],
                     "order": [{"field": "Name"}]}
                    """);

            ListEvaluationResult unbounded = run(evaluator(sequential()), list, items, ListLimits.unlimited());
            ListEvaluationResult bounded = run(evaluator(sequential()), list, items, ListLimits.ofMaxItems(5));

            assertThat(unbounded.size()).isEqualTo(7);
            assertThat(bounded.size()).isEqualTo(5);
        }

        @Test
        @DisplayName("An item taken by an earlier group is not counted again")
        void duplicateGroupsPullFollowingItems() {
            List<MediaItem> items = List.of(movie("1", "A", "Action"), movie("2", "B", "Action"),
                    movie("3", "C", "Action"), movie("4", "D", "Action"));
            CompiledListDefinition list = compile("""
                    {"expression_sets": [
                        {"max_items": 2, "expressions": [{"field": "Genres", "operator": "Contains", "value": "Action"}]},
                        {"max_items": 2, "expressions": [{"field": "Genres", "operator": "Contains", "value": "Action"}]}],
                     "order": [{"field": "Name"}]}
                    """);

            ListEvaluationResult result = run(evaluator(sequential()), list, items, ListLimits.unlimited());

            assertThat(result.itemIds()).containsExactly("1", "2", "3", "4");
            assertThat(result.items()).extracting(ResultItem::groupIndex).containsExactly(0, 0, 1, 1);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("A failing lookup excludes only that item and is counted")
        void perItemFailure() {
            when(lookups.people(anyString())).thenAnswer(inv -> {
                if ("m2".equals(inv.getArgument(0))) {
                    throw new IllegalStateException("metadata store unavailable");
                }
                return List.of(new PersonCredit("Jane", "Actor", null));
            });
            List<MediaItem> items = List.of(movie("m1", "One"), movie("m2", "Two"), movie("m3", "Three"));
            CompiledListDefinition list = compile("""
                    {"expression_sets": [{"expressions": [{"field": "Actors", "operator": "Contains", "value": "jane"}]}]}
                    """);

            ListEvaluationResult result = run(evaluator(sequential()), list, items, ListLimits.unlimited());

            assertThat(result.itemIds()).containsExactlyInAnyOrder("m1", "m3");
            assertThat(result.perItemErrorCount()).isEqualTo(1);
            assertThat(result.hasItemErrors()).isTrue();
        }

        @Test
        @DisplayName("A regex exceeding its time budget is a per-item failure")
        void regexTimeout() {
            List<MediaItem> items = List.of(movie("slow", "a".repeat(3000)), movie("fast", "aab"));
            CompiledListDefinition list = compile("""
                    {"expression_sets": [{"expressions": [{"field": "Name", "operator": "MatchRegex", "value": "a*a*a*a*a*b"}]}]}
                    """);
            EngineConfig config = EngineConfig.builder().workerThreads(1).regexTimeoutMillis(50).build();

            ListEvaluationResult result = run(evaluator(config), list, items, ListLimits.unlimited());

            assertThat(result.itemIds()).containsExactly("fast");
            assertThat(result.perItemErrorCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Cancellation between batches aborts the run")
        void cancellation() {
            List<MediaItem> items = new ArrayList<>();
            for (int i = 0; i < 10; i++) items.add(movie("m" + i, "Movie " + i));
            AtomicInteger batches = new AtomicInteger();
            ProgressSink progress = (processed, total) -> batches.incrementAndGet();
            CompiledListDefinition list = compile("""
                    {"expression_sets": [{"expressions": []}]}
                    """);
            ListEvaluator evaluator = evaluator(sequential());

            assertThatThrownBy(() -> evaluator.evaluate(list.ruleGroups(), CandidateSource.of(items), context,
                    list.sortSpec(), ListLimits.unlimited(), progress, () -> batches.get() >= 1))
                    .isInstanceOf(RunCancelledException.class)
                    .isInstanceOfSatisfying(EvaluationRunException.class,
                            e -> assertThat(e.getReason()).isEqualTo(EvaluationRunException.Reason.CANCELLED));
            assertThat(batches.get()).isEqualTo(1);
            assertThat(evaluator.getMetrics().getSnapshot()).containsEntry("cancelledRuns", 1L);
        }

        @Test
        @DisplayName("A source delivering fewer items than announced aborts the run")
        void sourceExhausted() {
            CandidateSource shortSource = new CandidateSource() {
                @Override
                public long totalCount() {
                    return 10;
                }

                @Override
                public List<MediaItem> fetchBatch(long offset, int limit) {
                    return offset == 0 ? List.of(movie("m0", "Zero"), movie("m1", "One")) : List.of();
                }
            };
            CompiledListDefinition list = compile("""
                    {"expression_sets": [{"expressions": []}]}
                    """);

            assertThatThrownBy(() -> evaluator(sequential()).evaluate(list.ruleGroups(), shortSource, context,
                    list.sortSpec(), ListLimits.unlimited()))
                    .isInstanceOf(EvaluationRunException.class)
                    .hasMessageContaining("offset 2")
                    .isInstanceOfSatisfying(EvaluationRunException.class,
                            e -> assertThat(e.getReason()).isEqualTo(EvaluationRunException.Reason.SOURCE_EXHAUSTED));
        }

        @Test
        @DisplayName("A failing source is a run-level failure")
        void sourceFailure() {
            CandidateSource broken = new CandidateSource() {
                @Override
                public long totalCount() {
                    throw new IllegalStateException("catalog offline");
                }

                @Override
                public List<MediaItem> fetchBatch(long offset, int limit) {
                    return List.of();
                }
            };

            assertThatThrownBy(() -> evaluator(sequential()).evaluate(RuleGroups.empty(), broken, context,
                    SortSpec.none(), ListLimits.unlimited()))
                    .isInstanceOf(EvaluationRunException.class)
                    .hasMessageContaining("catalog offline")
                    .isInstanceOfSatisfying(EvaluationRunException.class,
                            e -> assertThat(e.getReason()).isEqualTo(EvaluationRunException.Reason.SOURCE_FAILURE));
        }
    }

    @Nested
    @DisplayName("Progress")
    class Progress {

        @Test
        @DisplayName("Progress is reported after every batch")
        void reportsEveryBatch() {
            List<MediaItem> items = new ArrayList<>();
            for (int i = 0; i < 10; i++) items.add(movie("m" + i, "Movie " + i));
            List<long[]> reports = new ArrayList<>();
            CompiledListDefinition list = compile("""
                    {"expression_sets": [{"expressions": []}]}
                    """);

            evaluator(sequential()).evaluate(list.ruleGroups(), CandidateSource.of(items), context, list.sortSpec(),
                    ListLimits.unlimited(), (processed, total) -> reports.add(new long[]{processed, total}),
                    () -> false);

            assertThat(reports).extracting(r -> r[0]).containsExactly(4L, 8L, 10L);
            assertThat(reports).extracting(r -> r[1]).containsOnly(10L);
        }

        @Test
        @DisplayName("A failing progress sink aborts the run with a typed failure")
        void failingSinkAbortsRun() {
            List<MediaItem> items = List.of(movie("a", "A"), movie("b", "B"));
            CompiledListDefinition list = compile("""
                    {"expression_sets": [{"expressions": []}]}
                    """);
            ListEvaluator evaluator = evaluator(sequential());
            ProgressSink broken = (processed, total) -> {
                throw new IllegalStateException("ui gone");
            };

            assertThatThrownBy(() -> evaluator.evaluate(list.ruleGroups(), CandidateSource.of(items), context,
                    list.sortSpec(), ListLimits.unlimited(), broken, () -> false))
                    .isInstanceOfSatisfying(EvaluationRunException.class, e ->
                            assertThat(e.getReason()).isEqualTo(EvaluationRunException.Reason.RESOURCE_FAILURE))
                    .hasMessageContaining("ui gone")
                    .hasRootCauseInstanceOf(IllegalStateException.class);
            assertThat(evaluator.getMetrics().getSnapshot()).containsEntry("failedRuns", 1L);
        }
    }

    @Nested
    @DisplayName("External lists")
    class ExternalLists {

        private static final String URL = "https://mdblist.com/lists/someone/top";

        private CompiledListDefinition definition() {
            return compile("""
                    {"expression_sets": [{"expressions": [
                        {"field": "ExternalList", "operator": "Equal", "value": "%s"}]}],
                     "order": [{"field": "External List Order"}]}
                    """.formatted(URL));
        }

        private List<MediaItem> catalog() {
            return List.of(
                    MediaItem.builder("1").name("One").itemType("Movie").providerIds(Map.of("Imdb", "tt001")).build(),
                    MediaItem.builder("2").name("Two").itemType("Movie").providerIds(Map.of("Tmdb", "603")).build(),
                    MediaItem.builder("3").name("Three").itemType("Movie").providerIds(Map.of("Imdb", "tt999")).build());
        }

        @Test
        @DisplayName("Matches listed items and orders them by list position")
        void matchesAndOrders() throws Exception {
            ExternalListProvider provider = org.mockito.Mockito.mock(ExternalListProvider.class);
            when(provider.canHandle(URL)).thenReturn(true);
            when(provider.fetch(URL)).thenReturn(new ExternalListResult(URL, List.of(
                    new ExternalListResult.Entry(null, "603", null),
                    new ExternalListResult.Entry("tt001", null, null))));
            ListEvaluator evaluator = new ListEvaluator(lookups, List.of(provider), sequential(),
                    OpenTelemetry.noop().getTracer("test"));

            ListEvaluationResult result = run(evaluator, definition(), catalog(), ListLimits.unlimited());

            assertThat(result.itemIds()).containsExactly("2", "1");
            verify(provider, times(1)).fetch(URL);
        }

        @Test
        @DisplayName("A failed fetch yields an empty list without aborting the run")
        void failedFetchIsEmpty() throws Exception {
            ExternalListProvider provider = org.mockito.Mockito.mock(ExternalListProvider.class);
            when(provider.canHandle(URL)).thenReturn(true);
            when(provider.fetch(URL)).thenThrow(new IOException("HTTP 503"));
            ListEvaluator evaluator = new ListEvaluator(lookups, List.of(provider), sequential(),
                    OpenTelemetry.noop().getTracer("test"));

            ListEvaluationResult result = run(evaluator, definition(), catalog(), ListLimits.unlimited());

            assertThat(result.items()).isEmpty();
            assertThat(result.perItemErrorCount()).isZero();
        }

        @Test
        @DisplayName("A provider that fails to answer canHandle is treated like a failed fetch")
        void failingCanHandleIsEmpty() throws Exception {
            ExternalListProvider provider = org.mockito.Mockito.mock(ExternalListProvider.class);
            when(provider.canHandle(URL)).thenThrow(new IllegalStateException("provider bug"));
            ListEvaluator evaluator = new ListEvaluator(lookups, List.of(provider), sequential(),
                    OpenTelemetry.noop().getTracer("test"));

            ListEvaluationResult result = run(evaluator, definition(), catalog(), ListLimits.unlimited());

            assertThat(result.items()).isEmpty();
            assertThat(result.perItemErrorCount()).isZero();
            verify(provider, never()).fetch(anyString());
        }

        @Test
        @DisplayName("An interrupted fetch cancels the run")
        void interruptedFetchCancels() throws Exception {
            ExternalListProvider provider = org.mockito.Mockito.mock(ExternalListProvider.class);
            when(provider.canHandle(URL)).thenReturn(true);
            when(provider.fetch(URL)).thenThrow(new InterruptedException());
            ListEvaluator evaluator = new ListEvaluator(lookups, List.of(provider), sequential(),
                    OpenTelemetry.noop().getTracer("test"));

            try {
                assertThatThrownBy(() -> run(evaluator, definition(), catalog(), ListLimits.unlimited()))
                        .isInstanceOf(RunCancelledException.class);
            } finally {
                // Clear the flag restored by the service.
                Thread.interrupted();
            }
        }
    }

    @Nested
    @DisplayName("Similarity")
    class Similarity {

        @Test
        @DisplayName("Matches items sharing genres or tags with the reference, most similar first")
        void similarTo() {
            List<MediaItem> items = List.of(
                    MediaItem.builder("ref").name("The Matrix").itemType("Movie")
                            .genres(List.of("Action", "Sci-Fi")).tags(List.of("cyberpunk")).build(),
                    MediaItem.builder("a").name("Blade Runner").itemType("Movie")
                            .genres(List.of("Sci-Fi")).tags(List.of("Cyberpunk")).build(),
                    MediaItem.builder("b").name("Die Hard").itemType("Movie")
                            .genres(List.of("Action")).build(),
                    MediaItem.builder("c").name("Notting Hill").itemType("Movie")
                            .genres(List.of("Romance")).build());
            CompiledListDefinition list = compile("""
                    {"expression_sets": [{"expressions": [
                        {"field": "SimilarTo", "operator": "Equal", "value": "the matrix"}]}],
                     "order": [{"field": "Similarity"}]}
                    """);

            ListEvaluationResult result = run(evaluator(sequential()), list, items, ListLimits.unlimited());

            assertThat(result.itemIds()).containsExactly("a", "b");
            assertThat(result.items().get(0).sortKey()).containsExactly(2.0);
        }

        @Test
        @DisplayName("A reference outside the admitted media types still selects similar items")
        void referenceOfOtherType() {
            List<MediaItem> items = List.of(
                    MediaItem.builder("s").name("Firefly").itemType("Series").genres(List.of("Western")).build(),
                    MediaItem.builder("m").name("Serenity").itemType("Movie").genres(List.of("Western")).build());
            CompiledListDefinition list = compile("""
                    {"expression_sets": [{"expressions": [
                        {"field": "SimilarTo", "operator": "Equal", "value": "Firefly"}]}],
                     "media_types": ["Movie"]}
                    """);

            ListEvaluationResult result = evaluator(sequential()).evaluate(list, CandidateSource.of(items),
                    EvaluationContext.builder().now(NOW));

            assertThat(result.itemIds()).containsExactly("m");
        }
    }

    @Test
    @DisplayName("Metrics accumulate across runs")
    void metricsSnapshot() {
        ListEvaluator evaluator = evaluator(sequential());
        CompiledListDefinition list = compile("""
                {"expression_sets": [{"expressions": []}]}
                """);

        run(evaluator, list, List.of(movie("1", "A"), movie("2", "B")), ListLimits.unlimited());
        run(evaluator, list, List.of(movie("3", "C")), ListLimits.unlimited());

        assertThat(evaluator.getMetrics().getSnapshot())
                .containsEntry("completedRuns", 2L)
                .containsEntry("candidates", 3L)
                .containsEntry("returned", 3L);
    }

    @Test
    @DisplayName("User-specific rules read the context user")
    void userSpecificRulesUseContextUser() {
        when(lookups.userData("1", "u1")).thenReturn(new UserItemData(true, false, 0, 0L, null));
        CompiledListDefinition list = compile("""
                {"expression_sets": [{"expressions": [{"field": "IsFavorite", "operator": "Equal", "value": "true"}]}],
                 "user_id": "u1"}
                """);

        ListEvaluationResult result = evaluator(sequential()).evaluate(list,
                CandidateSource.of(List.of(movie("1", "A"), movie("2", "B"))), EvaluationContext.builder().now(NOW));

        assertThat(result.itemIds()).containsExactly("1");
        verify(lookups).userData("2", "u1");
    }
}
