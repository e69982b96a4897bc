package com.smartlists.ruleengine.runtime.similarity;

import com.smartlists.ruleengine.api.model.MediaItem;
import com.smartlists.ruleengine.api.model.MediaStreamInfo;
import com.smartlists.ruleengine.cache.EvaluationCache;
import com.smartlists.ruleengine.registry.PersonRole;
import com.smartlists.ruleengine.runtime.model.CompiledExpression;
import com.smartlists.ruleengine.runtime.model.SimilarityField;
import com.smartlists.ruleengine.runtime.operators.OperatorEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scores candidates against the reference items picked by {@code SimilarTo} rules.
 *
 * <p>A reference item is any candidate whose name satisfies the rule's operator and
 * target. The score of a candidate against one reference is the number of shared values
 * over the comparison fields (case-insensitive); production years count as shared when
 * at most {@value #YEAR_WINDOW} years apart. A candidate matches a rule when it is not
 * one of that rule's references and its best score is positive.
 *
 * <p>References must be offered before evaluation starts, which takes a pass over the
 * candidate source.
 */
public final class SimilarityScorer {
    private static final Logger logger = LoggerFactory.getLogger(SimilarityScorer.class);

    static final int YEAR_WINDOW = 2;

    private final EvaluationCache cache;
    private final List<SimilarityField> fields;
    private final OperatorEvaluator operators;
    private final List<CompiledExpression> rules;

    private final Map<CompiledExpression, List<Reference>> referencesByRule = new LinkedHashMap<>();
    private final Map<String, Double> bestScores = new ConcurrentHashMap<>();

    public SimilarityScorer(EvaluationCache cache, List<SimilarityField> fields, OperatorEvaluator operators,
                            List<CompiledExpression> rules) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.fields = List.copyOf(fields);
        this.operators = Objects.requireNonNull(operators, "operators must not be null");
        this.rules = List.copyOf(rules);
        for (CompiledExpression rule : rules) {
            referencesByRule.put(rule, new ArrayList<>());
        }
    }

    /**
     * Records {@code item} as a reference for every rule whose name test it passes.
     * Not thread-safe; called during the single-threaded reference pass.
     */
    public void offerReference(MediaItem item) {
        for (CompiledExpression rule : rules) {
            if (operators.evaluateText(rule.operator(), rule.target(), item.name())) {
                referencesByRule.get(rule).add(new Reference(item.id(), features(item), item.productionYear()));
            }
        }
    }

    public int referenceCount() {
        return (int) referencesByRule.values().stream().mapToLong(List::size).sum();
    }

    public void logReferences() {
        referencesByRule.forEach((rule, refs) ->
                logger.debug("Similarity rule {} selected {} reference item(s)", rule, refs.size()));
    }

    public boolean matches(CompiledExpression rule, MediaItem item) {
        List<Reference> references = referencesByRule.getOrDefault(rule, List.of());
        for (Reference reference : references) {
            if (reference.id().equals(item.id())) {
                return false;
            }
        }
        return bestScore(references, item) > 0;
    }

    /**
     * Best score against any reference of any rule, or null when there are no references.
     */
    public Double score(MediaItem item) {
        if (referenceCount() == 0) {
            return null;
        }
        return bestScores.computeIfAbsent(item.id(), id -> {
            List<Reference> all = new ArrayList<>();
            referencesByRule.values().forEach(all::addAll);
            return bestScore(all, item);
        });
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // SCORING
    // ════════════════════════════════════════════════════════════════════════════════

    private double bestScore(Collection<Reference> references, MediaItem item) {
        if (references.isEmpty()) {
            return 0;
        }
        Map<SimilarityField, Set<String>> candidate = features(item);
        double best = 0;
        for (Reference reference : references) {
            if (reference.id().equals(item.id())) {
                continue;
            }
            best = Math.max(best, score(reference, candidate, item.productionYear()));
        }
        return best;
    }

    private double score(Reference reference, Map<SimilarityField, Set<String>> candidate, Integer year) {
        double score = 0;
        for (SimilarityField field : fields) {
            if (field == SimilarityField.PRODUCTION_YEAR) {
                if (reference.year() != null && year != null && Math.abs(reference.year() - year) <= YEAR_WINDOW) {
                    score += 1;
                }
                continue;
            }
            Set<String> mine = candidate.getOrDefault(field, Set.of());
            for (String value : reference.features().getOrDefault(field, Set.of())) {
                if (mine.contains(value)) {
                    score += 1;
                }
            }
        }
        return score;
    }

    private Map<SimilarityField, Set<String>> features(MediaItem item) {
        Map<SimilarityField, Set<String>> features = new EnumMap<>(SimilarityField.class);
        for (SimilarityField field : fields) {
            switch (field) {
                case GENRE:
                    features.put(field, fold(item.genres()));
                    break;
                case TAGS:
                    features.put(field, fold(item.tags()));
                    break;
                case STUDIOS:
                    features.put(field, fold(item.studios()));
                    break;
                case ACTORS:
                    features.put(field, fold(PersonRole.ACTORS.select(cache.people(item.id()))));
                    break;
                case ACTOR_ROLES:
                    features.put(field, fold(PersonRole.ACTOR_ROLES.select(cache.people(item.id()))));
                    break;
                case WRITERS:
                    features.put(field, fold(PersonRole.WRITERS.select(cache.people(item.id()))));
                    break;
                case PRODUCERS:
                    features.put(field, fold(PersonRole.PRODUCERS.select(cache.people(item.id()))));
                    break;
                case DIRECTORS:
                    features.put(field, fold(PersonRole.DIRECTORS.select(cache.people(item.id()))));
                    break;
                case AUDIO_LANGUAGES:
                    List<String> languages = new ArrayList<>();
                    for (MediaStreamInfo.AudioStream stream : cache.mediaStreams(item.id()).audioStreams()) {
                        languages.add(stream.language());
                    }
                    features.put(field, fold(languages));
                    break;
                case NAME:
                    features.put(field, fold(item.name() != null ? List.of(item.name()) : List.of()));
                    break;
                case PARENTAL_RATING:
                    features.put(field, fold(item.officialRating() != null ? List.of(item.officialRating()) : List.of()));
                    break;
                case PRODUCTION_YEAR:
                    break;
                default:
                    throw new IllegalStateException("Unhandled similarity field: " + field);
            }
        }
        return features;
    }

    private static Set<String> fold(List<String> values) {
        Set<String> folded = new HashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                folded.add(value.trim().toLowerCase(Locale.ROOT));
            }
        }
        return folded;
    }

    private record Reference(String id, Map<SimilarityField, Set<String>> features, Integer year) {
    }
}
