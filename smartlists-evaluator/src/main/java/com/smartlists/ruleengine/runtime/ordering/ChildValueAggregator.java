package com.smartlists.ruleengine.runtime.ordering;

import com.smartlists.ruleengine.api.model.MediaItem;
import com.smartlists.ruleengine.cache.EvaluationCache;
import com.smartlists.ruleengine.runtime.model.SortField;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Substitutes a container's sort value with the min (ascending) or max (descending)
 * of its descendants' values.
 *
 * <p>Descendants are walked breadth-first through {@link EvaluationCache#children},
 * at most {@value #MAX_DEPTH} levels deep and never visiting an item twice.
 */
final class ChildValueAggregator {

    static final int MAX_DEPTH = 10;

    private final EvaluationCache cache;

    ChildValueAggregator(EvaluationCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
    }

    /**
     * @param own the container's own value, returned when no descendant has one
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    Object aggregate(MediaItem container, SortField field, boolean descending, Object own) {
        Comparable best = null;

        Set<String> visited = new HashSet<>();
        visited.add(container.id());
        Deque<MediaItem> frontier = new ArrayDeque<>();
        frontier.add(container);

        for (int depth = 0; depth < MAX_DEPTH && !frontier.isEmpty(); depth++) {
            Deque<MediaItem> next = new ArrayDeque<>();
            for (MediaItem parent : frontier) {
                for (MediaItem child : cache.children(parent.id())) {
                    if (child == null || !visited.add(child.id())) {
                        continue;
                    }
                    Comparable value = (Comparable) directValue(field, child);
                    if (value != null && (best == null
                            || (descending ? value.compareTo(best) > 0 : value.compareTo(best) < 0))) {
                        best = value;
                    }
                    if (child.isContainer()) {
                        next.add(child);
                    }
                }
            }
            frontier = next;
        }
        return best != null ? best : own;
    }

    /**
     * Value of an aggregatable key read from the item itself; years and ratings
     * of zero or less count as unknown.
     */
    static Object directValue(SortField field, MediaItem item) {
        switch (field) {
            case PRODUCTION_YEAR:
                return item.productionYear() != null && item.productionYear() > 0
                        ? item.productionYear().doubleValue() : null;
            case COMMUNITY_RATING:
                return item.communityRating() != null && item.communityRating() > 0
                        ? item.communityRating() : null;
            case DATE_CREATED:
                return item.dateCreated();
            case RELEASE_DATE:
                return item.releaseDate();
            default:
                throw new IllegalArgumentException("Child aggregation is not supported for " + field.id());
        }
    }
}
