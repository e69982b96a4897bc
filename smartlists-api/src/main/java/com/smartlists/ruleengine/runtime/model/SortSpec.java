package com.smartlists.ruleengine.runtime.model;

import java.util.List;
import java.util.Objects;

/**
 * Up to {@link #MAX_KEYS} sort keys applied left to right as a lexicographic key.
 */
public record SortSpec(List<SortKey> keys) {

    public static final int MAX_KEYS = 3;

    /**
     * One sort key.
     *
     * @param field               what to sort by
     * @param direction           ascending or descending
     * @param useChildAggregation containers use min/max of their children's values
     */
    public record SortKey(SortField field, SortDirection direction, boolean useChildAggregation) {
        public SortKey {
            Objects.requireNonNull(field, "field must not be null");
            direction = direction != null ? direction : field.defaultDirection();
            if (useChildAggregation && !field.isChildAggregatable()) {
                throw new IllegalArgumentException("Child aggregation is not supported for " + field.id());
            }
        }

        public static SortKey ascending(SortField field) {
            return new SortKey(field, SortDirection.ASCENDING, false);
        }

        public static SortKey descending(SortField field) {
            return new SortKey(field, SortDirection.DESCENDING, false);
        }

        public boolean descending() {
            return direction == SortDirection.DESCENDING;
        }
    }

    public SortSpec {
        keys = keys != null ? List.copyOf(keys) : List.of();
        if (keys.size() > MAX_KEYS) {
            throw new IllegalArgumentException("At most " + MAX_KEYS + " sort keys are supported, got " + keys.size());
        }
    }

    public static SortSpec none() {
        return new SortSpec(List.of());
    }

    public static SortSpec of(SortKey... keys) {
        return new SortSpec(List.of(keys));
    }

    public boolean isEmpty() {
        return keys.isEmpty() || keys.stream().allMatch(k -> k.field() == SortField.NO_ORDER);
    }
}
