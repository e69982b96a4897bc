package com.smartlists.ruleengine.runtime.model;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable per-run context.
 *
 * <p>Fixing {@link #now()} and {@link #randomSeed()} makes a run fully
 * deterministic, which is what tests rely on.
 *
 * @param userId           reference user for user-specific fields
 * @param mediaTypes       item types admitted to the run, lower-cased; empty admits all
 * @param includeExtras    whether extras (trailers, featurettes) take part
 * @param similarityFields attributes compared by SimilarTo rules
 * @param now              evaluation clock for relative date operators
 * @param randomSeed       seed of the Random sort key
 */
public record EvaluationContext(
        String userId,
        Set<String> mediaTypes,
        boolean includeExtras,
        List<SimilarityField> similarityFields,
        Instant now,
        long randomSeed
) {

    public EvaluationContext {
        mediaTypes = mediaTypes != null
                ? mediaTypes.stream().map(t -> t.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet())
                : Set.of();
        similarityFields = similarityFields != null && !similarityFields.isEmpty()
                ? List.copyOf(similarityFields)
                : SimilarityField.DEFAULTS;
        Objects.requireNonNull(now, "now must not be null");
    }

    public boolean admitsType(String itemType) {
        return mediaTypes.isEmpty() || (itemType != null && mediaTypes.contains(itemType.toLowerCase(Locale.ROOT)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String userId;
        private Set<String> mediaTypes = Set.of();
        private boolean includeExtras;
        private List<SimilarityField> similarityFields = SimilarityField.DEFAULTS;
        private Clock clock = Clock.systemUTC();
        private Instant now;
        private Long randomSeed;

        private Builder() {
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder mediaTypes(Set<String> mediaTypes) {
            this.mediaTypes = mediaTypes;
            return this;
        }

        public Builder includeExtras(boolean includeExtras) {
            this.includeExtras = includeExtras;
            return this;
        }

        public Builder similarityFields(List<SimilarityField> similarityFields) {
            this.similarityFields = similarityFields;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder now(Instant now) {
            this.now = now;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public EvaluationContext build() {
            Instant at = now != null ? now : clock.instant();
            long seed = randomSeed != null ? randomSeed : at.toEpochMilli() ^ System.nanoTime();
            return new EvaluationContext(userId, mediaTypes, includeExtras, similarityFields, at, seed);
        }
    }
}
