package com.smartlists.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON representation of a smart list for deserialization.
 * This is a simple Data Transfer Object used only for loading; the compiler turns it
 * into a {@link com.smartlists.ruleengine.runtime.model.CompiledListDefinition}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SmartListDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("expression_sets") List<ExpressionSetDefinition> expressionSets,
        @JsonProperty("order") List<OrderDefinition> order,
        @JsonProperty("max_items") Integer maxItems,
        @JsonProperty("max_playtime_minutes") Integer maxPlaytimeMinutes,
        @JsonProperty("media_types") List<String> mediaTypes,
        @JsonProperty("user_id") String userId,
        @JsonProperty("similarity_comparison_fields") List<String> similarityComparisonFields,
        @JsonProperty("include_extras") Boolean includeExtras
) {

    /**
     * DTO for one OR-ed group of AND-ed rules.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExpressionSetDefinition(
            @JsonProperty("expressions") List<ExpressionDefinition> expressions,
            @JsonProperty("max_items") Integer maxItems
    ) {}

    /**
     * DTO for a single rule.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExpressionDefinition(
            @JsonProperty("field") String field,
            @JsonProperty("operator") String operator,
            @JsonProperty("value") String value,
            @JsonProperty("include_parent_series_tags") Boolean includeParentSeriesTags,
            @JsonProperty("include_parent_series_studios") Boolean includeParentSeriesStudios,
            @JsonProperty("include_parent_series_genres") Boolean includeParentSeriesGenres,
            @JsonProperty("only_default_audio_language") Boolean onlyDefaultAudioLanguage,
            @JsonProperty("include_unwatched_series") Boolean includeUnwatchedSeries,
            @JsonProperty("collection_search_depth") Integer collectionSearchDepth,
            @JsonProperty("user_id") String userId
    ) {
        public static ExpressionDefinition of(String field, String operator, String value) {
            return new ExpressionDefinition(field, operator, value, null, null, null, null, null, null, null);
        }
    }

    /**
     * DTO for one sort key.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OrderDefinition(
            @JsonProperty("field") String field,
            @JsonProperty("direction") String direction,
            @JsonProperty("use_child_aggregation") Boolean useChildAggregation
    ) {}

    public boolean includeExtrasOrDefault() {
        return includeExtras != null && includeExtras;
    }
}
