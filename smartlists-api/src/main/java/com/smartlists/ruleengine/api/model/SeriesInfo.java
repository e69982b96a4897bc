package com.smartlists.ruleengine.api.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregated facts about a series, shared by all of its episodes.
 */
public record SeriesInfo(
        String id,
        String name,
        List<String> tags,
        List<String> studios,
        List<String> genres,
        Instant lastEpisodeAirDate,
        Map<String, String> providerIds
) {

    public SeriesInfo {
        tags = tags != null ? List.copyOf(tags) : List.of();
        studios = studios != null ? List.copyOf(studios) : List.of();
        genres = genres != null ? List.copyOf(genres) : List.of();
        providerIds = providerIds != null ? Map.copyOf(providerIds) : Map.of();
    }
}
