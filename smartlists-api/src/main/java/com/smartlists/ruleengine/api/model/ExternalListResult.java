package com.smartlists.ruleengine.api.model;

import java.util.List;

/**
 * Items of a fetched external list, in list order.
 *
 * <p>An entry carries whatever provider identifiers the service reported. The
 * position of an item is the index of the first entry sharing an identifier with it.
 */
public record ExternalListResult(String url, List<Entry> entries) {

    public ExternalListResult {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public static ExternalListResult empty(String url) {
        return new ExternalListResult(url, List.of());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * @param imdbId IMDb id, e.g. tt0133093
     * @param tmdbId TMDB numeric id as text
     * @param tvdbId TVDB numeric id as text
     */
    public record Entry(String imdbId, String tmdbId, String tvdbId) {
    }
}
