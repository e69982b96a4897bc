package com.smartlists.ruleengine.runtime.model;

import java.util.Locale;

/**
 * Sort keys available to list definitions.
 */
public enum SortField {
    NAME("Name"),
    NAME_IGNORE_ARTICLES("Name (Ignore Articles)"),
    PRODUCTION_YEAR("ProductionYear", true),
    DATE_CREATED("DateCreated", true),
    RELEASE_DATE("ReleaseDate", true),
    COMMUNITY_RATING("CommunityRating", true),
    CRITIC_RATING("CriticRating"),
    SIMILARITY("Similarity"),
    PLAY_COUNT("PlayCount (owner)"),
    LAST_PLAYED("LastPlayed (owner)"),
    RUNTIME("Runtime"),
    SERIES_NAME("SeriesName"),
    SERIES_NAME_IGNORE_ARTICLES("SeriesName (Ignore Articles)"),
    ALBUM_NAME("AlbumName"),
    ARTIST("Artist"),
    TRACK_NUMBER("TrackNumber"),
    SEASON_NUMBER("SeasonNumber"),
    EPISODE_NUMBER("EpisodeNumber"),
    LAST_EPISODE_AIR_DATE("LastEpisodeAirDate"),
    CHANNEL_RESOLUTION("ChannelResolution"),
    RULE_BLOCK_ORDER("Rule Block Order"),
    RULE_BLOCK_ORDER_INTERLEAVED("Rule Block Order Interleaved"),
    EXTERNAL_LIST_ORDER("External List Order"),
    RANDOM("Random"),
    NO_ORDER("NoOrder");

    private final String id;
    private final boolean childAggregatable;

    SortField(String id) {
        this(id, false);
    }

    SortField(String id, boolean childAggregatable) {
        this.id = id;
        this.childAggregatable = childAggregatable;
    }

    public String id() {
        return id;
    }

    /**
     * Whether container items may substitute the min/max of their children's values.
     */
    public boolean isChildAggregatable() {
        return childAggregatable;
    }

    /**
     * Whether the key rearranges the whole list instead of only comparing two items.
     * As the primary key, Rule Block Order Interleaved deals the groups out round-robin;
     * in any other position it compares by group index like Rule Block Order.
     */
    public boolean isInterleaving() {
        return this == RULE_BLOCK_ORDER_INTERLEAVED;
    }

    /**
     * Similarity reads best as "most similar first"; everything else ascends.
     */
    public SortDirection defaultDirection() {
        return this == SIMILARITY ? SortDirection.DESCENDING : SortDirection.ASCENDING;
    }

    /**
     * Resolves a definition name such as {@code "Name (Ignore Articles)"},
     * {@code "NameIgnoreArticles"} or {@code "NAME_IGNORE_ARTICLES"}.
     *
     * @return the field, or null if unknown
     */
    public static SortField fromString(String text) {
        if (text == null) return null;
        String wanted = normalize(text);
        for (SortField field : values()) {
            if (normalize(field.id).equals(wanted) || normalize(field.name()).equals(wanted)) {
                return field;
            }
        }
        return null;
    }

    private static String normalize(String text) {
        return text.replaceAll("[^A-Za-z0-9]", "").toLowerCase(Locale.ROOT);
    }
}
