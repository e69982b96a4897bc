package com.smartlists.ruleengine.runtime.model;

/**
 * Field-specific switches attached to a single rule.
 *
 * @param includeParentSeriesTags    episodes also see their series' tags
 * @param includeParentSeriesStudios episodes also see their series' studios
 * @param includeParentSeriesGenres  episodes also see their series' genres
 * @param onlyDefaultAudioLanguage   only default audio streams count for AudioLanguages
 * @param includeUnwatchedSeries     NextUnwatched also considers series never started
 * @param collectionSearchDepth      levels of parent collections searched, 0 = direct only
 * @param userId                     user override for user-specific fields, null = context user
 */
public record ExpressionOptions(
        boolean includeParentSeriesTags,
        boolean includeParentSeriesStudios,
        boolean includeParentSeriesGenres,
        boolean onlyDefaultAudioLanguage,
        boolean includeUnwatchedSeries,
        int collectionSearchDepth,
        String userId
) {
    public static final int MAX_COLLECTION_SEARCH_DEPTH = 10;

    public static final ExpressionOptions DEFAULTS =
            new ExpressionOptions(false, false, false, false, true, 0, null);

    /**
     * Extra extraction bits the options add on top of the field's own group.
     */
    public int extraExtractionMask() {
        int mask = ExtractionGroup.NONE;
        if (includeParentSeriesTags) mask |= ExtractionGroup.PARENT_SERIES_TAGS.bit();
        if (includeParentSeriesStudios) mask |= ExtractionGroup.PARENT_SERIES_STUDIOS.bit();
        if (includeParentSeriesGenres) mask |= ExtractionGroup.PARENT_SERIES_GENRES.bit();
        return mask;
    }

    public String effectiveUser(String contextUserId) {
        return userId != null && !userId.isBlank() ? userId : contextUserId;
    }
}
