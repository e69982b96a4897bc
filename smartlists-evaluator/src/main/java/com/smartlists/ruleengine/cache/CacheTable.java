package com.smartlists.ruleengine.cache;

/**
 * Lookup tables of the per-run {@link EvaluationCache}.
 */
public enum CacheTable {
    PEOPLE,
    /** Keyed by item and search depth. */
    COLLECTIONS,
    /** Keyed by item and user. */
    PLAYLISTS,
    MEDIA_STREAMS,
    SERIES_INFO,
    /** Keyed by series and user. */
    NEXT_UNWATCHED,
    /** Keyed by item and user. */
    USER_DATA,
    LIBRARY_NAME,
    EXTERNAL_LIST,
    /** Keyed by item and list URL. */
    EXTERNAL_POSITION,
    CHILDREN
}
