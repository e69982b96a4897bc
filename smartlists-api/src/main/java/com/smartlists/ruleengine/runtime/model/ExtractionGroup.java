package com.smartlists.ruleengine.runtime.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Tags identifying the side-channel lookup a field value needs.
 *
 * <p>Each constant owns one bit so that the requirements of a whole rule set
 * fold into a single {@code int} mask. The groups in {@link #CHEAP_MASK} are read
 * from the item itself or from trivial per-user data; every other group requires a
 * host lookup or a cross-item aggregation and is served through the evaluation cache.
 */
public enum ExtractionGroup {
    AUDIO_LANGUAGES(1),
    AUDIO_QUALITY(1 << 1),
    VIDEO_QUALITY(1 << 2),
    PEOPLE(1 << 3),
    COLLECTIONS(1 << 4),
    PLAYLISTS(1 << 5),
    NEXT_UNWATCHED(1 << 6),
    SERIES_NAME(1 << 7),
    PARENT_SERIES_TAGS(1 << 8),
    PARENT_SERIES_STUDIOS(1 << 9),
    PARENT_SERIES_GENRES(1 << 10),
    SIMILAR_TO(1 << 11),
    LAST_EPISODE_AIR_DATE(1 << 12),
    FILE_INFO(1 << 13),
    LIBRARY_INFO(1 << 14),
    AUDIO_METADATA(1 << 15),
    TEXT_CONTENT(1 << 16),
    ITEM_LISTS(1 << 17),
    USER_DATA(1 << 18),
    DATES(1 << 19),
    EXTERNAL_LISTS(1 << 20);

    /** No lookup at all: direct item property. */
    public static final int NONE = 0;

    /**
     * Groups cheap enough for phase 1 filtering.
     */
    public static final int CHEAP_MASK = (1 << 13) | (1 << 14) | (1 << 15) | (1 << 16)
            | (1 << 17) | (1 << 18) | (1 << 19);

    private final int bit;

    ExtractionGroup(int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }

    public boolean isCheap() {
        return (bit & CHEAP_MASK) != 0;
    }

    public boolean isIn(int mask) {
        return (mask & bit) != 0;
    }

    /**
     * A mask is expensive as soon as one of its bits lies outside the cheap subset.
     */
    public static boolean isExpensive(int mask) {
        return (mask & ~CHEAP_MASK) != 0;
    }

    public static int maskOf(ExtractionGroup... groups) {
        int mask = NONE;
        for (ExtractionGroup group : groups) {
            mask |= group.bit;
        }
        return mask;
    }

    public static Set<ExtractionGroup> fromMask(int mask) {
        EnumSet<ExtractionGroup> groups = EnumSet.noneOf(ExtractionGroup.class);
        for (ExtractionGroup group : values()) {
            if ((mask & group.bit) != 0) {
                groups.add(group);
            }
        }
        return groups;
    }
}
