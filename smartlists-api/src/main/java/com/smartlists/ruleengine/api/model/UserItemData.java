package com.smartlists.ruleengine.api.model;

import java.time.Instant;

/**
 * Per-user state of one item.
 *
 * @param favorite              marked as favorite
 * @param played                fully watched or listened to
 * @param playCount             number of completed plays
 * @param playbackPositionTicks resume position, 0 when not started
 * @param lastPlayedDate        last play, null if never played
 */
public record UserItemData(
        boolean favorite,
        boolean played,
        int playCount,
        long playbackPositionTicks,
        Instant lastPlayedDate
) {

    public static UserItemData unplayed() {
        return new UserItemData(false, false, 0, 0L, null);
    }

    public PlaybackStatus playbackStatus() {
        if (played) {
            return PlaybackStatus.PLAYED;
        }
        return playbackPositionTicks > 0 ? PlaybackStatus.IN_PROGRESS : PlaybackStatus.UNPLAYED;
    }
}
