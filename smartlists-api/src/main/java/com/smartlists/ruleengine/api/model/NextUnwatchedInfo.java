package com.smartlists.ruleengine.api.model;

/**
 * Next episode a user should watch in a series.
 *
 * @param episodeId     next unwatched episode, null when the series is finished
 * @param seriesStarted whether the user has watched at least one episode
 */
public record NextUnwatchedInfo(String episodeId, boolean seriesStarted) {

    public static NextUnwatchedInfo none() {
        return new NextUnwatchedInfo(null, false);
    }
}
