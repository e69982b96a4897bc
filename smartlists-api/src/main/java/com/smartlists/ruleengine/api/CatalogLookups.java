package com.smartlists.ruleengine.api;

import com.smartlists.ruleengine.api.model.ContainerRef;
import com.smartlists.ruleengine.api.model.MediaItem;
import com.smartlists.ruleengine.api.model.MediaStreamInfo;
import com.smartlists.ruleengine.api.model.NextUnwatchedInfo;
import com.smartlists.ruleengine.api.model.PersonCredit;
import com.smartlists.ruleengine.api.model.SeriesInfo;
import com.smartlists.ruleengine.api.model.UserItemData;

import java.util.List;
import java.util.Optional;

/**
 * Host callbacks for everything that is not a direct item property.
 *
 * <p>The engine owns none of these lookups; it only memoizes their results for the
 * duration of one run. Implementations may block and may throw: an exception
 * excludes the item being evaluated and is counted, it never aborts the run.
 */
public interface CatalogLookups {

    List<PersonCredit> people(String itemId);

    /**
     * Collections that directly contain the given item or collection.
     */
    List<ContainerRef> collectionsContaining(String itemId);

    /**
     * Playlists visible to the user that contain the item.
     */
    List<ContainerRef> playlistsContaining(String itemId, String userId);

    MediaStreamInfo mediaStreams(String itemId);

    Optional<SeriesInfo> series(String seriesId);

    NextUnwatchedInfo nextUnwatched(String seriesId, String userId);

    UserItemData userData(String itemId, String userId);

    String libraryName(String itemId);

    /**
     * Direct children of a container item (box set, playlist, series, ...).
     */
    List<MediaItem> children(String containerId);
}
