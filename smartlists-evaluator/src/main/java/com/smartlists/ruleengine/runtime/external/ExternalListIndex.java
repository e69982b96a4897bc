package com.smartlists.ruleengine.runtime.external;

import com.smartlists.ruleengine.api.model.ExternalListResult;
import com.smartlists.ruleengine.api.model.MediaItem;
import com.smartlists.ruleengine.api.model.ProviderIds;
import com.smartlists.ruleengine.api.model.SeriesInfo;
import com.smartlists.ruleengine.cache.EvaluationCache;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Provider-id lookup over the external lists fetched for one run.
 *
 * <p>Keys are {@code provider:id} in lower case, e.g. {@code imdb:tt0133093}; each maps
 * to the index of the first entry carrying it. Episodes are also matched through the
 * provider ids of their series.
 */
public final class ExternalListIndex {

    private final Map<String, Object2IntMap<String>> positionsByUrl = new HashMap<>();
    private final EvaluationCache cache;

    ExternalListIndex(Map<String, ExternalListResult> lists, EvaluationCache cache) {
        this.cache = cache;
        lists.forEach((url, list) -> positionsByUrl.put(url, index(list)));
    }

    public boolean isEmpty() {
        return positionsByUrl.isEmpty();
    }

    /**
     * @return zero-based position of the item in the list, or null when it is absent
     */
    public Integer position(MediaItem item, String url) {
        Object2IntMap<String> positions = positionsByUrl.get(url);
        if (positions == null || positions.isEmpty()) {
            return null;
        }
        return cache.externalPosition(item.id(), url, () -> resolve(item, positions));
    }

    /**
     * Smallest position over all fetched lists, for the External List Order sort key.
     */
    public Integer bestPosition(MediaItem item) {
        Integer best = null;
        for (String url : positionsByUrl.keySet()) {
            Integer position = position(item, url);
            if (position != null && (best == null || position < best)) {
                best = position;
            }
        }
        return best;
    }

    private Integer resolve(MediaItem item, Object2IntMap<String> positions) {
        int best = firstPosition(item.providerIds(), positions);
        if (item.isEpisode()) {
            SeriesInfo series = cache.series(item.seriesId()).orElse(null);
            if (series != null) {
                int fromSeries = firstPosition(series.providerIds(), positions);
                if (fromSeries >= 0 && (best < 0 || fromSeries < best)) {
                    best = fromSeries;
                }
            }
        }
        return best >= 0 ? best : null;
    }

    private static int firstPosition(Map<String, String> ids, Object2IntMap<String> positions) {
        int best = -1;
        for (Map.Entry<String, String> id : ids.entrySet()) {
            if (id.getValue() == null || id.getValue().isBlank()) {
                continue;
            }
            int position = positions.getInt(key(id.getKey(), id.getValue()));
            if (position >= 0 && (best < 0 || position < best)) {
                best = position;
            }
        }
        return best;
    }

    private static Object2IntMap<String> index(ExternalListResult list) {
        Object2IntMap<String> positions = new Object2IntOpenHashMap<>();
        positions.defaultReturnValue(-1);
        List<ExternalListResult.Entry> entries = list.entries();
        for (int i = 0; i < entries.size(); i++) {
            ExternalListResult.Entry entry = entries.get(i);
            putFirst(positions, ProviderIds.IMDB, entry.imdbId(), i);
            putFirst(positions, ProviderIds.TMDB, entry.tmdbId(), i);
            putFirst(positions, ProviderIds.TVDB, entry.tvdbId(), i);
        }
        return positions;
    }

    private static void putFirst(Object2IntMap<String> positions, String provider, String id, int position) {
        if (id != null && !id.isBlank()) {
            positions.putIfAbsent(key(provider, id), position);
        }
    }

    private static String key(String provider, String id) {
        return provider.toLowerCase(Locale.ROOT) + ":" + id.trim().toLowerCase(Locale.ROOT);
    }
}
