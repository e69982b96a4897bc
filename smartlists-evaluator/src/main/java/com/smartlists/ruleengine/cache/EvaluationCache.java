/*
 * Copyright (c) 2025 SmartLists Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.smartlists.ruleengine.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.smartlists.ruleengine.api.CatalogLookups;
import com.smartlists.ruleengine.api.model.ContainerRef;
import com.smartlists.ruleengine.api.model.ExternalListResult;
import com.smartlists.ruleengine.api.model.MediaItem;
import com.smartlists.ruleengine.api.model.MediaStreamInfo;
import com.smartlists.ruleengine.api.model.NextUnwatchedInfo;
import com.smartlists.ruleengine.api.model.PersonCredit;
import com.smartlists.ruleengine.api.model.SeriesInfo;
import com.smartlists.ruleengine.api.model.UserItemData;
import com.smartlists.ruleengine.runtime.evaluation.ItemEvaluationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Per-run memoization of expensive host lookups.
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>The compute function runs at most once per (table, key), failures included:
 *       a failed lookup is remembered and reported to every later caller.</li>
 *   <li>Concurrent callers for the same key wait for the first computation.
 *       Only a placeholder future is installed under Caffeine's lock, so the lookup
 *       itself runs outside it and other keys proceed concurrently.</li>
 *   <li>No eviction and no state shared between runs: one instance per run,
 *       discarded with it.</li>
 * </ul>
 *
 * <p>Per-table hit and miss counts come from Caffeine's {@code recordStats()}.
 */
public final class EvaluationCache {
    private static final Logger logger = LoggerFactory.getLogger(EvaluationCache.class);

    private final CatalogLookups lookups;
    private final Map<CacheTable, Cache<Object, CompletableFuture<Outcome>>> tables = new EnumMap<>(CacheTable.class);

    public EvaluationCache(CatalogLookups lookups) {
        this.lookups = Objects.requireNonNull(lookups, "lookups must not be null");
        for (CacheTable table : CacheTable.values()) {
            tables.put(table, Caffeine.newBuilder().recordStats().build());
        }
    }

    /**
     * Returns the memoized value for {@code key}, computing it on first use.
     *
     * @throws ItemEvaluationException if the (possibly earlier) computation failed
     */
    @SuppressWarnings("unchecked")
    public <V> V getOrCompute(CacheTable table, Object key, Supplier<V> compute) {
        Objects.requireNonNull(key, "key must not be null");
        Cache<Object, CompletableFuture<Outcome>> cache = tables.get(table);

        CompletableFuture<Outcome> created = new CompletableFuture<>();
        CompletableFuture<Outcome> future = cache.get(key, k -> created);
        if (future == created) {
            Outcome outcome;
            try {
                outcome = Outcome.success(compute.get());
            } catch (RuntimeException e) {
                logger.debug("Lookup {} failed for key {}: {}", table, key, e.getMessage());
                outcome = Outcome.failure(e);
            } catch (Error e) {
                created.completeExceptionally(e);
                throw e;
            }
            created.complete(outcome);
        }

        Outcome outcome = future.join();
        if (outcome.failure() != null) {
            throw new ItemEvaluationException(null,
                    "Lookup " + table + " failed for " + key + ": " + outcome.failure().getMessage(),
                    outcome.failure());
        }
        return (V) outcome.value();
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // TABLE ACCESSORS
    // ════════════════════════════════════════════════════════════════════════════════

    public List<PersonCredit> people(String itemId) {
        return getOrCompute(CacheTable.PEOPLE, itemId, () -> orEmpty(lookups.people(itemId)));
    }

    /**
     * Names of collections containing the item, following parent collections up to
     * {@code depth} extra levels.
     */
    public List<String> collections(String itemId, int depth) {
        return getOrCompute(CacheTable.COLLECTIONS, new Key(itemId, depth), () -> collectCollections(itemId, depth));
    }

    public List<String> playlists(String itemId, String userId) {
        return getOrCompute(CacheTable.PLAYLISTS, new Key(itemId, userId), () -> {
            List<String> names = new ArrayList<>();
            for (ContainerRef playlist : orEmpty(lookups.playlistsContaining(itemId, userId))) {
                if (playlist.name() != null) {
                    names.add(playlist.name());
                }
            }
            return names;
        });
    }

    public MediaStreamInfo mediaStreams(String itemId) {
        return getOrCompute(CacheTable.MEDIA_STREAMS, itemId, () -> {
            MediaStreamInfo info = lookups.mediaStreams(itemId);
            return info != null ? info : MediaStreamInfo.empty();
        });
    }

    public Optional<SeriesInfo> series(String seriesId) {
        if (seriesId == null) {
            return Optional.empty();
        }
        return getOrCompute(CacheTable.SERIES_INFO, seriesId, () -> {
            Optional<SeriesInfo> info = lookups.series(seriesId);
            return info != null ? info : Optional.<SeriesInfo>empty();
        });
    }

    public NextUnwatchedInfo nextUnwatched(String seriesId, String userId) {
        return getOrCompute(CacheTable.NEXT_UNWATCHED, new Key(seriesId, userId), () -> {
            NextUnwatchedInfo info = lookups.nextUnwatched(seriesId, userId);
            return info != null ? info : NextUnwatchedInfo.none();
        });
    }

    public UserItemData userData(String itemId, String userId) {
        return getOrCompute(CacheTable.USER_DATA, new Key(itemId, userId), () -> {
            UserItemData data = lookups.userData(itemId, userId);
            return data != null ? data : UserItemData.unplayed();
        });
    }

    public String libraryName(String itemId) {
        return getOrCompute(CacheTable.LIBRARY_NAME, itemId, () -> lookups.libraryName(itemId));
    }

    public List<MediaItem> children(String containerId) {
        return getOrCompute(CacheTable.CHILDREN, containerId, () -> orEmpty(lookups.children(containerId)));
    }

    public ExternalListResult externalList(String url, Supplier<ExternalListResult> fetch) {
        return getOrCompute(CacheTable.EXTERNAL_LIST, url, fetch);
    }

    /**
     * @return position of the item in the list, or null when absent
     */
    public Integer externalPosition(String itemId, String url, Supplier<Integer> resolve) {
        return getOrCompute(CacheTable.EXTERNAL_POSITION, new Key(itemId, url), resolve);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // STATISTICS
    // ════════════════════════════════════════════════════════════════════════════════

    public CacheStats stats(CacheTable table) {
        return tables.get(table).stats();
    }

    public long size(CacheTable table) {
        return tables.get(table).estimatedSize();
    }

    /**
     * Hits, misses and entry counts of every table that was used.
     */
    public Map<String, Object> getSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        for (Map.Entry<CacheTable, Cache<Object, CompletableFuture<Outcome>>> entry : tables.entrySet()) {
            CacheStats stats = entry.getValue().stats();
            if (stats.requestCount() == 0) {
                continue;
            }
            String prefix = entry.getKey().name().toLowerCase(Locale.ROOT);
            snapshot.put(prefix + ".hits", stats.hitCount());
            snapshot.put(prefix + ".misses", stats.missCount());
            snapshot.put(prefix + ".size", entry.getValue().estimatedSize());
        }
        return snapshot;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // INTERNALS
    // ════════════════════════════════════════════════════════════════════════════════

    private List<String> collectCollections(String itemId, int depth) {
        List<String> names = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(itemId);

        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(itemId);
        for (int level = 0; level <= depth && !frontier.isEmpty(); level++) {
            Deque<String> next = new ArrayDeque<>();
            for (String id : frontier) {
                for (ContainerRef collection : orEmpty(lookups.collectionsContaining(id))) {
                    if (collection.id() == null || !visited.add(collection.id())) {
                        continue;
                    }
                    if (collection.name() != null) {
                        names.add(collection.name());
                    }
                    next.add(collection.id());
                }
            }
            frontier = next;
        }
        return names;
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values != null ? values : List.of();
    }

    /** Composite key; either part may be null. */
    private record Key(String first, Object second) {
    }

    private record Outcome(Object value, RuntimeException failure) {
        static Outcome success(Object value) {
            return new Outcome(value, null);
        }

        static Outcome failure(RuntimeException failure) {
            return new Outcome(null, failure);
        }
    }
}
