package com.smartlists.ruleengine.api;

import com.smartlists.ruleengine.api.model.MediaItem;

import java.util.ArrayList;
import java.util.List;

/**
 * Pull-based supplier of candidate items, read in batches to bound memory on
 * large catalogs.
 *
 * <p>A run may read the source more than once: lists with SimilarTo rules make a
 * reference pass over every candidate before the filtering pass. Both passes must
 * see the same items in the same order.
 */
public interface CandidateSource {

    /**
     * Number of candidates the source will deliver.
     */
    long totalCount();

    /**
     * Returns up to {@code limit} items starting at {@code offset}. An empty list
     * before {@link #totalCount()} items were delivered is a run-level failure.
     */
    List<MediaItem> fetchBatch(long offset, int limit);

    /**
     * Wraps an in-memory list.
     */
    static CandidateSource of(List<MediaItem> items) {
        List<MediaItem> snapshot = new ArrayList<>(items);
        return new CandidateSource() {
            @Override
            public long totalCount() {
                return snapshot.size();
            }

            @Override
            public List<MediaItem> fetchBatch(long offset, int limit) {
                int from = (int) Math.min(offset, snapshot.size());
                int to = (int) Math.min(offset + limit, snapshot.size());
                return snapshot.subList(from, to);
            }
        };
    }
}
