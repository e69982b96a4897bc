package com.smartlists.ruleengine.runtime.ordering;

import com.smartlists.ruleengine.api.model.MediaItem;
import com.smartlists.ruleengine.api.model.UserItemData;
import com.smartlists.ruleengine.runtime.evaluation.ItemEvaluationException;
import com.smartlists.ruleengine.runtime.external.ExternalListIndex;
import com.smartlists.ruleengine.runtime.extraction.FieldExtractor;
import com.smartlists.ruleengine.runtime.model.SortField;
import com.smartlists.ruleengine.runtime.model.SortSpec;
import com.smartlists.ruleengine.runtime.similarity.SimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;

/**
 * Resolves the sort key tuple of an item.
 *
 * <p>Values are {@link String}, {@link Double}, {@link java.time.Instant}, {@link Integer}
 * or {@link Long}; a missing value is null. A lookup that fails while resolving a key
 * leaves that key null rather than dropping the item, since the item already matched.
 * A failed children lookup during aggregation keeps the container's own value.
 */
public final class SortKeyResolver {
    private static final Logger logger = LoggerFactory.getLogger(SortKeyResolver.class);

    private static final String ARTICLE = "the ";

    private final FieldExtractor extractor;
    private final ChildValueAggregator aggregator;
    private final SimilarityScorer similarity;
    private final ExternalListIndex externalLists;
    private final long randomSeed;

    /**
     * @param similarity    scorer of the run, or null without SimilarTo rules
     * @param externalLists fetched lists of the run, or null without ExternalList rules
     */
    public SortKeyResolver(FieldExtractor extractor, SimilarityScorer similarity,
                           ExternalListIndex externalLists, long randomSeed) {
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.aggregator = new ChildValueAggregator(extractor.cache());
        this.similarity = similarity;
        this.externalLists = externalLists;
        this.randomSeed = randomSeed;
    }

    public List<Object> resolve(SortSpec spec, MediaItem item, int group) {
        List<Object> keys = new ArrayList<>(spec.keys().size());
        for (SortSpec.SortKey key : spec.keys()) {
            Object value;
            try {
                value = value(key.field(), item, group);
            } catch (ItemEvaluationException e) {
                logger.debug("Sort key {} unavailable for item {}: {}", key.field().id(), item.id(), e.getMessage());
                value = null;
            }
            if (key.useChildAggregation() && item.isContainer()) {
                try {
                    value = aggregator.aggregate(item, key.field(), key.descending(), value);
                } catch (ItemEvaluationException e) {
                    logger.debug("Children of {} unavailable for sort key {}, using its own value: {}",
                            item.id(), key.field().id(), e.getMessage());
                }
            }
            keys.add(value);
        }
        return keys;
    }

    private Object value(SortField field, MediaItem item, int group) {
        switch (field) {
            case NAME:
                return item.name();
            case NAME_IGNORE_ARTICLES:
                return stripArticle(item.name());
            case PRODUCTION_YEAR:
            case COMMUNITY_RATING:
            case DATE_CREATED:
            case RELEASE_DATE:
                return ChildValueAggregator.directValue(field, item);
            case CRITIC_RATING:
                return item.criticRating();
            case SIMILARITY:
                return similarity != null ? similarity.score(item) : null;
            case PLAY_COUNT:
                return (double) userData(item).playCount();
            case LAST_PLAYED:
                return userData(item).lastPlayedDate();
            case RUNTIME:
                return item.runtimeTicks() != null ? item.runtimeMinutes() : null;
            case SERIES_NAME:
                return extractor.seriesName(item);
            case SERIES_NAME_IGNORE_ARTICLES:
                return stripArticle(extractor.seriesName(item));
            case ALBUM_NAME:
                return item.album();
            case ARTIST:
                if (!item.albumArtists().isEmpty()) {
                    return item.albumArtists().get(0);
                }
                return item.artists().isEmpty() ? null : item.artists().get(0);
            case TRACK_NUMBER:
            case EPISODE_NUMBER:
                return item.indexNumber() != null ? item.indexNumber().doubleValue() : null;
            case SEASON_NUMBER:
                return item.parentIndexNumber() != null ? item.parentIndexNumber().doubleValue() : null;
            case LAST_EPISODE_AIR_DATE:
                return extractor.lastEpisodeAirDate(item);
            case CHANNEL_RESOLUTION:
                return extractor.resolution(item);
            case RULE_BLOCK_ORDER:
            case RULE_BLOCK_ORDER_INTERLEAVED:
                return group;
            case EXTERNAL_LIST_ORDER:
                return externalLists != null ? externalLists.bestPosition(item) : null;
            case RANDOM:
                return new Random(randomSeed ^ item.id().hashCode()).nextLong();
            case NO_ORDER:
                return null;
            default:
                throw new IllegalStateException("Unhandled sort field: " + field);
        }
    }

    private UserItemData userData(MediaItem item) {
        return extractor.userData(item);
    }

    static String stripArticle(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        if (trimmed.length() > ARTICLE.length() && trimmed.toLowerCase(Locale.ROOT).startsWith(ARTICLE)) {
            return trimmed.substring(ARTICLE.length()).trim();
        }
        return trimmed;
    }
}
