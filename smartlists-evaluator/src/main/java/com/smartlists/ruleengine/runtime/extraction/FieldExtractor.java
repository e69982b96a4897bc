package com.smartlists.ruleengine.runtime.extraction;

import com.smartlists.ruleengine.api.model.MediaItem;
import com.smartlists.ruleengine.api.model.MediaStreamInfo;
import com.smartlists.ruleengine.api.model.NextUnwatchedInfo;
import com.smartlists.ruleengine.api.model.SeriesInfo;
import com.smartlists.ruleengine.api.model.UserItemData;
import com.smartlists.ruleengine.cache.EvaluationCache;
import com.smartlists.ruleengine.registry.PersonRole;
import com.smartlists.ruleengine.runtime.model.CompiledExpression;
import com.smartlists.ruleengine.runtime.model.EvaluationContext;
import com.smartlists.ruleengine.runtime.model.ExpressionOptions;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Reads the value a rule tests from an item, going through the {@link EvaluationCache}
 * for everything that needs a host lookup.
 *
 * <p>Values come back in the shape expected by
 * {@link com.smartlists.ruleengine.runtime.operators.OperatorEvaluator}. Similarity and
 * external list rules are not plain values and are resolved by their own services.
 */
public final class FieldExtractor {

    private final EvaluationCache cache;
    private final EvaluationContext context;

    public FieldExtractor(EvaluationCache cache, EvaluationContext context) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    public EvaluationCache cache() {
        return cache;
    }

    public Object extract(CompiledExpression expression, MediaItem item) {
        String field = expression.fieldName();
        ExpressionOptions options = expression.options();
        String userId = options.effectiveUser(context.userId());

        if (expression.field().personField()) {
            PersonRole role = PersonRole.forField(field);
            return role.select(cache.people(item.id()));
        }

        switch (field) {
            // Content
            case "Name":
                return item.name();
            case "SeriesName":
                return seriesName(item);
            case "OfficialRating":
                return item.officialRating();
            case "CustomRating":
                return item.customRating();
            case "Overview":
                return item.overview();
            case "ProductionYear":
                return item.productionYear() != null ? item.productionYear().doubleValue() : null;
            case "ReleaseDate":
                return item.releaseDate();
            case "LastEpisodeAirDate":
                return lastEpisodeAirDate(item);
            case "ProductionLocations":
                return item.productionLocations();
            case "ItemType":
                return item.itemType();
            case "ExtraType":
                return item.extraType();

            // Video
            case "Resolution":
                return resolution(item);
            case "Framerate":
                return video(item) != null ? video(item).framerate() : null;
            case "VideoCodec":
                return video(item) != null ? video(item).codec() : null;
            case "VideoProfile":
                return video(item) != null ? video(item).profile() : null;
            case "VideoRange":
                return video(item) != null ? video(item).videoRange() : null;
            case "VideoRangeType":
                return video(item) != null ? video(item).videoRangeType() : null;

            // Audio
            case "AudioLanguages":
                return audioLanguages(item, options.onlyDefaultAudioLanguage());
            case "SubtitleLanguages":
                return subtitleLanguages(item);
            case "AudioBitrate":
                return number(primaryAudio(item) != null ? primaryAudio(item).bitrate() : null);
            case "AudioSampleRate":
                return number(primaryAudio(item) != null ? primaryAudio(item).sampleRate() : null);
            case "AudioBitDepth":
                return number(primaryAudio(item) != null ? primaryAudio(item).bitDepth() : null);
            case "AudioChannels":
                return number(primaryAudio(item) != null ? primaryAudio(item).channels() : null);
            case "AudioCodec":
                return primaryAudio(item) != null ? primaryAudio(item).codec() : null;
            case "AudioProfile":
                return primaryAudio(item) != null ? primaryAudio(item).profile() : null;

            // Ratings and playback
            case "CommunityRating":
                return item.communityRating();
            case "CriticRating":
                return item.criticRating();
            case "IsFavorite":
                return cache.userData(item.id(), userId).favorite();
            case "PlaybackStatus":
                return cache.userData(item.id(), userId).playbackStatus().id();
            case "LastPlayedDate":
                return cache.userData(item.id(), userId).lastPlayedDate();
            case "PlayCount":
                return (double) cache.userData(item.id(), userId).playCount();
            case "NextUnwatched":
                return isNextUnwatched(item, userId, options.includeUnwatchedSeries());
            case "RuntimeMinutes":
                return item.runtimeTicks() != null ? item.runtimeMinutes() : null;

            // File and library
            case "FileName":
                return item.fileName();
            case "FolderPath":
                return item.folderPath();
            case "DateModified":
                return item.dateModified();
            case "LibraryName":
                return cache.libraryName(item.id());
            case "DateCreated":
                return item.dateCreated();
            case "DateLastRefreshed":
                return item.dateLastRefreshed();
            case "DateLastSaved":
                return item.dateLastSaved();

            // Collections and item lists
            case "Collections":
                return cache.collections(item.id(), options.collectionSearchDepth());
            case "Playlists":
                return cache.playlists(item.id(), userId);
            case "Genres":
                return withParentSeries(item, item.genres(), options.includeParentSeriesGenres(), SeriesInfo::genres);
            case "Studios":
                return withParentSeries(item, item.studios(), options.includeParentSeriesStudios(), SeriesInfo::studios);
            case "Tags":
                return withParentSeries(item, item.tags(), options.includeParentSeriesTags(), SeriesInfo::tags);
            case "Album":
                return item.album();
            case "Artists":
                return item.artists();
            case "AlbumArtists":
                return item.albumArtists();

            default:
                throw new IllegalStateException("No extractor for field " + field);
        }
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // HELPERS
    // ════════════════════════════════════════════════════════════════════════════════

    /**
     * Episodes report their series' name; series report their own.
     */
    public String seriesName(MediaItem item) {
        if (item.isEpisode()) {
            return cache.series(item.seriesId()).map(SeriesInfo::name).orElse(null);
        }
        if ("series".equalsIgnoreCase(item.itemType())) {
            return item.name();
        }
        return null;
    }

    public Instant lastEpisodeAirDate(MediaItem item) {
        String seriesId = item.isEpisode() ? item.seriesId() : item.id();
        if (!item.isEpisode() && !"series".equalsIgnoreCase(item.itemType())) {
            return null;
        }
        return cache.series(seriesId).map(SeriesInfo::lastEpisodeAirDate).orElse(null);
    }

    private MediaStreamInfo.VideoStream video(MediaItem item) {
        return cache.mediaStreams(item.id()).video();
    }

    private MediaStreamInfo.AudioStream primaryAudio(MediaItem item) {
        return cache.mediaStreams(item.id()).primaryAudio();
    }

    /**
     * Video height of the item in lines, or null without a video stream.
     */
    public Double resolution(MediaItem item) {
        return resolutionHeight(cache.mediaStreams(item.id()).video());
    }

    /**
     * Height in lines; widescreen encodes with a short height count by their width.
     */
    static Double resolutionHeight(MediaStreamInfo.VideoStream video) {
        if (video == null) {
            return null;
        }
        int height = video.height() != null ? video.height() : 0;
        int fromWidth = video.width() != null ? video.width() * 9 / 16 : 0;
        int lines = Math.max(height, fromWidth);
        return lines > 0 ? (double) lines : null;
    }

    private List<String> audioLanguages(MediaItem item, boolean onlyDefault) {
        List<String> languages = new ArrayList<>();
        for (MediaStreamInfo.AudioStream stream : cache.mediaStreams(item.id()).audioStreams()) {
            if (stream.language() != null && (!onlyDefault || stream.isDefault())) {
                languages.add(stream.language());
            }
        }
        return languages;
    }

    private List<String> subtitleLanguages(MediaItem item) {
        List<String> languages = new ArrayList<>();
        for (MediaStreamInfo.SubtitleStream stream : cache.mediaStreams(item.id()).subtitleStreams()) {
            if (stream.language() != null) {
                languages.add(stream.language());
            }
        }
        return languages;
    }

    private boolean isNextUnwatched(MediaItem item, String userId, boolean includeUnwatchedSeries) {
        if (!item.isEpisode() || item.seriesId() == null) {
            return false;
        }
        NextUnwatchedInfo next = cache.nextUnwatched(item.seriesId(), userId);
        if (next.episodeId() == null || !next.episodeId().equals(item.id())) {
            return false;
        }
        return next.seriesStarted() || includeUnwatchedSeries;
    }

    private List<String> withParentSeries(MediaItem item, List<String> own, boolean include,
                                          Function<SeriesInfo, List<String>> seriesValues) {
        if (!include || !item.isEpisode()) {
            return own;
        }
        Optional<SeriesInfo> series = cache.series(item.seriesId());
        if (series.isEmpty()) {
            return own;
        }
        Set<String> seen = new LinkedHashSet<>();
        List<String> merged = new ArrayList<>();
        for (String value : own) {
            if (value != null && seen.add(value.toLowerCase(Locale.ROOT))) merged.add(value);
        }
        for (String value : seriesValues.apply(series.get())) {
            if (value != null && seen.add(value.toLowerCase(Locale.ROOT))) merged.add(value);
        }
        return merged;
    }

    /**
     * Per-user data for sort keys, read with the context user.
     */
    public UserItemData userData(MediaItem item) {
        return cache.userData(item.id(), context.userId());
    }

    private static Double number(Integer value) {
        return value != null ? value.doubleValue() : null;
    }
}
