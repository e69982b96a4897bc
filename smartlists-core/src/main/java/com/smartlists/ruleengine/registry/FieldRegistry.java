/*
 * Copyright (c) 2025 SmartLists Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.smartlists.ruleengine.registry;

import com.smartlists.ruleengine.runtime.model.ExtractionGroup;
import com.smartlists.ruleengine.runtime.model.FieldCategory;
import com.smartlists.ruleengine.runtime.model.FieldMetadata;
import com.smartlists.ruleengine.runtime.model.FieldValueType;
import com.smartlists.ruleengine.runtime.model.Operator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.smartlists.ruleengine.runtime.model.Operator.*;

/**
 * Catalog of every filterable attribute.
 *
 * <p>Single source of truth for field value types, allowed operators and extraction
 * cost. Rule validation, field listings and the pipeline's expensive-field detection
 * all read from here.
 *
 * <h2>Thread Safety</h2>
 * <p>Built once in the static initializer and never mutated afterwards, so concurrent
 * unsynchronized reads are safe.
 *
 * <h2>Adding a field</h2>
 * <p>Declare value type, category, operator set and extraction group together in
 * {@link #buildStandardFields()}. A field with an expensive group also needs an
 * evaluation cache table and an extractor branch.
 */
public final class FieldRegistry {

    // ════════════════════════════════════════════════════════════════════════════════
    // OPERATOR SETS
    // ════════════════════════════════════════════════════════════════════════════════

    public static final List<Operator> STRING_OPERATORS =
            List.of(EQUAL, NOT_EQUAL, CONTAINS, NOT_CONTAINS, IS_IN, IS_NOT_IN, MATCH_REGEX);
    public static final List<Operator> MULTI_VALUE_OPERATORS =
            List.of(CONTAINS, NOT_CONTAINS, IS_IN, IS_NOT_IN, MATCH_REGEX);
    public static final List<Operator> NUMERIC_OPERATORS =
            List.of(EQUAL, NOT_EQUAL, GREATER_THAN, LESS_THAN, GREATER_THAN_OR_EQUAL, LESS_THAN_OR_EQUAL);
    public static final List<Operator> DATE_OPERATORS =
            List.of(EQUAL, NOT_EQUAL, AFTER, BEFORE, NEWER_THAN, OLDER_THAN, WEEKDAY);
    public static final List<Operator> BOOLEAN_OPERATORS = List.of(EQUAL, NOT_EQUAL);
    public static final List<Operator> SIMPLE_OPERATORS = List.of(EQUAL, NOT_EQUAL);
    public static final List<Operator> SIMILARITY_OPERATORS = List.of(EQUAL, CONTAINS, IS_IN, MATCH_REGEX);

    private static final FieldRegistry STANDARD = new FieldRegistry(buildStandardFields());

    // ════════════════════════════════════════════════════════════════════════════════
    // INSTANCE STATE
    // ════════════════════════════════════════════════════════════════════════════════

    /** Keyed by lower-cased name; iteration follows registration order. */
    private final Map<String, FieldMetadata> fields;
    private final Map<FieldCategory, List<FieldMetadata>> fieldsByCategory;

    private FieldRegistry(List<FieldMetadata> definitions) {
        Map<String, FieldMetadata> byName = new LinkedHashMap<>();
        Map<FieldCategory, List<FieldMetadata>> byCategory = new EnumMap<>(FieldCategory.class);
        for (FieldMetadata field : definitions) {
            FieldMetadata previous = byName.put(key(field.name()), field);
            if (previous != null) {
                throw new IllegalStateException("Duplicate field name: " + field.name());
            }
            byCategory.computeIfAbsent(field.category(), c -> new ArrayList<>()).add(field);
        }
        byCategory.replaceAll((c, list) -> List.copyOf(list));
        this.fields = Collections.unmodifiableMap(byName);
        this.fieldsByCategory = Collections.unmodifiableMap(byCategory);
    }

    /**
     * The process-wide registry.
     */
    public static FieldRegistry standard() {
        return STANDARD;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // LOOKUPS
    // ════════════════════════════════════════════════════════════════════════════════

    public Optional<FieldMetadata> lookup(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(fields.get(key(name)));
    }

    public boolean contains(String name) {
        return lookup(name).isPresent();
    }

    /**
     * @return allowed operators in display order, empty if the field is unknown
     */
    public List<Operator> operatorsFor(String name) {
        return lookup(name).map(FieldMetadata::allowedOperators).orElse(List.of());
    }

    /**
     * @return extraction bitset, {@link ExtractionGroup#NONE} if the field is unknown
     */
    public int extractionGroupOf(String name) {
        return lookup(name).map(FieldMetadata::extractionGroup).orElse(ExtractionGroup.NONE);
    }

    public boolean isExpensive(String name) {
        return ExtractionGroup.isExpensive(extractionGroupOf(name));
    }

    public List<FieldMetadata> allFields() {
        return List.copyOf(fields.values());
    }

    public Map<FieldCategory, List<FieldMetadata>> fieldsByCategory() {
        return fieldsByCategory;
    }

    public List<FieldMetadata> fieldsInGroup(ExtractionGroup group) {
        return fields.values().stream()
                .filter(f -> group.isIn(f.extractionGroup()))
                .toList();
    }

    /**
     * Field name to allowed operator ids, as consumed by definition editors.
     */
    public Map<String, List<String>> fieldOperatorsDictionary() {
        Map<String, List<String>> dictionary = new LinkedHashMap<>();
        fields.values().forEach(f -> dictionary.put(f.name(),
                f.allowedOperators().stream().map(Operator::id).toList()));
        return dictionary;
    }

    public int size() {
        return fields.size();
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // STANDARD FIELD TABLE
    // ════════════════════════════════════════════════════════════════════════════════

    private static List<FieldMetadata> buildStandardFields() {
        List<FieldMetadata> f = new ArrayList<>();

        // Content
        add(f, "Name", "Name", FieldValueType.TEXT, FieldCategory.CONTENT, STRING_OPERATORS);
        add(f, "SeriesName", "Series Name", FieldValueType.TEXT, FieldCategory.CONTENT, STRING_OPERATORS,
                ExtractionGroup.SERIES_NAME);
        add(f, "SimilarTo", "Similar To", FieldValueType.SIMILARITY, FieldCategory.CONTENT, SIMILARITY_OPERATORS,
                ExtractionGroup.SIMILAR_TO);
        add(f, "OfficialRating", "Parental Rating", FieldValueType.TEXT, FieldCategory.CONTENT, STRING_OPERATORS);
        add(f, "CustomRating", "Custom Rating", FieldValueType.TEXT, FieldCategory.CONTENT, STRING_OPERATORS);
        add(f, "Overview", "Overview", FieldValueType.TEXT, FieldCategory.CONTENT, STRING_OPERATORS,
                ExtractionGroup.TEXT_CONTENT);
        add(f, "ProductionYear", "Production Year", FieldValueType.NUMERIC, FieldCategory.CONTENT, NUMERIC_OPERATORS,
                ExtractionGroup.DATES);
        add(f, "ReleaseDate", "Release Date", FieldValueType.DATE, FieldCategory.CONTENT, DATE_OPERATORS,
                ExtractionGroup.DATES);
        add(f, "LastEpisodeAirDate", "Last Episode Air Date", FieldValueType.DATE, FieldCategory.CONTENT,
                DATE_OPERATORS, ExtractionGroup.LAST_EPISODE_AIR_DATE);
        add(f, "ProductionLocations", "Production Locations", FieldValueType.LIST, FieldCategory.CONTENT,
                MULTI_VALUE_OPERATORS, ExtractionGroup.TEXT_CONTENT);

        // Video
        add(f, "Resolution", "Resolution", FieldValueType.RESOLUTION, FieldCategory.VIDEO, NUMERIC_OPERATORS,
                ExtractionGroup.VIDEO_QUALITY);
        add(f, "Framerate", "Framerate", FieldValueType.FRAMERATE, FieldCategory.VIDEO, NUMERIC_OPERATORS,
                ExtractionGroup.VIDEO_QUALITY);
        add(f, "VideoCodec", "Video Codec", FieldValueType.TEXT, FieldCategory.VIDEO, STRING_OPERATORS,
                ExtractionGroup.VIDEO_QUALITY);
        add(f, "VideoProfile", "Video Profile", FieldValueType.TEXT, FieldCategory.VIDEO, STRING_OPERATORS,
                ExtractionGroup.VIDEO_QUALITY);
        add(f, "VideoRange", "Video Range", FieldValueType.TEXT, FieldCategory.VIDEO, STRING_OPERATORS,
                ExtractionGroup.VIDEO_QUALITY);
        add(f, "VideoRangeType", "Video Range Type", FieldValueType.TEXT, FieldCategory.VIDEO, STRING_OPERATORS,
                ExtractionGroup.VIDEO_QUALITY);

        // Audio
        add(f, "AudioLanguages", "Audio Languages", FieldValueType.LIST, FieldCategory.AUDIO, MULTI_VALUE_OPERATORS,
                ExtractionGroup.AUDIO_LANGUAGES);
        add(f, "SubtitleLanguages", "Subtitle Languages", FieldValueType.LIST, FieldCategory.AUDIO,
                MULTI_VALUE_OPERATORS, ExtractionGroup.AUDIO_LANGUAGES);
        add(f, "AudioBitrate", "Audio Bitrate (kbps)", FieldValueType.NUMERIC, FieldCategory.AUDIO, NUMERIC_OPERATORS,
                ExtractionGroup.AUDIO_QUALITY);
        add(f, "AudioSampleRate", "Audio Sample Rate (Hz)", FieldValueType.NUMERIC, FieldCategory.AUDIO,
                NUMERIC_OPERATORS, ExtractionGroup.AUDIO_QUALITY);
        add(f, "AudioBitDepth", "Audio Bit Depth", FieldValueType.NUMERIC, FieldCategory.AUDIO, NUMERIC_OPERATORS,
                ExtractionGroup.AUDIO_QUALITY);
        add(f, "AudioCodec", "Audio Codec", FieldValueType.TEXT, FieldCategory.AUDIO, STRING_OPERATORS,
                ExtractionGroup.AUDIO_QUALITY);
        add(f, "AudioProfile", "Audio Profile", FieldValueType.TEXT, FieldCategory.AUDIO, STRING_OPERATORS,
                ExtractionGroup.AUDIO_QUALITY);
        add(f, "AudioChannels", "Audio Channels", FieldValueType.NUMERIC, FieldCategory.AUDIO, NUMERIC_OPERATORS,
                ExtractionGroup.AUDIO_QUALITY);

        // Ratings and playback
        add(f, "CommunityRating", "Community Rating", FieldValueType.NUMERIC, FieldCategory.RATINGS_PLAYBACK,
                NUMERIC_OPERATORS);
        add(f, "CriticRating", "Critic Rating", FieldValueType.NUMERIC, FieldCategory.RATINGS_PLAYBACK,
                NUMERIC_OPERATORS);
        addUser(f, "IsFavorite", "Is Favorite", FieldValueType.BOOLEAN, BOOLEAN_OPERATORS, ExtractionGroup.USER_DATA);
        addUser(f, "PlaybackStatus", "Playback Status", FieldValueType.USER_DATA, SIMPLE_OPERATORS,
                ExtractionGroup.USER_DATA);
        addUser(f, "LastPlayedDate", "Last Played", FieldValueType.DATE, DATE_OPERATORS, ExtractionGroup.USER_DATA);
        addUser(f, "NextUnwatched", "Next Unwatched", FieldValueType.BOOLEAN, BOOLEAN_OPERATORS,
                ExtractionGroup.NEXT_UNWATCHED);
        addUser(f, "PlayCount", "Play Count", FieldValueType.NUMERIC, NUMERIC_OPERATORS, ExtractionGroup.USER_DATA);
        add(f, "RuntimeMinutes", "Runtime (Minutes)", FieldValueType.NUMERIC, FieldCategory.RATINGS_PLAYBACK,
                NUMERIC_OPERATORS, ExtractionGroup.TEXT_CONTENT);

        // File
        add(f, "FileName", "File Name", FieldValueType.TEXT, FieldCategory.FILE, STRING_OPERATORS,
                ExtractionGroup.FILE_INFO);
        add(f, "FolderPath", "Folder Path", FieldValueType.TEXT, FieldCategory.FILE, STRING_OPERATORS,
                ExtractionGroup.FILE_INFO);
        add(f, "DateModified", "Date Modified", FieldValueType.DATE, FieldCategory.FILE, DATE_OPERATORS,
                ExtractionGroup.FILE_INFO);

        // Library
        add(f, "LibraryName", "Library Name", FieldValueType.TEXT, FieldCategory.LIBRARY, STRING_OPERATORS,
                ExtractionGroup.LIBRARY_INFO);
        add(f, "DateCreated", "Date Added to Library", FieldValueType.DATE, FieldCategory.LIBRARY, DATE_OPERATORS,
                ExtractionGroup.DATES);
        add(f, "DateLastRefreshed", "Last Metadata Refresh", FieldValueType.DATE, FieldCategory.LIBRARY,
                DATE_OPERATORS, ExtractionGroup.DATES);
        add(f, "DateLastSaved", "Last Database Save", FieldValueType.DATE, FieldCategory.LIBRARY, DATE_OPERATORS,
                ExtractionGroup.DATES);

        // Collections and item lists
        add(f, "Collections", "Collection name", FieldValueType.LIST, FieldCategory.COLLECTION, MULTI_VALUE_OPERATORS,
                ExtractionGroup.COLLECTIONS);
        add(f, "Playlists", "Playlist name", FieldValueType.LIST, FieldCategory.COLLECTION, MULTI_VALUE_OPERATORS,
                ExtractionGroup.PLAYLISTS);
        add(f, "Genres", "Genres", FieldValueType.LIST, FieldCategory.COLLECTION, MULTI_VALUE_OPERATORS,
                ExtractionGroup.ITEM_LISTS);
        add(f, "Studios", "Studios", FieldValueType.LIST, FieldCategory.COLLECTION, MULTI_VALUE_OPERATORS,
                ExtractionGroup.ITEM_LISTS);
        add(f, "Tags", "Tags", FieldValueType.LIST, FieldCategory.COLLECTION, MULTI_VALUE_OPERATORS,
                ExtractionGroup.ITEM_LISTS);
        add(f, "Album", "Album", FieldValueType.TEXT, FieldCategory.COLLECTION, STRING_OPERATORS,
                ExtractionGroup.AUDIO_METADATA);
        add(f, "Artists", "Artists", FieldValueType.LIST, FieldCategory.COLLECTION, MULTI_VALUE_OPERATORS,
                ExtractionGroup.AUDIO_METADATA);
        add(f, "AlbumArtists", "Album Artists", FieldValueType.LIST, FieldCategory.COLLECTION, MULTI_VALUE_OPERATORS,
                ExtractionGroup.AUDIO_METADATA);
        add(f, "ExternalList", "External List", FieldValueType.LIST, FieldCategory.COLLECTION, SIMPLE_OPERATORS,
                ExtractionGroup.EXTERNAL_LISTS);

        // Simple
        add(f, "ItemType", "Item Type", FieldValueType.SIMPLE, FieldCategory.CONTENT, SIMPLE_OPERATORS);
        add(f, "ExtraType", "Extra Type", FieldValueType.SIMPLE, FieldCategory.CONTENT, SIMPLE_OPERATORS);

        // People, all served by the people lookup
        for (PersonRole role : PersonRole.values()) {
            f.add(new FieldMetadata(role.fieldName(), role.label(), FieldValueType.LIST,
                    FieldCategory.PEOPLE_SUB_FIELDS, ExtractionGroup.PEOPLE.bit(), MULTI_VALUE_OPERATORS,
                    false, true));
        }

        return f;
    }

    private static void add(List<FieldMetadata> fields, String name, String label, FieldValueType type,
                            FieldCategory category, List<Operator> operators) {
        fields.add(new FieldMetadata(name, label, type, category, ExtractionGroup.NONE, operators, false, false));
    }

    private static void add(List<FieldMetadata> fields, String name, String label, FieldValueType type,
                            FieldCategory category, List<Operator> operators, ExtractionGroup group) {
        fields.add(new FieldMetadata(name, label, type, category, group.bit(), operators, false, false));
    }

    private static void addUser(List<FieldMetadata> fields, String name, String label, FieldValueType type,
                                List<Operator> operators, ExtractionGroup group) {
        fields.add(new FieldMetadata(name, label, type, FieldCategory.RATINGS_PLAYBACK, group.bit(), operators,
                true, false));
    }
}
