package com.smartlists.ruleengine.api.model;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of a catalog item as supplied by the host.
 *
 * <p>Only direct properties live here. Anything that needs a host lookup
 * (people, collection membership, stream facts, series aggregates, per-user state)
 * is fetched through {@link com.smartlists.ruleengine.api.CatalogLookups} and memoized
 * per run.
 *
 * <p>The engine never mutates items; it filters, orders and slices them.
 */
public final class MediaItem {

    /** Runtime ticks per minute (one tick is 100 ns). */
    public static final long TICKS_PER_MINUTE = 600_000_000L;

    private static final Set<String> CONTAINER_TYPES = Set.of(
            "boxset", "playlist", "folder", "collectionfolder", "series", "season", "musicalbum");

    private final String id;
    private final String name;
    private final String itemType;
    private final String extraType;
    private final String seriesId;
    private final String officialRating;
    private final String customRating;
    private final String overview;
    private final Integer productionYear;
    private final Instant releaseDate;
    private final Double communityRating;
    private final Double criticRating;
    private final Long runtimeTicks;
    private final String path;
    private final Instant dateModified;
    private final Instant dateCreated;
    private final Instant dateLastRefreshed;
    private final Instant dateLastSaved;
    private final List<String> productionLocations;
    private final List<String> genres;
    private final List<String> studios;
    private final List<String> tags;
    private final String album;
    private final List<String> artists;
    private final List<String> albumArtists;
    private final Integer indexNumber;
    private final Integer parentIndexNumber;
    private final Map<String, String> providerIds;

    private MediaItem(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.name = b.name;
        this.itemType = b.itemType;
        this.extraType = b.extraType;
        this.seriesId = b.seriesId;
        this.officialRating = b.officialRating;
        this.customRating = b.customRating;
        this.overview = b.overview;
        this.productionYear = b.productionYear;
        this.releaseDate = b.releaseDate;
        this.communityRating = b.communityRating;
        this.criticRating = b.criticRating;
        this.runtimeTicks = b.runtimeTicks;
        this.path = b.path;
        this.dateModified = b.dateModified;
        this.dateCreated = b.dateCreated;
        this.dateLastRefreshed = b.dateLastRefreshed;
        this.dateLastSaved = b.dateLastSaved;
        this.productionLocations = copy(b.productionLocations);
        this.genres = copy(b.genres);
        this.studios = copy(b.studios);
        this.tags = copy(b.tags);
        this.album = b.album;
        this.artists = copy(b.artists);
        this.albumArtists = copy(b.albumArtists);
        this.indexNumber = b.indexNumber;
        this.parentIndexNumber = b.parentIndexNumber;
        this.providerIds = b.providerIds != null ? Map.copyOf(b.providerIds) : Map.of();
    }

    private static List<String> copy(List<String> values) {
        return values != null ? List.copyOf(values) : List.of();
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String id() { return id; }
    public String name() { return name; }
    public String itemType() { return itemType; }
    public String extraType() { return extraType; }
    public String seriesId() { return seriesId; }
    public String officialRating() { return officialRating; }
    public String customRating() { return customRating; }
    public String overview() { return overview; }
    public Integer productionYear() { return productionYear; }
    public Instant releaseDate() { return releaseDate; }
    public Double communityRating() { return communityRating; }
    public Double criticRating() { return criticRating; }
    public Long runtimeTicks() { return runtimeTicks; }
    public String path() { return path; }
    public Instant dateModified() { return dateModified; }
    public Instant dateCreated() { return dateCreated; }
    public Instant dateLastRefreshed() { return dateLastRefreshed; }
    public Instant dateLastSaved() { return dateLastSaved; }
    public List<String> productionLocations() { return productionLocations; }
    public List<String> genres() { return genres; }
    public List<String> studios() { return studios; }
    public List<String> tags() { return tags; }
    public String album() { return album; }
    public List<String> artists() { return artists; }
    public List<String> albumArtists() { return albumArtists; }
    /** Episode number for episodes, track number for audio. */
    public Integer indexNumber() { return indexNumber; }
    /** Season number for episodes, disc number for audio. */
    public Integer parentIndexNumber() { return parentIndexNumber; }
    public Map<String, String> providerIds() { return providerIds; }

    public boolean isEpisode() {
        return "episode".equalsIgnoreCase(itemType);
    }

    public boolean isExtra() {
        return extraType != null && !extraType.isBlank();
    }

    /**
     * Items that hold other items and can aggregate their children's values.
     */
    public boolean isContainer() {
        return itemType != null && CONTAINER_TYPES.contains(itemType.toLowerCase(Locale.ROOT));
    }

    /**
     * Runtime in minutes, 0 when unknown.
     */
    public double runtimeMinutes() {
        return runtimeTicks != null && runtimeTicks > 0 ? (double) runtimeTicks / TICKS_PER_MINUTE : 0.0;
    }

    public String fileName() {
        if (path == null) return null;
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    public String folderPath() {
        if (path == null) return null;
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return slash > 0 ? path.substring(0, slash) : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MediaItem)) return false;
        return id.equals(((MediaItem) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "MediaItem{id=" + id + ", name=" + name + ", type=" + itemType + "}";
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String itemType;
        private String extraType;
        private String seriesId;
        private String officialRating;
        private String customRating;
        private String overview;
        private Integer productionYear;
        private Instant releaseDate;
        private Double communityRating;
        private Double criticRating;
        private Long runtimeTicks;
        private String path;
        private Instant dateModified;
        private Instant dateCreated;
        private Instant dateLastRefreshed;
        private Instant dateLastSaved;
        private List<String> productionLocations = List.of();
        private List<String> genres = List.of();
        private List<String> studios = List.of();
        private List<String> tags = List.of();
        private String album;
        private List<String> artists = List.of();
        private List<String> albumArtists = List.of();
        private Integer indexNumber;
        private Integer parentIndexNumber;
        private Map<String, String> providerIds = Map.of();

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) { this.name = name; return this; }
        public Builder itemType(String itemType) { this.itemType = itemType; return this; }
        public Builder extraType(String extraType) { this.extraType = extraType; return this; }
        public Builder seriesId(String seriesId) { this.seriesId = seriesId; return this; }
        public Builder officialRating(String officialRating) { this.officialRating = officialRating; return this; }
        public Builder customRating(String customRating) { this.customRating = customRating; return this; }
        public Builder overview(String overview) { this.overview = overview; return this; }
        public Builder productionYear(Integer productionYear) { this.productionYear = productionYear; return this; }
        public Builder releaseDate(Instant releaseDate) { this.releaseDate = releaseDate; return this; }
        public Builder communityRating(Double communityRating) { this.communityRating = communityRating; return this; }
        public Builder criticRating(Double criticRating) { this.criticRating = criticRating; return this; }
        public Builder runtimeTicks(Long runtimeTicks) { this.runtimeTicks = runtimeTicks; return this; }
        public Builder path(String path) { this.path = path; return this; }
        public Builder dateModified(Instant dateModified) { this.dateModified = dateModified; return this; }
        public Builder dateCreated(Instant dateCreated) { this.dateCreated = dateCreated; return this; }
        public Builder dateLastRefreshed(Instant dateLastRefreshed) { this.dateLastRefreshed = dateLastRefreshed; return this; }
        public Builder dateLastSaved(Instant dateLastSaved) { this.dateLastSaved = dateLastSaved; return this; }
        public Builder productionLocations(List<String> values) { this.productionLocations = values; return this; }
        public Builder genres(List<String> genres) { this.genres = genres; return this; }
        public Builder studios(List<String> studios) { this.studios = studios; return this; }
        public Builder tags(List<String> tags) { this.tags = tags; return this; }
        public Builder album(String album) { this.album = album; return this; }
        public Builder artists(List<String> artists) { this.artists = artists; return this; }
        public Builder albumArtists(List<String> albumArtists) { this.albumArtists = albumArtists; return this; }
        public Builder indexNumber(Integer indexNumber) { this.indexNumber = indexNumber; return this; }
        public Builder parentIndexNumber(Integer parentIndexNumber) { this.parentIndexNumber = parentIndexNumber; return this; }
        public Builder providerIds(Map<String, String> providerIds) { this.providerIds = providerIds; return this; }

        /**
         * Convenience for runtimes given in minutes.
         */
        public Builder runtimeMinutes(double minutes) {
            this.runtimeTicks = Math.round(minutes * TICKS_PER_MINUTE);
            return this;
        }

        public MediaItem build() {
            return new MediaItem(this);
        }
    }
}
