package com.smartlists.ruleengine.runtime.model;

import java.util.List;
import java.util.Locale;

/**
 * Attributes compared between a reference item and a candidate when scoring similarity.
 */
public enum SimilarityField {
    GENRE("Genre"),
    TAGS("Tags"),
    ACTORS("Actors"),
    ACTOR_ROLES("ActorRoles"),
    WRITERS("Writers"),
    PRODUCERS("Producers"),
    DIRECTORS("Directors"),
    STUDIOS("Studios"),
    AUDIO_LANGUAGES("Audio Languages"),
    NAME("Name"),
    PRODUCTION_YEAR("Production Year"),
    PARENTAL_RATING("Parental Rating");

    public static final List<SimilarityField> DEFAULTS = List.of(GENRE, TAGS);

    private final String id;

    SimilarityField(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public boolean needsPeople() {
        return this == ACTORS || this == ACTOR_ROLES || this == WRITERS
                || this == PRODUCERS || this == DIRECTORS;
    }

    /**
     * @return the field, or null if unknown
     */
    public static SimilarityField fromString(String text) {
        if (text == null) return null;
        String wanted = text.replaceAll("[^A-Za-z]", "").toLowerCase(Locale.ROOT);
        for (SimilarityField field : values()) {
            if (field.id.replaceAll("[^A-Za-z]", "").toLowerCase(Locale.ROOT).equals(wanted)
                    || field.name().replace("_", "").toLowerCase(Locale.ROOT).equals(wanted)) {
                return field;
            }
        }
        return null;
    }
}
