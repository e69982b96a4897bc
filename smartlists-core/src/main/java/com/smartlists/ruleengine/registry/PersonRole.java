package com.smartlists.ruleengine.registry;

import com.smartlists.ruleengine.api.model.PersonCredit;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Person fields and the credit types each one selects.
 */
public enum PersonRole {
    PEOPLE("People", "People (All)", null),
    ACTORS("Actors", "Actors", "Actor"),
    ACTOR_ROLES("ActorRoles", "Actor Roles (Character Names)", "Actor"),
    DIRECTORS("Directors", "Directors", "Director"),
    COMPOSERS("Composers", "Composers", "Composer"),
    WRITERS("Writers", "Writers", "Writer"),
    GUEST_STARS("GuestStars", "Guest Stars", "GuestStar"),
    PRODUCERS("Producers", "Producers", "Producer"),
    CONDUCTORS("Conductors", "Conductors", "Conductor"),
    LYRICISTS("Lyricists", "Lyricists", "Lyricist"),
    ARRANGERS("Arrangers", "Arrangers", "Arranger"),
    SOUND_ENGINEERS("SoundEngineers", "Sound Engineers", "Engineer"),
    MIXERS("Mixers", "Mixers", "Mixer"),
    REMIXERS("Remixers", "Remixers", "Remixer"),
    CREATORS("Creators", "Creators", "Creator"),
    PERSON_ARTISTS("PersonArtists", "Artists (Person Role)", "Artist"),
    PERSON_ALBUM_ARTISTS("PersonAlbumArtists", "Album Artists (Person Role)", "AlbumArtist"),
    AUTHORS("Authors", "Authors", "Author"),
    ILLUSTRATORS("Illustrators", "Illustrators", "Illustrator"),
    PENCILERS("Pencilers", "Pencilers", "Penciller"),
    INKERS("Inkers", "Inkers", "Inker"),
    COLORISTS("Colorists", "Colorists", "Colorist"),
    LETTERERS("Letterers", "Letterers", "Letterer"),
    COVER_ARTISTS("CoverArtists", "Cover Artists", "CoverArtist"),
    EDITORS("Editors", "Editors", "Editor"),
    TRANSLATORS("Translators", "Translators", "Translator");

    private final String fieldName;
    private final String label;
    /** Host credit type; null selects every credit. */
    private final String creditType;

    PersonRole(String fieldName, String label, String creditType) {
        this.fieldName = fieldName;
        this.label = label;
        this.creditType = creditType;
    }

    public String fieldName() {
        return fieldName;
    }

    public String label() {
        return label;
    }

    /**
     * @return the role for a person field name, or null
     */
    public static PersonRole forField(String fieldName) {
        if (fieldName == null) return null;
        for (PersonRole role : values()) {
            if (role.fieldName.equalsIgnoreCase(fieldName)) {
                return role;
            }
        }
        return null;
    }

    /**
     * Values this role extracts from an item's credits: names, or character names
     * for {@link #ACTOR_ROLES}.
     */
    public List<String> select(List<PersonCredit> credits) {
        List<String> values = new ArrayList<>();
        for (PersonCredit credit : credits) {
            if (!matchesType(credit.type())) {
                continue;
            }
            String value = this == ACTOR_ROLES ? credit.role() : credit.name();
            if (value != null && !value.isBlank()) {
                values.add(value);
            }
        }
        return values;
    }

    private boolean matchesType(String type) {
        if (creditType == null) return true;
        if (type == null) return false;
        // Hosts spell some types with spaces ("Guest Star", "Sound Engineer")
        String normalized = type.replace(" ", "").toLowerCase(Locale.ROOT);
        String wanted = creditType.toLowerCase(Locale.ROOT);
        return normalized.equals(wanted)
                || (this == SOUND_ENGINEERS && normalized.equals("soundengineer"))
                || (this == PENCILERS && normalized.equals("penciler"));
    }
}
