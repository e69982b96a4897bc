package com.smartlists.ruleengine.api.model;

import java.util.Locale;

public enum PlaybackStatus {
    PLAYED("Played"),
    UNPLAYED("Unplayed"),
    IN_PROGRESS("InProgress");

    private final String id;

    PlaybackStatus(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * @return the status, or null if unknown
     */
    public static PlaybackStatus fromString(String text) {
        if (text == null) return null;
        String wanted = text.replaceAll("[^A-Za-z]", "").toLowerCase(Locale.ROOT);
        for (PlaybackStatus status : values()) {
            if (status.id.toLowerCase(Locale.ROOT).equals(wanted)) {
                return status;
            }
        }
        return null;
    }
}
