package com.smartlists.ruleengine.runtime.model;

/**
 * Closed set of value shapes a field can produce. Operator evaluation dispatches
 * on this type instead of inspecting the extracted value.
 */
public enum FieldValueType {
    TEXT,
    NUMERIC,
    DATE,
    BOOLEAN,
    LIST,
    /** Categorical video height, compared numerically. */
    RESOLUTION,
    /** Frames per second, compared numerically. */
    FRAMERATE,
    /** Enumerated per-user state such as playback status. */
    USER_DATA,
    SIMILARITY,
    /** Enumerated single value compared with equality only. */
    SIMPLE;

    public boolean isNumeric() {
        return this == NUMERIC || this == RESOLUTION || this == FRAMERATE;
    }
}
