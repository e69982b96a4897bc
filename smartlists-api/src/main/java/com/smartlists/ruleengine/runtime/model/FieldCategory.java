package com.smartlists.ruleengine.runtime.model;

/**
 * UI grouping of fields. Has no influence on evaluation.
 */
public enum FieldCategory {
    CONTENT,
    VIDEO,
    AUDIO,
    RATINGS_PLAYBACK,
    FILE,
    LIBRARY,
    PEOPLE,
    PEOPLE_SUB_FIELDS,
    COLLECTION,
    SIMILARITY_COMPARISON
}
