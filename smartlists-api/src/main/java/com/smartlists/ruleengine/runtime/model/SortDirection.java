package com.smartlists.ruleengine.runtime.model;

public enum SortDirection {
    ASCENDING,
    DESCENDING;

    /**
     * @return the direction, or null if the text is neither ascending nor descending
     */
    public static SortDirection fromString(String text) {
        if (text == null) return null;
        String t = text.trim();
        if (t.equalsIgnoreCase("Ascending") || t.equalsIgnoreCase("Asc")) return ASCENDING;
        if (t.equalsIgnoreCase("Descending") || t.equalsIgnoreCase("Desc")) return DESCENDING;
        return null;
    }
}
