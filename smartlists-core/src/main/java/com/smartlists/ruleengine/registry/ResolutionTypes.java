package com.smartlists.ruleengine.registry;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Maps resolution labels to a video height so that Resolution rules compare numerically.
 */
public final class ResolutionTypes {

    private static final Map<String, Integer> HEIGHTS = new LinkedHashMap<>();

    static {
        HEIGHTS.put("480p", 480);
        HEIGHTS.put("576p", 576);
        HEIGHTS.put("720p", 720);
        HEIGHTS.put("1080p", 1080);
        HEIGHTS.put("1440p", 1440);
        HEIGHTS.put("4k", 2160);
        HEIGHTS.put("2160p", 2160);
        HEIGHTS.put("8k", 4320);
        HEIGHTS.put("4320p", 4320);
        // Channel style labels
        HEIGHTS.put("sd", 480);
        HEIGHTS.put("sd (pal)", 576);
        HEIGHTS.put("hd", 720);
        HEIGHTS.put("full hd", 1080);
        HEIGHTS.put("uhd", 2160);
    }

    private ResolutionTypes() {
    }

    /**
     * @param label {@code 1080p}, {@code 4K}, {@code Full HD}, or a plain number of lines
     * @return the height, or empty if the label is unknown
     */
    public static OptionalInt heightOf(String label) {
        if (label == null || label.isBlank()) return OptionalInt.empty();
        String key = label.trim().toLowerCase(Locale.ROOT);
        Integer height = HEIGHTS.get(key);
        if (height != null) {
            return OptionalInt.of(height);
        }
        try {
            int lines = Integer.parseInt(key);
            return lines > 0 ? OptionalInt.of(lines) : OptionalInt.empty();
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }
}
