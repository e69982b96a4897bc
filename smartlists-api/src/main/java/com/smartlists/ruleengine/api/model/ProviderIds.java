package com.smartlists.ruleengine.api.model;

/**
 * Provider id keys used in {@link MediaItem#providerIds()}.
 */
public final class ProviderIds {
    public static final String IMDB = "Imdb";
    public static final String TMDB = "Tmdb";
    public static final String TVDB = "Tvdb";

    private ProviderIds() {
    }
}
