package com.smartlists.ruleengine.api;

import com.smartlists.ruleengine.api.model.ExternalListResult;

import java.io.IOException;

/**
 * Fetches lists published by an external service (MDBList, Trakt, TMDB, IMDb ...).
 */
public interface ExternalListProvider {

    /**
     * Whether this provider understands the URL.
     */
    boolean canHandle(String url);

    /**
     * Fetches the list.
     *
     * @throws IOException          if the service cannot be reached or answers garbage
     * @throws InterruptedException if the fetching thread is interrupted
     */
    ExternalListResult fetch(String url) throws IOException, InterruptedException;
}
