package com.delta.harvester.harvest.fetch;

import com.delta.harvester.harvest.model.FetchResult;

public interface PageFetcher {
    /**
     * Fetches one listing page. Transport problems are reported in the result, not thrown.
     */
    FetchResult fetch(int page);

    /**
     * Drops the current session so the next fetch starts with a fresh identity.
     */
    void recycle();
}
