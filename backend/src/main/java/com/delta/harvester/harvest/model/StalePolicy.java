package com.delta.harvester.harvest.model;

/**
 * What happens to state entries that stop appearing in the listing.
 */
public enum StalePolicy {
    KEEP,
    PRUNE
}
