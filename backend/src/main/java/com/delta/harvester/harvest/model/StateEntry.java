package com.delta.harvester.harvest.model;

import java.time.Instant;

public record StateEntry(
    ListingRecord record,
    Instant firstSeen,
    Instant lastSeen
) {
    public static StateEntry firstObservation(ListingRecord record, Instant seenAt) {
        return new StateEntry(record, seenAt, seenAt);
    }

    public StateEntry observed(ListingRecord latest, Instant seenAt) {
        return new StateEntry(latest, firstSeen, seenAt);
    }
}
