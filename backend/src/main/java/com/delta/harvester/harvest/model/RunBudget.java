package com.delta.harvester.harvest.model;

import java.time.Duration;
import java.time.Instant;

public record RunBudget(Instant deadline) {

    public static RunBudget startingAt(Instant startedAt, Duration maxDuration) {
        return new RunBudget(startedAt.plus(maxDuration));
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(deadline);
    }

    public boolean allows(Instant now, Duration wait) {
        return now.plus(wait).isBefore(deadline);
    }
}
