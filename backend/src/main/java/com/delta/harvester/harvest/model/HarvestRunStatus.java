package com.delta.harvester.harvest.model;

import java.time.Instant;
import java.util.List;

public record HarvestRunStatus(
    Instant startedAt,
    Instant finishedAt,
    long elapsedMs,
    StopReason stopReason,
    int pagesAttempted,
    int pagesSucceeded,
    List<Integer> errorPages,
    List<Integer> emptyPages,
    List<Integer> abandonedPages,
    int cooldownsUsed,
    boolean baselineComplete,
    int nextPage,
    int failedQueueSize,
    int recordsExtracted,
    int recordsAccepted,
    boolean baselineRun,
    boolean changesSuppressed,
    int newCount,
    int updatedCount,
    int prunedCount,
    int filteredOutCount,
    int stateSize
) {
}
