package com.delta.harvester.harvest.model;

import java.util.List;

public record HarvestRunResult(
    HarvestCursor cursor,
    List<FailedPageEntry> failedPages,
    List<ListingRecord> rows,
    RunStats stats,
    List<Integer> abandonedPages,
    StopReason stopReason
) {
    public HarvestRunResult {
        failedPages = failedPages == null ? List.of() : List.copyOf(failedPages);
        rows = rows == null ? List.of() : List.copyOf(rows);
        abandonedPages = abandonedPages == null ? List.of() : List.copyOf(abandonedPages);
    }
}
