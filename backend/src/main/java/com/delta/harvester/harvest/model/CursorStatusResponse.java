package com.delta.harvester.harvest.model;

import java.util.List;

public record CursorStatusResponse(
    HarvestCursor cursor,
    List<FailedPageEntry> failedPages
) {
}
