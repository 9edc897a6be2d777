package com.delta.harvester.harvest.model;

import java.util.List;

public record RunStats(
    int pagesAttempted,
    int pagesSucceeded,
    List<Integer> errorPages,
    List<Integer> emptyPages,
    int cooldownsUsed
) {
    public RunStats {
        errorPages = errorPages == null ? List.of() : List.copyOf(errorPages);
        emptyPages = emptyPages == null ? List.of() : List.copyOf(emptyPages);
    }
}
