package com.delta.harvester.harvest.model;

public record HarvestCursor(int nextPage, boolean baselineComplete) {
    public HarvestCursor {
        nextPage = Math.max(1, nextPage);
    }

    public static HarvestCursor initial() {
        return new HarvestCursor(1, false);
    }
}
