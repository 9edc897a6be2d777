package com.delta.harvester.harvest.model;

public record FailedPageEntry(int page, int attempts) {
}
