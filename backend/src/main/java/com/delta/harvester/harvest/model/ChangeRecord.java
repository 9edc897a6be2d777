package com.delta.harvester.harvest.model;

import java.util.List;

public record ChangeRecord(
    ListingRecord record,
    ChangeKind kind,
    List<FieldDiff> fieldDiffs
) {
    public ChangeRecord {
        fieldDiffs = fieldDiffs == null ? List.of() : List.copyOf(fieldDiffs);
    }

    public static ChangeRecord added(ListingRecord record) {
        return new ChangeRecord(record, ChangeKind.NEW, List.of());
    }

    public static ChangeRecord updated(ListingRecord record, List<FieldDiff> fieldDiffs) {
        return new ChangeRecord(record, ChangeKind.UPDATED, fieldDiffs);
    }
}
