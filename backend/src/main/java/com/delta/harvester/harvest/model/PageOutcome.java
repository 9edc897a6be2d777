package com.delta.harvester.harvest.model;

import java.util.List;

public record PageOutcome(
    int page,
    OutcomeType type,
    List<ListingRecord> rows,
    FetchErrorKind errorKind,
    String detail,
    int attempts
) {
    public PageOutcome {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static PageOutcome ok(int page, List<ListingRecord> rows) {
        return new PageOutcome(page, OutcomeType.OK, rows, null, null, 1);
    }

    public static PageOutcome empty(int page) {
        return new PageOutcome(page, OutcomeType.EMPTY, List.of(), null, null, 1);
    }

    public static PageOutcome error(int page, FetchErrorKind kind, String detail) {
        return new PageOutcome(page, OutcomeType.ERROR, List.of(), kind, detail, 1);
    }

    public PageOutcome withAttempts(int attempts) {
        return new PageOutcome(page, type, rows, errorKind, detail, attempts);
    }

    public boolean isError() {
        return type == OutcomeType.ERROR;
    }

    public boolean isEmpty() {
        return type == OutcomeType.EMPTY;
    }
}
