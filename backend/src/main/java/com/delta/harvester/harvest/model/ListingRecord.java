package com.delta.harvester.harvest.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ListingRecord(
    String identity,
    Map<String, String> fields,
    Instant extractedAt
) {
    public ListingRecord {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String field(String name) {
        String value = fields.get(name);
        return value == null ? "" : value;
    }
}
