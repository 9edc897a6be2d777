package com.delta.harvester.harvest.model;

public record FieldDiff(String field, String before, String after) {
}
