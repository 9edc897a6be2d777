package com.delta.harvester.harvest.filter;

import com.delta.harvester.harvest.model.ListingRecord;

@FunctionalInterface
public interface RecordFilter {
    boolean accepts(ListingRecord record);
}
