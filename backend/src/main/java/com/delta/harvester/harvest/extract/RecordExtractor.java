package com.delta.harvester.harvest.extract;

import com.delta.harvester.harvest.model.ListingRecord;

import java.util.List;

public interface RecordExtractor {
    /**
     * Maps one raw listing page to records. A page without records yields an empty list.
     */
    List<ListingRecord> extract(String rawContent);
}
