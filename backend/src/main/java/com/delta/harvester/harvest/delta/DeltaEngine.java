package com.delta.harvester.harvest.delta;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.harvest.model.ChangeRecord;
import com.delta.harvester.harvest.model.FieldDiff;
import com.delta.harvester.harvest.model.ListingRecord;
import com.delta.harvester.harvest.model.StateEntry;
import com.delta.harvester.harvest.state.StateStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merges a batch of records into a copy of the state store. Only the significant fields decide
 * whether a known record changed; records missing from the batch are kept as they are.
 */
@Component
public class DeltaEngine {
    private final List<String> significantFields;

    @Autowired
    public DeltaEngine(HarvesterProperties properties) {
        this(properties.getDelta().getSignificantFields());
    }

    public DeltaEngine(List<String> significantFields) {
        this.significantFields = List.copyOf(significantFields);
    }

    public DeltaResult compute(StateStore prior, List<ListingRecord> batch, Instant now) {
        StateStore source = prior == null ? new StateStore() : prior;
        boolean baselineRun = source.isEmpty();
        StateStore next = StateStore.copyOf(source);
        List<ChangeRecord> changes = new ArrayList<>();

        Map<String, ListingRecord> latestByIdentity = new LinkedHashMap<>();
        if (batch != null) {
            for (ListingRecord record : batch) {
                latestByIdentity.put(record.identity(), record);
            }
        }

        for (ListingRecord record : latestByIdentity.values()) {
            Optional<StateEntry> existing = source.get(record.identity());
            if (existing.isEmpty()) {
                next.put(StateEntry.firstObservation(record, now));
                if (!baselineRun) {
                    changes.add(ChangeRecord.added(record));
                }
                continue;
            }
            StateEntry entry = existing.get();
            List<FieldDiff> diffs = diff(entry.record(), record);
            if (diffs.isEmpty()) {
                next.put(entry.observed(entry.record(), now));
            } else {
                next.put(entry.observed(record, now));
                changes.add(ChangeRecord.updated(record, diffs));
            }
        }
        return new DeltaResult(changes, next, baselineRun);
    }

    List<FieldDiff> diff(ListingRecord before, ListingRecord after) {
        List<FieldDiff> diffs = new ArrayList<>();
        for (String field : significantFields) {
            String previous = before.field(field);
            String current = after.field(field);
            if (!previous.equals(current)) {
                diffs.add(new FieldDiff(field, previous, current));
            }
        }
        return diffs;
    }
}
