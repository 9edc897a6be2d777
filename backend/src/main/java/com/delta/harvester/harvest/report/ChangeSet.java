package com.delta.harvester.harvest.report;

import com.delta.harvester.harvest.model.ChangeKind;
import com.delta.harvester.harvest.model.ChangeRecord;
import com.delta.harvester.harvest.state.StateStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record ChangeSet(
    Instant generatedAt,
    List<ChangeRecord> changes,
    List<String> prunedIdentities,
    List<String> filteredOutIdentities,
    StateStore state,
    boolean baselineRun,
    boolean suppressed
) {
    public ChangeSet {
        changes = changes == null ? List.of() : List.copyOf(changes);
        prunedIdentities = prunedIdentities == null ? List.of() : List.copyOf(prunedIdentities);
        filteredOutIdentities = filteredOutIdentities == null ? List.of() : List.copyOf(filteredOutIdentities);
    }

    /** Identities that left the state this run, filtered out first, then pruned. */
    public List<String> removedIdentities() {
        List<String> removed = new ArrayList<>(filteredOutIdentities);
        removed.addAll(prunedIdentities);
        return removed;
    }

    public List<ChangeRecord> ofKind(ChangeKind kind) {
        return changes.stream().filter(change -> change.kind() == kind).toList();
    }
}
