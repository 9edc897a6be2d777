package com.delta.harvester.harvest.delta;

import com.delta.harvester.harvest.model.ChangeKind;
import com.delta.harvester.harvest.model.ChangeRecord;
import com.delta.harvester.harvest.state.StateStore;

import java.util.List;

public record DeltaResult(
    List<ChangeRecord> changes,
    StateStore newState,
    boolean baselineRun
) {
    public DeltaResult {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public long count(ChangeKind kind) {
        return changes.stream().filter(change -> change.kind() == kind).count();
    }
}
