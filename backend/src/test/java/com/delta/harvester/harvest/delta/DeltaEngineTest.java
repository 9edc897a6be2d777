package com.delta.harvester.harvest.delta;

import com.delta.harvester.harvest.model.ChangeKind;
import com.delta.harvester.harvest.model.ChangeRecord;
import com.delta.harvester.harvest.model.FieldDiff;
import com.delta.harvester.harvest.model.ListingRecord;
import com.delta.harvester.harvest.model.StateEntry;
import com.delta.harvester.harvest.state.StateStore;
import com.delta.harvester.harvest.support.TestRecords;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DeltaEngineTest {
    private static final Instant T1 = Instant.parse("2026-03-01T06:00:00Z");
    private static final Instant T2 = Instant.parse("2026-03-02T06:00:00Z");

    private final DeltaEngine engine = new DeltaEngine(List.of("phase", "construction_type", "address", "object"));

    @Test
    void firstRunSeedsStateWithoutReportingChanges() {
        DeltaResult result = engine.compute(new StateStore(), List.of(iecere("A"), iecere("B"), iecere("C")), T1);

        assertThat(result.baselineRun()).isTrue();
        assertThat(result.changes()).isEmpty();
        assertThat(result.newState().size()).isEqualTo(3);
        assertThat(result.newState().get("key:A").orElseThrow().firstSeen()).isEqualTo(T1);
    }

    @Test
    void phaseChangeIsReportedAndFirstSeenIsPreserved() {
        StateStore prior = engine.compute(new StateStore(), List.of(iecere("BIS-7")), T1).newState();

        ListingRecord moved = TestRecords.record("BIS-7", "phase", "Būvdarbi", "address", "Jomas iela 1");
        DeltaResult result = engine.compute(prior, List.of(moved), T2);

        assertThat(result.changes()).hasSize(1);
        ChangeRecord change = result.changes().get(0);
        assertThat(change.kind()).isEqualTo(ChangeKind.UPDATED);
        assertThat(change.fieldDiffs()).containsExactly(new FieldDiff("phase", "Iecere", "Būvdarbi"));
        StateEntry entry = result.newState().get("key:BIS-7").orElseThrow();
        assertThat(entry.firstSeen()).isEqualTo(T1);
        assertThat(entry.lastSeen()).isEqualTo(T2);
        assertThat(entry.record().field("phase")).isEqualTo("Būvdarbi");
    }

    @Test
    void recomputingTheSameBatchIsIdempotent() {
        List<ListingRecord> batch = List.of(iecere("A"), iecere("B"));
        StateStore prior = engine.compute(new StateStore(), batch, T1).newState();

        DeltaResult again = engine.compute(prior, batch, T2);

        assertThat(again.baselineRun()).isFalse();
        assertThat(again.changes()).isEmpty();
        assertThat(again.newState().asMap().keySet()).isEqualTo(prior.asMap().keySet());
        assertThat(again.newState().get("key:A").orElseThrow().lastSeen()).isEqualTo(T2);
    }

    @Test
    void partialScansNeverRemoveKnownRecords() {
        StateStore prior = engine.compute(new StateStore(), List.of(iecere("A"), iecere("B"), iecere("C")), T1).newState();

        DeltaResult result = engine.compute(prior, List.of(iecere("A")), T2);

        assertThat(result.newState().size()).isEqualTo(3);
        assertThat(result.newState().get("key:C").orElseThrow().lastSeen()).isEqualTo(T1);
        assertThat(prior.get("key:A").orElseThrow().lastSeen()).isEqualTo(T1);
    }

    @Test
    void unknownRecordAfterBaselineIsNew() {
        StateStore prior = engine.compute(new StateStore(), List.of(iecere("A")), T1).newState();

        DeltaResult result = engine.compute(prior, List.of(iecere("A"), iecere("D")), T2);

        assertThat(result.count(ChangeKind.NEW)).isEqualTo(1);
        assertThat(result.changes().get(0).record().identity()).isEqualTo("key:D");
    }

    @Test
    void changesOutsideSignificantFieldsAreIgnored() {
        StateStore prior = engine.compute(new StateStore(), List.of(iecere("A")), T1).newState();
        ListingRecord republished = TestRecords.record(
            "A", "phase", "Iecere", "address", "Jomas iela 1", "published", "2026-03-02"
        );

        DeltaResult result = engine.compute(prior, List.of(republished), T2);

        assertThat(result.changes()).isEmpty();
        assertThat(result.newState().get("key:A").orElseThrow().lastSeen()).isEqualTo(T2);
    }

    @Test
    void lastOccurrenceWinsWithinABatch() {
        StateStore prior = engine.compute(new StateStore(), List.of(iecere("A")), T1).newState();
        ListingRecord stale = iecere("A");
        ListingRecord latest = TestRecords.record("A", "phase", "Projektēšanas nosacījumu izpilde", "address", "Jomas iela 1");

        DeltaResult result = engine.compute(prior, List.of(latest, stale), T2);
        assertThat(result.changes()).isEmpty();

        DeltaResult reversed = engine.compute(prior, List.of(stale, latest), T2);
        assertThat(reversed.count(ChangeKind.UPDATED)).isEqualTo(1);
    }

    private ListingRecord iecere(String bisNumber) {
        return TestRecords.record(bisNumber, "phase", "Iecere", "address", "Jomas iela 1");
    }
}
