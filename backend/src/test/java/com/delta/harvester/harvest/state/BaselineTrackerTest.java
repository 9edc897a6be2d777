package com.delta.harvester.harvest.state;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.harvest.model.FetchErrorKind;
import com.delta.harvester.harvest.model.HarvestCursor;
import com.delta.harvester.harvest.model.PageOutcome;
import com.delta.harvester.harvest.support.TestRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BaselineTrackerTest {
    private HarvesterProperties.Scan scan;

    @BeforeEach
    void setUp() {
        scan = new HarvesterProperties.Scan();
        scan.setPageCeiling(300);
        scan.setBuildPagesPerRun(5);
        scan.setDeltaWindowSize(20);
        scan.setEmptyPageTolerance(2);
    }

    @Test
    void buildingRunAdvancesTheFrontierPastTheLastVisitedPage() {
        BaselineTracker tracker = new BaselineTracker(HarvestCursor.initial(), scan);
        assertThat(tracker.sequentialWindow()).containsExactly(1, 2, 3, 4, 5);

        for (int page = 1; page <= 5; page++) {
            assertThat(tracker.onSequentialOutcome(ok(page))).isFalse();
        }

        assertThat(tracker.finish()).isEqualTo(new HarvestCursor(6, false));
    }

    @Test
    void consecutiveEmptyPagesCompleteTheBaseline() {
        BaselineTracker tracker = new BaselineTracker(new HarvestCursor(6, false), scan);

        assertThat(tracker.onSequentialOutcome(PageOutcome.empty(6))).isFalse();
        assertThat(tracker.onSequentialOutcome(PageOutcome.empty(7))).isTrue();

        assertThat(tracker.endOfDataReached()).isTrue();
        assertThat(tracker.finish()).isEqualTo(new HarvestCursor(1, true));
    }

    @Test
    void anyNonEmptyOutcomeResetsTheEmptyRun() {
        BaselineTracker tracker = new BaselineTracker(new HarvestCursor(6, false), scan);

        tracker.onSequentialOutcome(PageOutcome.empty(6));
        tracker.onSequentialOutcome(PageOutcome.error(7, FetchErrorKind.TRANSIENT, "timeout"));
        assertThat(tracker.onSequentialOutcome(PageOutcome.empty(8))).isFalse();

        assertThat(tracker.finish()).isEqualTo(new HarvestCursor(9, false));
    }

    @Test
    void steadyStateRescansTheFrontOfTheListing() {
        BaselineTracker tracker = new BaselineTracker(new HarvestCursor(1, true), scan);

        assertThat(tracker.isBuilding()).isFalse();
        assertThat(tracker.sequentialWindow()).hasSize(20).startsWith(1).endsWith(20);
        assertThat(tracker.onSequentialOutcome(PageOutcome.empty(1))).isFalse();
        assertThat(tracker.onSequentialOutcome(PageOutcome.empty(2))).isFalse();
        assertThat(tracker.finish()).isEqualTo(new HarvestCursor(1, true));
    }

    @Test
    void reachingThePageCeilingCompletesTheBaseline() {
        BaselineTracker tracker = new BaselineTracker(new HarvestCursor(298, false), scan);
        assertThat(tracker.sequentialWindow()).containsExactly(298, 299, 300);

        tracker.onSequentialOutcome(ok(298));
        tracker.onSequentialOutcome(ok(299));
        tracker.onSequentialOutcome(ok(300));

        assertThat(tracker.finish()).isEqualTo(new HarvestCursor(1, true));
    }

    @Test
    void cursorIsUnchangedWhenNoWindowPageWasVisited() {
        BaselineTracker tracker = new BaselineTracker(new HarvestCursor(41, false), scan);
        tracker.markVisited(2);

        assertThat(tracker.finish()).isEqualTo(new HarvestCursor(41, false));
    }

    private PageOutcome ok(int page) {
        return PageOutcome.ok(page, List.of(TestRecords.record("B-" + page)));
    }
}
