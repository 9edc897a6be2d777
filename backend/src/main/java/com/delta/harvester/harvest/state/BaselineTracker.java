package com.delta.harvester.harvest.state;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.harvest.model.HarvestCursor;
import com.delta.harvester.harvest.model.PageOutcome;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Cursor state machine for one run. While building, the run scans a bounded window from the
 * cursor and moves the frontier; in steady state it rescans the first pages of the listing.
 */
public class BaselineTracker {
    private final HarvestCursor cursor;
    private final int pageCeiling;
    private final int emptyPageTolerance;
    private final int windowStart;
    private final int windowEnd;

    private int highestVisited;
    private int consecutiveEmpty;
    private boolean endOfData;

    public BaselineTracker(HarvestCursor cursor, HarvesterProperties.Scan scan) {
        this.cursor = cursor == null ? HarvestCursor.initial() : cursor;
        this.pageCeiling = scan.getPageCeiling();
        this.emptyPageTolerance = scan.getEmptyPageTolerance();
        if (this.cursor.baselineComplete()) {
            this.windowStart = 1;
            this.windowEnd = Math.min(pageCeiling, scan.getDeltaWindowSize());
        } else {
            this.windowStart = Math.min(this.cursor.nextPage(), pageCeiling);
            this.windowEnd = Math.min(pageCeiling, windowStart + scan.getBuildPagesPerRun() - 1);
        }
    }

    public boolean isBuilding() {
        return !cursor.baselineComplete();
    }

    public List<Integer> sequentialWindow() {
        return IntStream.rangeClosed(windowStart, windowEnd).boxed().toList();
    }

    public boolean inSequentialWindow(int page) {
        return page >= windowStart && page <= windowEnd;
    }

    /**
     * Records a visit of a sequential-window page. Returns true once enough consecutive empty
     * pages were seen to treat the rest of the listing as absent.
     */
    public boolean onSequentialOutcome(PageOutcome outcome) {
        markVisited(outcome.page());
        if (!isBuilding()) {
            return false;
        }
        consecutiveEmpty = outcome.isEmpty() ? consecutiveEmpty + 1 : 0;
        if (consecutiveEmpty >= emptyPageTolerance) {
            endOfData = true;
        }
        return endOfData;
    }

    /**
     * Counts a window page visited in an earlier pass of the run towards the frontier.
     */
    public void markVisited(int page) {
        if (inSequentialWindow(page)) {
            highestVisited = Math.max(highestVisited, page);
        }
    }

    public boolean endOfDataReached() {
        return endOfData;
    }

    public HarvestCursor finish() {
        if (!isBuilding() || endOfData || highestVisited >= pageCeiling) {
            return new HarvestCursor(1, true);
        }
        if (highestVisited == 0) {
            return new HarvestCursor(Math.min(cursor.nextPage(), pageCeiling), false);
        }
        return new HarvestCursor(Math.min(pageCeiling, highestVisited + 1), false);
    }
}
