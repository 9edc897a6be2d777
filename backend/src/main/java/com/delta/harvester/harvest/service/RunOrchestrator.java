package com.delta.harvester.harvest.service;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.harvest.fetch.PageFetcher;
import com.delta.harvester.harvest.model.FailedPageEntry;
import com.delta.harvester.harvest.model.HarvestCursor;
import com.delta.harvester.harvest.model.HarvestRunResult;
import com.delta.harvester.harvest.model.ListingRecord;
import com.delta.harvester.harvest.model.PageOutcome;
import com.delta.harvester.harvest.model.RunBudget;
import com.delta.harvester.harvest.model.RunStats;
import com.delta.harvester.harvest.model.StopReason;
import com.delta.harvester.harvest.retry.BreakerDecision;
import com.delta.harvester.harvest.retry.CircuitBreaker;
import com.delta.harvester.harvest.retry.RetryBackoffController;
import com.delta.harvester.harvest.retry.Sleeper;
import com.delta.harvester.harvest.state.BaselineTracker;
import com.delta.harvester.harvest.state.FailedPageQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Visits the pages of one run strictly one after another: failed pages from earlier runs first,
 * then the front refresh window while the baseline is still being built, then the sequential
 * window of the cursor. Takes the durable state as arguments and returns its next version;
 * loading and saving belong to the caller.
 */
@Service
public class RunOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(RunOrchestrator.class);

    private final RetryBackoffController retryController;
    private final PageFetcher fetcher;
    private final HarvesterProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;

    public RunOrchestrator(
        RetryBackoffController retryController,
        PageFetcher fetcher,
        HarvesterProperties properties,
        Clock clock,
        Sleeper sleeper
    ) {
        this.retryController = retryController;
        this.fetcher = fetcher;
        this.properties = properties;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public HarvestRunResult run(HarvestCursor cursor, List<FailedPageEntry> failedPages, RunBudget budget) {
        HarvesterProperties.Scan scan = properties.getScan();
        BaselineTracker tracker = new BaselineTracker(cursor, scan);
        FailedPageQueue queue = new FailedPageQueue(
            failedPages,
            scan.getPageCeiling(),
            properties.getFailedPages().getMaxAttempts()
        );
        CircuitBreaker breaker = CircuitBreaker.fromProperties(properties.getBreaker());

        List<FailedPageEntry> failedBatch = queue.popBatch(properties.getFailedPages().getBatchSize());
        Map<Integer, WorkItem> worklist = buildWorklist(tracker, failedBatch, scan);
        log.info(
            "Harvest run starting: building={} window={}..{} failedBatch={} worklist={} deadline={}",
            tracker.isBuilding(),
            tracker.sequentialWindow().isEmpty() ? 0 : tracker.sequentialWindow().get(0),
            tracker.sequentialWindow().isEmpty() ? 0 : tracker.sequentialWindow().get(tracker.sequentialWindow().size() - 1),
            failedBatch.size(),
            worklist.size(),
            budget.deadline()
        );

        List<ListingRecord> rows = new ArrayList<>();
        List<Integer> errorPages = new ArrayList<>();
        List<Integer> emptyPages = new ArrayList<>();
        int attempted = 0;
        int succeeded = 0;
        StopReason stopReason = StopReason.WORKLIST_EXHAUSTED;

        Iterator<WorkItem> iterator = worklist.values().iterator();
        while (iterator.hasNext()) {
            WorkItem item = iterator.next();
            if (Thread.currentThread().isInterrupted()) {
                restoreUnvisited(item, queue);
                stopReason = StopReason.INTERRUPTED;
                break;
            }
            if (budget.isExpired(clock.instant())) {
                restoreUnvisited(item, queue);
                stopReason = StopReason.DEADLINE;
                break;
            }

            PageOutcome outcome = retryController.attemptPage(item.page(), budget);
            attempted++;
            switch (outcome.type()) {
                case OK -> {
                    succeeded++;
                    rows.addAll(outcome.rows());
                }
                case EMPTY -> {
                    succeeded++;
                    emptyPages.add(item.page());
                }
                case ERROR -> {
                    errorPages.add(item.page());
                    if (item.failedEntry() != null) {
                        queue.requeue(item.failedEntry());
                    } else {
                        queue.push(item.page());
                    }
                    log.warn(
                        "Page {} failed after {} attempt(s): {} {}",
                        item.page(),
                        outcome.attempts(),
                        outcome.errorKind(),
                        outcome.detail()
                    );
                }
            }

            boolean endOfData = false;
            if (item.pass() != Pass.FAILED && tracker.inSequentialWindow(item.page())) {
                endOfData = tracker.onSequentialOutcome(outcome);
            } else {
                tracker.markVisited(item.page());
            }

            BreakerDecision decision = breaker.record(outcome, clock.instant(), budget);
            if (decision == BreakerDecision.ABORT) {
                log.warn(
                    "Circuit breaker aborted the run at page {} (error ratio {}, cooldowns used {})",
                    item.page(),
                    breaker.errorRatio(),
                    breaker.cooldownsUsed()
                );
                stopReason = StopReason.CIRCUIT_ABORT;
                break;
            }
            if (endOfData) {
                log.info("End of listing data reached at page {}", item.page());
                stopReason = StopReason.END_OF_DATA;
                break;
            }
            if (decision == BreakerDecision.COOLDOWN) {
                log.warn(
                    "Circuit breaker cooling down for {}s after page {} (cooldown {} of this run)",
                    breaker.cooldown().toSeconds(),
                    item.page(),
                    breaker.cooldownsUsed()
                );
                if (!coolDown(breaker)) {
                    stopReason = StopReason.INTERRUPTED;
                    break;
                }
                fetcher.recycle();
            }
        }
        while (iterator.hasNext()) {
            restoreUnvisited(iterator.next(), queue);
        }

        HarvestCursor nextCursor = tracker.finish();
        RunStats stats = new RunStats(attempted, succeeded, errorPages, emptyPages, breaker.cooldownsUsed());
        log.info(
            "Harvest run finished: stop={} attempted={} succeeded={} errors={} empty={} rows={} cursor={} failedQueue={}",
            stopReason,
            attempted,
            succeeded,
            errorPages.size(),
            emptyPages.size(),
            rows.size(),
            nextCursor,
            queue.size()
        );
        return new HarvestRunResult(nextCursor, queue.entries(), rows, stats, queue.abandonedPages(), stopReason);
    }

    private Map<Integer, WorkItem> buildWorklist(
        BaselineTracker tracker,
        List<FailedPageEntry> failedBatch,
        HarvesterProperties.Scan scan
    ) {
        Map<Integer, WorkItem> worklist = new LinkedHashMap<>();
        for (FailedPageEntry entry : failedBatch) {
            worklist.putIfAbsent(entry.page(), new WorkItem(entry.page(), Pass.FAILED, entry));
        }
        if (tracker.isBuilding()) {
            int frontEnd = Math.min(scan.getFrontRefreshSize(), scan.getPageCeiling());
            for (int page = 1; page <= frontEnd; page++) {
                worklist.putIfAbsent(page, new WorkItem(page, Pass.FRONT, null));
            }
        }
        for (int page : tracker.sequentialWindow()) {
            worklist.putIfAbsent(page, new WorkItem(page, Pass.SEQUENTIAL, null));
        }
        return worklist;
    }

    private void restoreUnvisited(WorkItem item, FailedPageQueue queue) {
        if (item.failedEntry() != null) {
            queue.restore(item.failedEntry());
        }
    }

    private boolean coolDown(CircuitBreaker breaker) {
        try {
            sleeper.sleep(breaker.cooldown());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private enum Pass {
        FAILED,
        FRONT,
        SEQUENTIAL
    }

    private record WorkItem(int page, Pass pass, FailedPageEntry failedEntry) {
    }
}
