package com.delta.harvester.harvest.service;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.harvest.delta.DeltaEngine;
import com.delta.harvester.harvest.delta.DeltaResult;
import com.delta.harvester.harvest.filter.RecordFilter;
import com.delta.harvester.harvest.model.ChangeKind;
import com.delta.harvester.harvest.model.ChangeRecord;
import com.delta.harvester.harvest.model.CursorStatusResponse;
import com.delta.harvester.harvest.model.FailedPageEntry;
import com.delta.harvester.harvest.model.HarvestCursor;
import com.delta.harvester.harvest.model.HarvestRunResult;
import com.delta.harvester.harvest.model.HarvestRunStatus;
import com.delta.harvester.harvest.model.ListingRecord;
import com.delta.harvester.harvest.model.RunBudget;
import com.delta.harvester.harvest.model.StalePolicy;
import com.delta.harvester.harvest.model.StateEntry;
import com.delta.harvester.harvest.persistence.HarvestStateRepository;
import com.delta.harvester.harvest.report.ChangeSet;
import com.delta.harvester.harvest.report.ChangeSetSink;
import com.delta.harvester.harvest.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One harvest run end to end: load the documents, visit pages, filter, diff, save everything once,
 * then hand the change set to the sinks.
 */
@Service
public class HarvestRunService {
    private static final Logger log = LoggerFactory.getLogger(HarvestRunService.class);

    private final RunOrchestrator orchestrator;
    private final HarvestStateRepository repository;
    private final RecordFilter recordFilter;
    private final DeltaEngine deltaEngine;
    private final List<ChangeSetSink> sinks;
    private final HarvesterProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HarvestRunService(
        RunOrchestrator orchestrator,
        HarvestStateRepository repository,
        RecordFilter recordFilter,
        DeltaEngine deltaEngine,
        List<ChangeSetSink> sinks,
        HarvesterProperties properties,
        Clock clock
    ) {
        this.orchestrator = orchestrator;
        this.repository = repository;
        this.recordFilter = recordFilter;
        this.deltaEngine = deltaEngine;
        this.sinks = sinks == null ? List.of() : List.copyOf(sinks);
        this.properties = properties;
        this.clock = clock;
    }

    public HarvestRunStatus run() {
        if (!running.compareAndSet(false, true)) {
            throw new ActiveHarvestRunException("A harvest run is already in progress");
        }
        try {
            return runExclusive();
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<HarvestRunStatus> getLastStatus() {
        return repository.loadRunStatus();
    }

    public CursorStatusResponse getCursorStatus() {
        return new CursorStatusResponse(repository.loadCursor(), repository.loadFailedPages());
    }

    private HarvestRunStatus runExclusive() {
        Instant startedAt = clock.instant();
        StateStore prior = repository.loadStateStore();
        HarvestCursor cursor = repository.loadCursor();
        List<FailedPageEntry> failedPages = repository.loadFailedPages();
        RunBudget budget = RunBudget.startingAt(
            startedAt,
            Duration.ofSeconds(properties.getScan().getRunBudgetSeconds())
        );

        HarvestRunResult result = orchestrator.run(cursor, failedPages, budget);

        List<ListingRecord> accepted = new ArrayList<>();
        List<ListingRecord> rejected = new ArrayList<>();
        for (ListingRecord row : result.rows()) {
            if (recordFilter.accepts(row)) {
                accepted.add(row);
            } else {
                rejected.add(row);
            }
        }
        Instant now = clock.instant();
        DeltaResult delta = deltaEngine.compute(prior, accepted, now);

        StateStore nextState = delta.newState();
        List<String> filteredOut = dropFilteredOut(nextState, prior, accepted, rejected);

        boolean suppressed = properties.getDelta().isSuppressUntilBaselineComplete()
            && !cursor.baselineComplete()
            && (!delta.changes().isEmpty() || !filteredOut.isEmpty());
        List<ChangeRecord> reported = suppressed ? List.of() : delta.changes();
        List<String> reportedFilteredOut = suppressed ? List.of() : filteredOut;

        List<String> pruned = cursor.baselineComplete() && result.cursor().baselineComplete()
            ? pruneStale(nextState, now)
            : List.of();

        repository.saveStateStore(nextState);
        repository.saveCursor(result.cursor());
        repository.saveFailedPages(result.failedPages());

        Instant finishedAt = clock.instant();
        HarvestRunStatus status = new HarvestRunStatus(
            startedAt,
            finishedAt,
            Duration.between(startedAt, finishedAt).toMillis(),
            result.stopReason(),
            result.stats().pagesAttempted(),
            result.stats().pagesSucceeded(),
            result.stats().errorPages(),
            result.stats().emptyPages(),
            result.abandonedPages(),
            result.stats().cooldownsUsed(),
            result.cursor().baselineComplete(),
            result.cursor().nextPage(),
            result.failedPages().size(),
            result.rows().size(),
            accepted.size(),
            delta.baselineRun(),
            suppressed,
            suppressed ? 0 : (int) delta.count(ChangeKind.NEW),
            suppressed ? 0 : (int) delta.count(ChangeKind.UPDATED),
            pruned.size(),
            reportedFilteredOut.size(),
            nextState.size()
        );
        repository.saveRunStatus(status);

        publish(new ChangeSet(
            finishedAt,
            reported,
            pruned,
            reportedFilteredOut,
            nextState,
            delta.baselineRun(),
            suppressed
        ));
        log.info(
            "Harvest run {}: extracted={} accepted={} new={} updated={} pruned={} filteredOut={} suppressed={} state={} cursor={}",
            status.stopReason(),
            status.recordsExtracted(),
            status.recordsAccepted(),
            status.newCount(),
            status.updatedCount(),
            status.prunedCount(),
            filteredOut.size(),
            suppressed,
            status.stateSize(),
            result.cursor()
        );
        return status;
    }

    private List<String> pruneStale(StateStore state, Instant now) {
        HarvesterProperties.Delta delta = properties.getDelta();
        if (delta.getStalePolicy() != StalePolicy.PRUNE) {
            return List.of();
        }
        Instant threshold = now.minus(Duration.ofDays(delta.getStaleAfterDays()));
        List<String> pruned = new ArrayList<>();
        for (StateEntry entry : List.copyOf(state.entries())) {
            if (entry.lastSeen() != null && entry.lastSeen().isBefore(threshold)) {
                pruned.add(entry.record().identity());
            }
        }
        pruned.forEach(state::remove);
        if (!pruned.isEmpty()) {
            log.info("Pruned {} entries not seen since {}", pruned.size(), threshold);
        }
        return pruned;
    }

    private void publish(ChangeSet changeSet) {
        for (ChangeSetSink sink : sinks) {
            try {
                sink.publish(changeSet);
            } catch (Exception e) {
                log.warn("Change-set sink {} failed: {}", sink.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    /**
     * Tracked records seen this run that no longer pass the filter leave the state, so they are
     * reported once instead of keeping a stale snapshot forever.
     */
    private List<String> dropFilteredOut(
        StateStore state,
        StateStore prior,
        List<ListingRecord> accepted,
        List<ListingRecord> rejected
    ) {
        Set<String> acceptedIdentities = new HashSet<>();
        accepted.forEach(row -> acceptedIdentities.add(row.identity()));
        Set<String> filteredOut = new LinkedHashSet<>();
        for (ListingRecord row : rejected) {
            String identity = row.identity();
            if (prior.contains(identity) && !acceptedIdentities.contains(identity)) {
                filteredOut.add(identity);
            }
        }
        filteredOut.forEach(state::remove);
        if (!filteredOut.isEmpty()) {
            log.info("Dropped {} tracked entries that no longer pass the record filter", filteredOut.size());
        }
        return List.copyOf(filteredOut);
    }
}
