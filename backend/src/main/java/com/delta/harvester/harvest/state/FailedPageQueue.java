package com.delta.harvester.harvest.state;

import com.delta.harvester.harvest.model.FailedPageEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Pages that exhausted their retries in an earlier run, with the number of runs they failed in.
 * A page is abandoned once its attempt counter reaches the configured maximum.
 */
public class FailedPageQueue {
    private static final Logger log = LoggerFactory.getLogger(FailedPageQueue.class);

    private final int pageCeiling;
    private final int maxAttempts;
    private final Map<Integer, Integer> attemptsByPage = new TreeMap<>();
    private final List<Integer> abandonedPages = new ArrayList<>();

    public FailedPageQueue(Collection<FailedPageEntry> entries, int pageCeiling, int maxAttempts) {
        this.pageCeiling = Math.max(1, pageCeiling);
        this.maxAttempts = Math.max(1, maxAttempts);
        if (entries != null) {
            for (FailedPageEntry entry : entries) {
                if (entry != null) {
                    record(entry.page(), Math.max(entry.attempts(), attemptsByPage.getOrDefault(entry.page(), 0)));
                }
            }
        }
    }

    public void push(int page) {
        record(page, attemptsByPage.getOrDefault(page, 0) + 1);
    }

    public void requeue(FailedPageEntry popped) {
        int known = Math.max(popped.attempts(), attemptsByPage.getOrDefault(popped.page(), 0));
        record(popped.page(), known + 1);
    }

    public void restore(FailedPageEntry popped) {
        int known = Math.max(popped.attempts(), attemptsByPage.getOrDefault(popped.page(), 0));
        record(popped.page(), known);
    }

    public List<FailedPageEntry> popBatch(int limit) {
        List<FailedPageEntry> batch = attemptsByPage.entrySet().stream()
            .map(entry -> new FailedPageEntry(entry.getKey(), entry.getValue()))
            .sorted(Comparator.comparingInt(FailedPageEntry::attempts).thenComparingInt(FailedPageEntry::page))
            .limit(Math.max(0, limit))
            .toList();
        for (FailedPageEntry entry : batch) {
            attemptsByPage.remove(entry.page());
        }
        return batch;
    }

    public List<FailedPageEntry> entries() {
        return attemptsByPage.entrySet().stream()
            .map(entry -> new FailedPageEntry(entry.getKey(), entry.getValue()))
            .toList();
    }

    public List<Integer> abandonedPages() {
        return List.copyOf(abandonedPages);
    }

    public boolean contains(int page) {
        return attemptsByPage.containsKey(page);
    }

    public int size() {
        return attemptsByPage.size();
    }

    private void record(int page, int attempts) {
        if (page < 1 || page > pageCeiling) {
            attemptsByPage.remove(page);
            return;
        }
        if (attempts >= maxAttempts) {
            attemptsByPage.remove(page);
            if (!abandonedPages.contains(page)) {
                abandonedPages.add(page);
            }
            log.warn("Abandoning page {} after {} failed attempts", page, attempts);
            return;
        }
        attemptsByPage.put(page, Math.max(1, attempts));
    }
}
