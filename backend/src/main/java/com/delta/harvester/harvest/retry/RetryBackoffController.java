package com.delta.harvester.harvest.retry;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.harvest.fetch.FetchClassifier;
import com.delta.harvester.harvest.fetch.PageFetcher;
import com.delta.harvester.harvest.model.FetchResult;
import com.delta.harvester.harvest.model.PageOutcome;
import com.delta.harvester.harvest.model.RunBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class RetryBackoffController {
    private static final Logger log = LoggerFactory.getLogger(RetryBackoffController.class);

    private final PageFetcher fetcher;
    private final FetchClassifier classifier;
    private final HarvesterProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;

    public RetryBackoffController(
        PageFetcher fetcher,
        FetchClassifier classifier,
        HarvesterProperties properties,
        Clock clock,
        Sleeper sleeper
    ) {
        this.fetcher = fetcher;
        this.classifier = classifier;
        this.properties = properties;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Fetches and classifies one page, retrying errors with exponential backoff.
     * Returns the first OK or EMPTY outcome, or the last ERROR once attempts or the
     * run budget are used up. An interrupt ends the retries and is left set on the thread.
     */
    public PageOutcome attemptPage(int page, RunBudget budget) {
        int maxAttempts = 1 + properties.getRetry().getMaxRetries();
        boolean recycled = false;
        PageOutcome last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            last = classifier.classify(page, fetchSafely(page)).withAttempts(attempt);
            if (!last.isError()) {
                return last;
            }
            log.debug("Page {} attempt {}/{} failed: {} {}", page, attempt, maxAttempts, last.errorKind(), last.detail());
            if (attempt >= maxAttempts) {
                break;
            }
            if (!recycled) {
                fetcher.recycle();
                recycled = true;
            }
            Duration delay = backoffDelay(attempt);
            if (!budget.allows(clock.instant(), delay)) {
                log.debug("Page {} retry skipped, backoff of {}ms would pass the run deadline", page, delay.toMillis());
                break;
            }
            if (!sleepBackoff(delay)) {
                break;
            }
            if (budget.isExpired(clock.instant())) {
                break;
            }
        }
        return last;
    }

    Duration backoffDelay(int retryNumber) {
        HarvesterProperties.Retry retry = properties.getRetry();
        long delay = (long) retry.getBaseDelayMs() * (1L << Math.min(20, Math.max(0, retryNumber - 1)));
        if (retry.getMaxDelayMs() > 0) {
            delay = Math.min(delay, retry.getMaxDelayMs());
        }
        long jitter = retry.getMaxJitterMs() > 0
            ? ThreadLocalRandom.current().nextLong(retry.getMaxJitterMs() + 1L)
            : 0L;
        return Duration.ofMillis(delay + jitter);
    }

    private FetchResult fetchSafely(int page) {
        try {
            FetchResult result = fetcher.fetch(page);
            return result == null ? FetchResult.failure(0, "no_result", "fetcher returned nothing") : result;
        } catch (RuntimeException e) {
            log.debug("Fetcher threw for page {}", page, e);
            return FetchResult.failure(0, "fetch_exception", e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private boolean sleepBackoff(Duration delay) {
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
