package com.delta.harvester.harvest.retry;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.harvest.model.FetchErrorKind;
import com.delta.harvester.harvest.model.PageOutcome;
import com.delta.harvester.harvest.model.RunBudget;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window breaker over the last N page outcomes of a single run.
 * Backend error pages weigh more than plain transport failures.
 */
public class CircuitBreaker {
    private final int windowSize;
    private final double errorRatioThreshold;
    private final double backendErrorWeight;
    private final Duration cooldown;
    private final int maxCooldowns;

    private final Deque<Double> window = new ArrayDeque<>();
    private double errorScore;
    private int cooldownsUsed;

    public CircuitBreaker(
        int windowSize,
        double errorRatioThreshold,
        double backendErrorWeight,
        Duration cooldown,
        int maxCooldowns
    ) {
        this.windowSize = Math.max(1, windowSize);
        this.errorRatioThreshold = errorRatioThreshold;
        this.backendErrorWeight = Math.max(1.0, backendErrorWeight);
        this.cooldown = cooldown == null ? Duration.ZERO : cooldown;
        this.maxCooldowns = Math.max(0, maxCooldowns);
    }

    public static CircuitBreaker fromProperties(HarvesterProperties.Breaker breaker) {
        return new CircuitBreaker(
            breaker.getWindowSize(),
            breaker.getErrorRatioThreshold(),
            breaker.getBackendErrorWeight(),
            Duration.ofSeconds(breaker.getCooldownSeconds()),
            breaker.getMaxCooldownsPerRun()
        );
    }

    public BreakerDecision record(PageOutcome outcome, Instant now, RunBudget budget) {
        double weight = weightOf(outcome);
        window.addLast(weight);
        errorScore += weight;
        if (window.size() > windowSize) {
            errorScore -= window.removeFirst();
        }
        if (window.size() < windowSize || errorRatio() < errorRatioThreshold) {
            return BreakerDecision.CONTINUE;
        }
        if (cooldownsUsed < maxCooldowns && budget.allows(now, cooldown)) {
            cooldownsUsed++;
            reset();
            return BreakerDecision.COOLDOWN;
        }
        return BreakerDecision.ABORT;
    }

    public double errorRatio() {
        return Math.min(1.0, errorScore / windowSize);
    }

    public int cooldownsUsed() {
        return cooldownsUsed;
    }

    public Duration cooldown() {
        return cooldown;
    }

    private void reset() {
        window.clear();
        errorScore = 0.0;
    }

    private double weightOf(PageOutcome outcome) {
        if (outcome == null || !outcome.isError()) {
            return 0.0;
        }
        return outcome.errorKind() == FetchErrorKind.BACKEND_UNAVAILABLE ? backendErrorWeight : 1.0;
    }
}
