package com.delta.harvester.harvest.retry;

public enum BreakerDecision {
    CONTINUE,
    COOLDOWN,
    ABORT
}
