package com.delta.harvester.harvest.model;

public enum StopReason {
    WORKLIST_EXHAUSTED,
    END_OF_DATA,
    DEADLINE,
    CIRCUIT_ABORT,
    INTERRUPTED
}
