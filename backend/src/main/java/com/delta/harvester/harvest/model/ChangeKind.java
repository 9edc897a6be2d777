package com.delta.harvester.harvest.model;

public enum ChangeKind {
    NEW,
    UPDATED
}
