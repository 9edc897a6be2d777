package com.delta.harvester.harvest.model;

public enum OutcomeType {
    OK,
    EMPTY,
    ERROR
}
