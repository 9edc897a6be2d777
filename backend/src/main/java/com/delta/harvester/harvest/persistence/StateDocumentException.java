package com.delta.harvester.harvest.persistence;

public class StateDocumentException extends RuntimeException {
    public StateDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
