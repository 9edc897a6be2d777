package com.delta.harvester.harvest.model;

public enum FetchErrorKind {
    /** Network failure, timeout or a non-success HTTP status. */
    TRANSIENT,
    /** The backend answered with its own error or maintenance page. */
    BACKEND_UNAVAILABLE,
    /** The page was delivered but the extractor could not read it. */
    EXTRACTION_FAILED
}
