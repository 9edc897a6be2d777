package com.delta.harvester.harvest.model;

public record FetchResult(
    String rawContent,
    boolean transportOk,
    int statusCode,
    String errorCode,
    String errorMessage
) {
    public static FetchResult ok(String rawContent) {
        return new FetchResult(rawContent, true, 200, null, null);
    }

    public static FetchResult failure(int statusCode, String errorCode, String errorMessage) {
        return new FetchResult(null, false, statusCode, errorCode, errorMessage);
    }

    public String describeFailure() {
        if (errorCode != null) {
            return errorMessage == null ? errorCode : errorCode + ": " + errorMessage;
        }
        return "http_" + statusCode;
    }
}
