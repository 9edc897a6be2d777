package com.delta.harvester.harvest.fetch;

@FunctionalInterface
public interface ErrorPagePredicate {
    boolean isErrorPage(String content);
}
