package com.delta.harvester.harvest.report;

import java.io.IOException;

public interface ChangeSetSink {
    void publish(ChangeSet changeSet) throws IOException;
}
