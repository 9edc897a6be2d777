package com.delta.harvester.harvest.state;

import com.delta.harvester.harvest.model.FailedPageEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FailedPageQueueTest {

    @Test
    void pushCountsRepeatedFailures() {
        FailedPageQueue queue = new FailedPageQueue(List.of(), 300, 5);
        queue.push(12);
        queue.push(12);
        queue.push(4);

        assertThat(queue.entries()).containsExactly(new FailedPageEntry(4, 1), new FailedPageEntry(12, 2));
    }

    @Test
    void popBatchPrefersFewestAttemptsThenLowestPage() {
        FailedPageQueue queue = new FailedPageQueue(
            List.of(new FailedPageEntry(7, 2), new FailedPageEntry(9, 1), new FailedPageEntry(3, 1)),
            300,
            5
        );

        List<FailedPageEntry> batch = queue.popBatch(2);

        assertThat(batch).containsExactly(new FailedPageEntry(3, 1), new FailedPageEntry(9, 1));
        assertThat(queue.entries()).containsExactly(new FailedPageEntry(7, 2));
    }

    @Test
    void pageIsAbandonedWhenAttemptsReachTheLimit() {
        FailedPageQueue queue = new FailedPageQueue(List.of(new FailedPageEntry(5, 2)), 300, 3);
        FailedPageEntry popped = queue.popBatch(10).get(0);

        queue.requeue(popped);

        assertThat(queue.contains(5)).isFalse();
        assertThat(queue.size()).isZero();
        assertThat(queue.abandonedPages()).containsExactly(5);
    }

    @Test
    void restoreKeepsTheAttemptCounter() {
        FailedPageQueue queue = new FailedPageQueue(List.of(new FailedPageEntry(8, 3)), 300, 5);
        FailedPageEntry popped = queue.popBatch(1).get(0);
        assertThat(queue.contains(8)).isFalse();

        queue.restore(popped);

        assertThat(queue.entries()).containsExactly(new FailedPageEntry(8, 3));
    }

    @Test
    void pagesOutsideTheCeilingAreIgnored() {
        FailedPageQueue queue = new FailedPageQueue(
            List.of(new FailedPageEntry(400, 1), new FailedPageEntry(0, 1), new FailedPageEntry(300, 1)),
            300,
            5
        );
        queue.push(301);

        assertThat(queue.entries()).containsExactly(new FailedPageEntry(300, 1));
    }

    @Test
    void duplicateEntriesCollapseToTheHigherCount() {
        FailedPageQueue queue = new FailedPageQueue(
            List.of(new FailedPageEntry(6, 1), new FailedPageEntry(6, 3)),
            300,
            5
        );

        assertThat(queue.entries()).containsExactly(new FailedPageEntry(6, 3));
    }
}
