package com.delta.harvester.harvest.persistence;

import com.delta.harvester.config.HarvestConfig;
import com.delta.harvester.harvest.model.FailedPageEntry;
import com.delta.harvester.harvest.model.HarvestCursor;
import com.delta.harvester.harvest.model.StateEntry;
import com.delta.harvester.harvest.state.StateStore;
import com.delta.harvester.harvest.support.TestRecords;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HarvestStateRepositoryTest {
    private static final Instant T1 = Instant.parse("2026-03-01T06:00:00Z");
    private static final Instant T2 = Instant.parse("2026-03-02T06:00:00Z");

    @TempDir
    Path dataDir;

    @Test
    void missingDocumentsReadAsDefaults() {
        HarvestStateRepository repository = repository();

        assertThat(repository.loadStateStore().isEmpty()).isTrue();
        assertThat(repository.loadCursor()).isEqualTo(HarvestCursor.initial());
        assertThat(repository.loadFailedPages()).isEmpty();
        assertThat(repository.loadRunStatus()).isEmpty();
    }

    @Test
    void documentsSurviveARestart() {
        StateStore store = new StateStore();
        store.put(new StateEntry(TestRecords.record("BIS-1", "phase", "Iecere"), T1, T2));
        repository().saveStateStore(store);
        repository().saveCursor(new HarvestCursor(41, false));
        repository().saveFailedPages(List.of(new FailedPageEntry(7, 2)));

        HarvestStateRepository reopened = repository();
        StateEntry entry = reopened.loadStateStore().get("key:BIS-1").orElseThrow();

        assertThat(entry.firstSeen()).isEqualTo(T1);
        assertThat(entry.lastSeen()).isEqualTo(T2);
        assertThat(entry.record().field("phase")).isEqualTo("Iecere");
        assertThat(reopened.loadCursor()).isEqualTo(new HarvestCursor(41, false));
        assertThat(reopened.loadFailedPages()).containsExactly(new FailedPageEntry(7, 2));
    }

    @Test
    void zeroByteDocumentReadsAsDefault() throws Exception {
        Files.createFile(dataDir.resolve(HarvestStateRepository.CURSOR_DOCUMENT));

        assertThat(repository().loadCursor()).isEqualTo(HarvestCursor.initial());
    }

    @Test
    void corruptDocumentFailsInsteadOfReseeding() throws Exception {
        Files.writeString(dataDir.resolve(HarvestStateRepository.STATE_STORE_DOCUMENT), "{\"key:BIS-1\": [");

        assertThatThrownBy(() -> repository().loadStateStore())
            .isInstanceOf(StateDocumentException.class)
            .hasMessageContaining(HarvestStateRepository.STATE_STORE_DOCUMENT);
    }

    @Test
    void writesLeaveNoTempFilesBehind() throws Exception {
        repository().saveCursor(new HarvestCursor(3, false));
        repository().saveCursor(new HarvestCursor(4, false));

        try (var files = Files.list(dataDir)) {
            assertThat(files.map(path -> path.getFileName().toString()).toList())
                .containsExactly(HarvestStateRepository.CURSOR_DOCUMENT);
        }
    }

    private HarvestStateRepository repository() {
        return new HarvestStateRepository(new HarvestConfig().objectMapper(), dataDir);
    }
}
