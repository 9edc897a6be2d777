package com.delta.harvester.harvest.report;

import com.delta.harvester.harvest.model.ChangeRecord;
import com.delta.harvester.harvest.model.FieldDiff;
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

class MarkdownChangelogWriterTest {
    private static final Instant NOW = Instant.parse("2026-03-01T06:00:00Z");

    @TempDir
    Path reportsDir;

    @Test
    void writesCountsNewAndUpdatedSections() throws Exception {
        StateStore state = new StateStore();
        state.put(StateEntry.firstObservation(TestRecords.record("BIS-1"), NOW));
        state.put(StateEntry.firstObservation(TestRecords.record("BIS-2"), NOW));
        ChangeSet changeSet = new ChangeSet(
            NOW,
            List.of(
                ChangeRecord.added(TestRecords.record(
                    "BIS-1",
                    "authority", "Jūrmalas Būvvalde",
                    "details_url", "https://bis.gov.lv/bisp/lv/planned_constructions/show/1"
                )),
                ChangeRecord.updated(
                    TestRecords.record("BIS-2", "phase", "Būvdarbi"),
                    List.of(new FieldDiff("phase", "Iecere", "Būvdarbi"))
                )
            ),
            List.of("key:BIS-9"),
            List.of("key:BIS-3"),
            state,
            false,
            false
        );

        new MarkdownChangelogWriter(reportsDir, true).publish(changeSet);

        String markdown = Files.readString(reportsDir.resolve(MarkdownChangelogWriter.CHANGELOG_FILE));
        assertThat(markdown).startsWith("# BIS Plānotie būvdarbi");
        assertThat(markdown).contains("- Kopā ieraksti: 2", "- Jauni: 1", "- Atjaunināti: 1", "- Noņemti: 2");
        assertThat(markdown).contains("**Jūrmalas Būvvalde** — BIS-1");
        assertThat(markdown).contains("[Saite](https://bis.gov.lv/bisp/lv/planned_constructions/show/1)");
        assertThat(markdown).contains("  - phase: `Iecere` → `Būvdarbi`");
        assertThat(markdown).contains("## Noņemti (vairs neatbilst filtriem vai pazuduši)\n- key:BIS-3\n- key:BIS-9");
        assertThat(markdown).doesNotContain("Bāzes skenēšana");
    }

    @Test
    void notesSuppressedChangesDuringBaseline() throws Exception {
        ChangeSet changeSet = new ChangeSet(NOW, List.of(), List.of(), List.of(), new StateStore(), false, true);

        new MarkdownChangelogWriter(reportsDir, true).publish(changeSet);

        assertThat(Files.readString(reportsDir.resolve(MarkdownChangelogWriter.CHANGELOG_FILE)))
            .contains("Bāzes skenēšana vēl nav pabeigta");
    }

    @Test
    void disabledWriterLeavesNoFile() throws Exception {
        new MarkdownChangelogWriter(reportsDir, false)
            .publish(new ChangeSet(NOW, List.of(), List.of(), List.of(), new StateStore(), false, false));

        assertThat(Files.exists(reportsDir.resolve(MarkdownChangelogWriter.CHANGELOG_FILE))).isFalse();
    }
}
