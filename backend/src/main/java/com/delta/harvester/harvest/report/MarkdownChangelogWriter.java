package com.delta.harvester.harvest.report;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.harvest.model.ChangeKind;
import com.delta.harvester.harvest.model.ChangeRecord;
import com.delta.harvester.harvest.model.FieldDiff;
import com.delta.harvester.harvest.model.ListingRecord;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

@Component
public class MarkdownChangelogWriter implements ChangeSetSink {
    static final String CHANGELOG_FILE = "CHANGELOG.md";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
        .withZone(ZoneId.of("Europe/Riga"));

    private final Path reportsDir;
    private final boolean enabled;

    @Autowired
    public MarkdownChangelogWriter(HarvesterProperties properties) {
        this(Path.of(properties.getStorage().getReportsDir()), properties.getStorage().isWriteChangelog());
    }

    MarkdownChangelogWriter(Path reportsDir, boolean enabled) {
        this.reportsDir = reportsDir;
        this.enabled = enabled;
    }

    @Override
    public void publish(ChangeSet changeSet) throws IOException {
        if (!enabled) {
            return;
        }
        Files.createDirectories(reportsDir);
        Files.writeString(reportsDir.resolve(CHANGELOG_FILE), render(changeSet), StandardCharsets.UTF_8);
    }

    String render(ChangeSet changeSet) {
        List<ChangeRecord> added = changeSet.ofKind(ChangeKind.NEW);
        List<ChangeRecord> updated = changeSet.ofKind(ChangeKind.UPDATED);
        List<String> removed = changeSet.removedIdentities();
        List<String> lines = new ArrayList<>();
        lines.add("# BIS Plānotie būvdarbi — izmaiņu atskaite (" + TIMESTAMP.format(changeSet.generatedAt()) + ")");
        lines.add("");
        lines.add("- Kopā ieraksti: " + changeSet.state().size());
        lines.add("- Jauni: " + added.size());
        lines.add("- Atjaunināti: " + updated.size());
        lines.add("- Noņemti: " + removed.size());
        if (changeSet.baselineRun() || changeSet.suppressed()) {
            lines.add("");
            lines.add("_Bāzes skenēšana vēl nav pabeigta, izmaiņas netiek ziņotas._");
        }
        lines.add("");
        lines.add("## Jaunie");
        for (ChangeRecord change : added) {
            lines.add("- " + headline(change.record(), true));
        }
        lines.add("");
        lines.add("## Atjaunināti");
        for (ChangeRecord change : updated) {
            lines.add("- " + headline(change.record(), false));
            for (FieldDiff diff : change.fieldDiffs()) {
                lines.add("  - " + diff.field() + ": `" + diff.before() + "` → `" + diff.after() + "`");
            }
        }
        lines.add("");
        lines.add("## Noņemti (vairs neatbilst filtriem vai pazuduši)");
        for (String identity : removed) {
            lines.add("- " + identity);
        }
        return String.join("\n", lines) + "\n";
    }

    private String headline(ListingRecord record, boolean detailed) {
        List<String> parts = new ArrayList<>(List.of(
            "**" + orUnknown(record.field("authority")) + "**",
            orUnknown(record.field("bis_number")),
            orUnknown(record.field("address")),
            orUnknown(record.field("object"))
        ));
        if (detailed) {
            parts.add(orUnknown(record.field("phase")));
            parts.add(orUnknown(record.field("construction_type")));
            parts.add(orUnknown(record.field("usage_code")));
        }
        String line = String.join(" — ", parts);
        String link = record.field("details_url");
        return detailed && !link.isBlank() ? line + " [Saite](" + link + ")" : line;
    }

    private String orUnknown(String value) {
        return value == null || value.isBlank() ? "?" : value;
    }
}
