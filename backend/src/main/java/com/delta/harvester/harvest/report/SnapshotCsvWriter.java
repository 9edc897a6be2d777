package com.delta.harvester.harvest.report;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.harvest.model.StateEntry;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes the whole state store as {@code latest.csv} plus a dated copy.
 */
@Component
public class SnapshotCsvWriter implements ChangeSetSink {
    static final String LATEST_FILE = "latest.csv";
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private final Path reportsDir;
    private final boolean enabled;

    @Autowired
    public SnapshotCsvWriter(HarvesterProperties properties) {
        this(Path.of(properties.getStorage().getReportsDir()), properties.getStorage().isWriteSnapshotCsv());
    }

    SnapshotCsvWriter(Path reportsDir, boolean enabled) {
        this.reportsDir = reportsDir;
        this.enabled = enabled;
    }

    @Override
    public void publish(ChangeSet changeSet) throws IOException {
        if (!enabled) {
            return;
        }
        Files.createDirectories(reportsDir);
        Path latest = reportsDir.resolve(LATEST_FILE);
        List<StateEntry> entries = new ArrayList<>(changeSet.state().entries());
        Set<String> fieldNames = new LinkedHashSet<>();
        for (StateEntry entry : entries) {
            fieldNames.addAll(entry.record().fields().keySet());
        }
        List<String> header = new ArrayList<>(List.of("id", "first_seen", "last_seen"));
        header.addAll(fieldNames);

        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(header.toArray(String[]::new))
            .build();
        try (Writer writer = Files.newBufferedWriter(latest, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (StateEntry entry : entries) {
                List<String> row = new ArrayList<>();
                row.add(entry.record().identity());
                row.add(entry.firstSeen() == null ? "" : entry.firstSeen().toString());
                row.add(entry.lastSeen() == null ? "" : entry.lastSeen().toString());
                for (String field : fieldNames) {
                    row.add(entry.record().field(field));
                }
                printer.printRecord(row);
            }
        }
        Files.copy(
            latest,
            reportsDir.resolve(DAY.format(changeSet.generatedAt()) + ".csv"),
            StandardCopyOption.REPLACE_EXISTING
        );
    }
}
