package com.delta.harvester.harvest.persistence;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.harvest.model.FailedPageEntry;
import com.delta.harvester.harvest.model.HarvestCursor;
import com.delta.harvester.harvest.model.HarvestRunStatus;
import com.delta.harvester.harvest.model.StateEntry;
import com.delta.harvester.harvest.state.StateStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One JSON document per durable concern. Missing or zero-byte documents read as defaults;
 * unreadable ones raise {@link StateDocumentException}. Writes go through a temp file and a move.
 */
@Repository
public class HarvestStateRepository {
    static final String STATE_STORE_DOCUMENT = "state-store.json";
    static final String CURSOR_DOCUMENT = "cursor.json";
    static final String FAILED_PAGES_DOCUMENT = "failed-pages.json";
    static final String RUN_STATUS_DOCUMENT = "run-status.json";

    private static final TypeReference<LinkedHashMap<String, StateEntry>> STATE_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<FailedPageEntry>> FAILED_PAGES_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Path dataDir;

    @Autowired
    public HarvestStateRepository(ObjectMapper objectMapper, HarvesterProperties properties) {
        this(objectMapper, Path.of(properties.getStorage().getDataDir()));
    }

    HarvestStateRepository(ObjectMapper objectMapper, Path dataDir) {
        this.objectMapper = objectMapper;
        this.dataDir = dataDir;
    }

    public StateStore loadStateStore() {
        Map<String, StateEntry> entries = read(STATE_STORE_DOCUMENT, STATE_TYPE).orElseGet(LinkedHashMap::new);
        return new StateStore(entries);
    }

    public void saveStateStore(StateStore stateStore) {
        write(STATE_STORE_DOCUMENT, new LinkedHashMap<>(stateStore.asMap()));
    }

    public HarvestCursor loadCursor() {
        return read(CURSOR_DOCUMENT, new TypeReference<HarvestCursor>() {
        }).orElseGet(HarvestCursor::initial);
    }

    public void saveCursor(HarvestCursor cursor) {
        write(CURSOR_DOCUMENT, cursor);
    }

    public List<FailedPageEntry> loadFailedPages() {
        return read(FAILED_PAGES_DOCUMENT, FAILED_PAGES_TYPE).map(List::copyOf).orElseGet(List::of);
    }

    public void saveFailedPages(List<FailedPageEntry> failedPages) {
        write(FAILED_PAGES_DOCUMENT, failedPages);
    }

    public Optional<HarvestRunStatus> loadRunStatus() {
        return read(RUN_STATUS_DOCUMENT, new TypeReference<HarvestRunStatus>() {
        });
    }

    public void saveRunStatus(HarvestRunStatus status) {
        write(RUN_STATUS_DOCUMENT, status);
    }

    private <T> Optional<T> read(String document, TypeReference<T> type) {
        Path path = dataDir.resolve(document);
        try {
            if (!Files.exists(path) || Files.size(path) == 0) {
                return Optional.empty();
            }
            return Optional.ofNullable(objectMapper.readValue(path.toFile(), type));
        } catch (IOException e) {
            throw new StateDocumentException("Unable to read " + path, e);
        }
    }

    private void write(String document, Object value) {
        Path target = dataDir.resolve(document);
        Path temp = null;
        try {
            Files.createDirectories(dataDir);
            temp = Files.createTempFile(dataDir, document, ".tmp");
            objectMapper.writeValue(temp.toFile(), value);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp, e);
            throw new StateDocumentException("Unable to write " + target, e);
        }
    }

    private void deleteQuietly(Path temp, IOException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
