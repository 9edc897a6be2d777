package com.delta.harvester.harvest.state;

import com.delta.harvester.harvest.model.StateEntry;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Identity → last known snapshot. Entries are never removed by the delta engine.
 */
public class StateStore {
    private final Map<String, StateEntry> entries;

    public StateStore() {
        this.entries = new LinkedHashMap<>();
    }

    public StateStore(Map<String, StateEntry> entries) {
        this.entries = new LinkedHashMap<>(entries == null ? Map.of() : entries);
    }

    public static StateStore copyOf(StateStore other) {
        return new StateStore(other.entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public Optional<StateEntry> get(String identity) {
        return Optional.ofNullable(entries.get(identity));
    }

    public boolean contains(String identity) {
        return entries.containsKey(identity);
    }

    public void put(StateEntry entry) {
        entries.put(entry.record().identity(), entry);
    }

    public StateEntry remove(String identity) {
        return entries.remove(identity);
    }

    public Collection<StateEntry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public Map<String, StateEntry> asMap() {
        return Collections.unmodifiableMap(entries);
    }
}
