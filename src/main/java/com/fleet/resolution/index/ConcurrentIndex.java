package com.fleet.resolution.index;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiConsumer;

/**
 * Thread-safe lookup table from one identity string to another.
 * Individual operations are atomic; there is no coupling between tables.
 */
public class ConcurrentIndex {

    private final ConcurrentMap<String, String> entries = new ConcurrentHashMap<>();

    public Optional<String> load(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(key));
    }

    public void store(String key, String value) {
        entries.put(key, value);
    }

    /**
     * Removes the entry for the key.
     *
     * @return the removed value, or empty if there was none
     */
    public Optional<String> delete(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.remove(key));
    }

    /**
     * Visits every entry. Concurrent modification is tolerated; the visit
     * reflects some state of the table at or after the call began.
     */
    public void forEach(BiConsumer<String, String> action) {
        entries.forEach(action);
    }

    public int size() {
        return entries.size();
    }
}
