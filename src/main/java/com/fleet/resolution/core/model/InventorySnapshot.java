package com.fleet.resolution.core.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of all flexible scale sets known at one refresh.
 * Entries are keyed by resource ID and iterate in insertion order.
 * A new snapshot replaces the previous one wholesale; it is never mutated.
 */
public final class InventorySnapshot {

    private static final InventorySnapshot EMPTY = new InventorySnapshot(Map.of(), Instant.EPOCH);

    private final Map<String, ScaleSet> scaleSets;
    private final Instant loadedAt;

    private InventorySnapshot(Map<String, ScaleSet> scaleSets, Instant loadedAt) {
        this.scaleSets = scaleSets;
        this.loadedAt = loadedAt;
    }

    public static InventorySnapshot empty() {
        return EMPTY;
    }

    public Optional<ScaleSet> findById(String scaleSetId) {
        return Optional.ofNullable(scaleSets.get(scaleSetId));
    }

    /**
     * Returns the first scale set whose short name equals {@code name}, ignoring case.
     */
    public Optional<ScaleSet> findByShortName(String name) {
        for (ScaleSet scaleSet : scaleSets.values()) {
            Optional<String> shortName = scaleSet.shortName();
            if (shortName.isPresent() && shortName.get().equalsIgnoreCase(name)) {
                return Optional.of(scaleSet);
            }
        }
        return Optional.empty();
    }

    public boolean contains(String scaleSetId) {
        return scaleSets.containsKey(scaleSetId);
    }

    public Collection<ScaleSet> scaleSets() {
        return scaleSets.values();
    }

    public int size() {
        return scaleSets.size();
    }

    public boolean isEmpty() {
        return scaleSets.isEmpty();
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    @Override
    public String toString() {
        return "InventorySnapshot{size=" + scaleSets.size() + ", loadedAt=" + loadedAt + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects scale sets for one snapshot. Only entries with an ID and
     * FLEXIBLE orchestration are accepted.
     */
    public static class Builder {
        private final Map<String, ScaleSet> scaleSets = new LinkedHashMap<>();
        private Instant loadedAt = Instant.now();

        /**
         * Adds the scale set if eligible.
         *
         * @return true if the scale set was added
         */
        public boolean add(ScaleSet scaleSet) {
            if (scaleSet == null || !scaleSet.hasId() || !scaleSet.isFlexible()) {
                return false;
            }
            scaleSets.put(scaleSet.id(), scaleSet);
            return true;
        }

        public Builder loadedAt(Instant loadedAt) {
            this.loadedAt = loadedAt;
            return this;
        }

        public InventorySnapshot build() {
            return new InventorySnapshot(
                    Collections.unmodifiableMap(new LinkedHashMap<>(scaleSets)), loadedAt);
        }
    }
}
