package com.company.sensoretl.domain;

import java.time.Instant;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Immutable snapshot of the target store's signal name to id mapping.
 */
public final class SignalRegistry {

    private final Map<String, Long> idsByName;
    private final Instant loadedAt;

    public SignalRegistry(Map<String, Long> idsByName, Instant loadedAt) {
        this.idsByName = Map.copyOf(idsByName);
        this.loadedAt = loadedAt;
    }

    public static SignalRegistry empty() {
        return new SignalRegistry(Map.of(), Instant.EPOCH);
    }

    public OptionalLong lookup(String signalName) {
        Long id = idsByName.get(signalName);
        return id == null ? OptionalLong.empty() : OptionalLong.of(id);
    }

    public int size() {
        return idsByName.size();
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }
}
