package com.perpradar.snapshot;

import com.perpradar.domain.Position;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot as read back from the store: positions by token and the time of the last real change.
 */
public record StoredSnapshot(Map<String, Position> positions, Instant timestamp) {

    public StoredSnapshot {
        positions = positions != null ? Map.copyOf(positions) : Map.of();
    }

    public static StoredSnapshot empty() {
        return new StoredSnapshot(Map.of(), null);
    }

    /** Empty when the wallet has never had a snapshot saved. */
    public Optional<Instant> lastTimestamp() {
        return Optional.ofNullable(timestamp);
    }
}
