package com.perpradar.domain;

import java.time.Instant;
import java.util.List;

/**
 * Atomic per-address updates for wallet_snapshots. Refcount and content are updated independently
 * so a refcount change never overwrites positions and vice versa.
 */
public interface WalletSnapshotRepositoryCustom {

    /** $inc followersCount by 1; creates an empty record (no timestamp) when the address is unseen. */
    void incrementFollowers(String address);

    /** $inc followersCount by -1 only while it is above zero. No-op for unseen addresses. */
    void decrementFollowers(String address);

    /** Overwrites followersCount; used when rebuilding counts from links. */
    void setFollowers(String address, int followersCount);

    /** $set positions and timestamp, leaving followersCount untouched (0 on insert). */
    void savePositions(String address, List<WalletSnapshot.PositionEntry> positions, Instant timestamp);

    /** Addresses with followersCount &gt; 0. */
    List<String> findMonitoredAddresses();

    List<String> findAllAddresses();
}
