package com.perpradar.snapshot;

import com.perpradar.common.EvmAddresses;
import com.perpradar.domain.Position;
import com.perpradar.domain.WalletSnapshot;
import com.perpradar.domain.WalletSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Last-known position snapshot per unique wallet address, annotated with its follower refcount.
 * Content (positions, timestamp) and refcount are written by separate atomic updates. Refcount
 * methods are meant to be called only by WalletRegistry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotStore {

    private final WalletSnapshotRepository repository;

    /**
     * Positions and timestamp for the address; empty snapshot without timestamp if unseen.
     * Entries saved without a USD value read as zero.
     */
    public StoredSnapshot load(String address) {
        String key = EvmAddresses.normalize(address);
        return repository.findById(key)
                .map(SnapshotStore::toStored)
                .orElseGet(StoredSnapshot::empty);
    }

    /**
     * Replaces the token map and timestamp. followersCount is preserved.
     */
    public void save(String address, Map<String, Position> positions, Instant timestamp) {
        String key = EvmAddresses.normalize(address);
        List<WalletSnapshot.PositionEntry> entries = new ArrayList<>();
        new TreeMap<>(positions).forEach((token, p) ->
                entries.add(new WalletSnapshot.PositionEntry(token, p.size(), p.notionalUsd())));
        repository.savePositions(key, entries, timestamp);
        log.debug("Saved snapshot for {} with {} positions", key, entries.size());
    }

    /**
     * +1 follower. An unseen address gets a zero-position record with no timestamp; its first real
     * snapshot is taken by the next monitoring pass.
     */
    public void incrementFollowers(String address) {
        repository.incrementFollowers(EvmAddresses.normalize(address));
    }

    /** -1 follower, floored at zero; no-op for unseen addresses. */
    public void decrementFollowers(String address) {
        repository.decrementFollowers(EvmAddresses.normalize(address));
    }

    /** Overwrites the refcount; used only when rebuilding counts from links. */
    public void resetFollowers(String address, int followersCount) {
        repository.setFollowers(EvmAddresses.normalize(address), followersCount);
    }

    public int followersOf(String address) {
        return repository.findById(EvmAddresses.normalize(address))
                .map(WalletSnapshot::getFollowersCount)
                .orElse(0);
    }

    public List<String> findMonitoredAddresses() {
        return repository.findMonitoredAddresses();
    }

    public List<String> findAllAddresses() {
        return repository.findAllAddresses();
    }

    private static StoredSnapshot toStored(WalletSnapshot snapshot) {
        Map<String, Position> positions = new LinkedHashMap<>();
        if (snapshot.getPositions() != null) {
            for (WalletSnapshot.PositionEntry entry : snapshot.getPositions()) {
                if (entry == null || entry.getToken() == null) {
                    continue;
                }
                positions.put(entry.getToken(), new Position(entry.getSize(), entry.getNotionalUsd()));
            }
        }
        return new StoredSnapshot(positions, snapshot.getTimestamp());
    }
}
