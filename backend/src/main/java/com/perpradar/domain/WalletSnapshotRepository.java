package com.perpradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for wallet_snapshots keyed by lowercase address.
 */
public interface WalletSnapshotRepository extends MongoRepository<WalletSnapshot, String>, WalletSnapshotRepositoryCustom {
}
