package com.perpradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Last-known positions for one wallet, shared by all of its followers.
 * followersCount is written only through WalletSnapshotRepositoryCustom increments driven by WalletRegistry;
 * positions and timestamp only by SnapshotStore.save. timestamp is null until the first real snapshot.
 */
@Document(collection = "wallet_snapshots")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class WalletSnapshot {

    @Id
    @EqualsAndHashCode.Include
    private String address;
    @Indexed
    private int followersCount;
    private Instant timestamp;
    private List<PositionEntry> positions = new ArrayList<>();

    /**
     * Token entry. notionalUsd is null on records written before USD values were tracked.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class PositionEntry {
        private String token;
        private BigDecimal size;
        private BigDecimal notionalUsd;

        public PositionEntry(String token, BigDecimal size, BigDecimal notionalUsd) {
            this.token = token;
            this.size = size;
            this.notionalUsd = notionalUsd;
        }
    }
}
