package com.perpradar.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of WalletSnapshotRepositoryCustom using single-document MongoTemplate updates.
 */
@Repository
@RequiredArgsConstructor
public class WalletSnapshotRepositoryImpl implements WalletSnapshotRepositoryCustom {

    private static final String ID = "_id";
    private static final String FOLLOWERS = "followersCount";

    private final MongoTemplate mongoTemplate;

    @Override
    public void incrementFollowers(String address) {
        Query query = new Query(where(ID).is(address));
        Update update = new Update()
                .inc(FOLLOWERS, 1)
                .setOnInsert("positions", new ArrayList<>());
        mongoTemplate.findAndModify(query, update, FindAndModifyOptions.options().upsert(true), WalletSnapshot.class);
    }

    @Override
    public void decrementFollowers(String address) {
        Query query = new Query(where(ID).is(address).and(FOLLOWERS).gt(0));
        mongoTemplate.updateFirst(query, new Update().inc(FOLLOWERS, -1), WalletSnapshot.class);
    }

    @Override
    public void setFollowers(String address, int followersCount) {
        Query query = new Query(where(ID).is(address));
        Update update = new Update()
                .set(FOLLOWERS, Math.max(0, followersCount))
                .setOnInsert("positions", new ArrayList<>());
        mongoTemplate.upsert(query, update, WalletSnapshot.class);
    }

    @Override
    public void savePositions(String address, List<WalletSnapshot.PositionEntry> positions, Instant timestamp) {
        Query query = new Query(where(ID).is(address));
        Update update = new Update()
                .set("positions", positions)
                .set("timestamp", timestamp)
                .setOnInsert(FOLLOWERS, 0);
        mongoTemplate.upsert(query, update, WalletSnapshot.class);
    }

    @Override
    public List<String> findMonitoredAddresses() {
        Query query = new Query(where(FOLLOWERS).gt(0));
        return mongoTemplate.findDistinct(query, ID, WalletSnapshot.class, String.class);
    }

    @Override
    public List<String> findAllAddresses() {
        return mongoTemplate.findDistinct(new Query(), ID, WalletSnapshot.class, String.class);
    }
}
