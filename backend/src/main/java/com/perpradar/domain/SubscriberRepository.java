package com.perpradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

/**
 * Persistence for subscribers keyed by chat id.
 */
public interface SubscriberRepository extends MongoRepository<Subscriber, Long> {

    List<Subscriber> findByActiveTrue();

    List<Subscriber> findByIdInAndActiveTrue(Collection<Long> ids);
}
