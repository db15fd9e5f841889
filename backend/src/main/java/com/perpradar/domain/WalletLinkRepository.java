package com.perpradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for wallet_links. Only WalletRegistry writes here.
 */
public interface WalletLinkRepository extends MongoRepository<WalletLink, String> {

    List<WalletLink> findBySubscriberIdAndActiveTrueOrderByAddedAtAsc(Long subscriberId);

    Optional<WalletLink> findFirstBySubscriberIdAndAddressAndActiveTrue(Long subscriberId, String address);

    List<WalletLink> findByAddressAndActiveTrue(String address);

    List<WalletLink> findByActiveTrue();
}
