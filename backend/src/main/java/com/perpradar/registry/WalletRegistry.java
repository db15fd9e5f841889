package com.perpradar.registry;

import com.perpradar.common.EvmAddresses;
import com.perpradar.domain.Subscriber;
import com.perpradar.domain.SubscriberRepository;
import com.perpradar.domain.WalletLink;
import com.perpradar.domain.WalletLinkRepository;
import com.perpradar.snapshot.SnapshotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Subscriber → wallet links, capped per subscriber with FIFO eviction. Sole writer of the follower
 * refcount in {@link SnapshotStore}: every link activation/deactivation of an active subscriber moves
 * the count of that address by exactly one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletRegistry {

    private static final Comparator<WalletLink> OLDEST_FIRST = Comparator
            .comparing(WalletLink::getAddedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(WalletLink::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final WalletLinkRepository walletLinkRepository;
    private final SubscriberRepository subscriberRepository;
    private final SnapshotStore snapshotStore;
    private final RegistryProperties properties;
    private final Clock clock;

    /**
     * Links the address to the subscriber. Rejects malformed addresses and addresses already linked.
     * When the subscriber is at capacity the oldest active link is deactivated first, never the new one.
     */
    public AddWalletResult addWallet(long subscriberId, String address) {
        String normalized = EvmAddresses.normalize(address);
        if (!EvmAddresses.isValid(normalized)) {
            return AddWalletResult.rejected(normalized, AddWalletResult.Rejection.INVALID_ADDRESS);
        }
        List<WalletLink> active = activeLinks(subscriberId);
        if (active.stream().anyMatch(l -> normalized.equals(l.getAddress()))) {
            log.info("Wallet {} already linked for subscriber {}", normalized, subscriberId);
            return AddWalletResult.rejected(normalized, AddWalletResult.Rejection.ALREADY_LINKED);
        }
        boolean counted = isSubscriberActive(subscriberId);

        List<String> evicted = new ArrayList<>();
        int cap = Math.max(1, properties.getMaxWalletsPerSubscriber());
        while (active.size() >= cap) {
            WalletLink oldest = active.remove(0);
            deactivate(oldest, counted);
            evicted.add(oldest.getAddress());
            log.info("Evicted oldest wallet {} for subscriber {}", oldest.getAddress(), subscriberId);
        }

        WalletLink link = new WalletLink();
        link.setSubscriberId(subscriberId);
        link.setAddress(normalized);
        link.setAddedAt(Instant.now(clock));
        link.setActive(true);
        walletLinkRepository.save(link);
        if (counted) {
            snapshotStore.incrementFollowers(normalized);
        }
        log.info("Added wallet {} for subscriber {}", normalized, subscriberId);
        return AddWalletResult.added(normalized, evicted);
    }

    /**
     * Deactivates the subscriber's active link to the address.
     *
     * @return false if no such active link exists
     */
    public boolean removeWallet(long subscriberId, String address) {
        String normalized = EvmAddresses.normalize(address);
        Optional<WalletLink> link = walletLinkRepository
                .findFirstBySubscriberIdAndAddressAndActiveTrue(subscriberId, normalized);
        if (link.isEmpty()) {
            return false;
        }
        deactivate(link.get(), isSubscriberActive(subscriberId));
        log.info("Removed wallet {} for subscriber {}", normalized, subscriberId);
        return true;
    }

    /**
     * Removes the wallet at the 1-based position of {@link #listWallets}.
     *
     * @return the removed address, empty if the index is out of range
     */
    public Optional<String> removeWalletAt(long subscriberId, int index) {
        List<LinkedWallet> wallets = listWallets(subscriberId);
        if (index < 1 || index > wallets.size()) {
            return Optional.empty();
        }
        String address = wallets.get(index - 1).address();
        return removeWallet(subscriberId, address) ? Optional.of(address) : Optional.empty();
    }

    /** Active wallets, oldest first. */
    public List<LinkedWallet> listWallets(long subscriberId) {
        return activeLinks(subscriberId).stream()
                .map(l -> new LinkedWallet(l.getAddress(), l.getAddedAt()))
                .toList();
    }

    /** Subscribers with an active link to the address and an active subscription. */
    public Set<Long> listActiveFollowers(String address) {
        String normalized = EvmAddresses.normalize(address);
        Set<Long> linked = walletLinkRepository.findByAddressAndActiveTrue(normalized).stream()
                .map(WalletLink::getSubscriberId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (linked.isEmpty()) {
            return Set.of();
        }
        return subscriberRepository.findByIdInAndActiveTrue(linked).stream()
                .map(Subscriber::getId)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /** Addresses with at least one active follower. */
    public Set<String> listMonitoredAddresses() {
        return new TreeSet<>(snapshotStore.findMonitoredAddresses());
    }

    /** Re-counts the subscriber on every wallet still linked; called after re-subscribe. */
    public void restoreFollowers(long subscriberId) {
        List<WalletLink> links = activeLinks(subscriberId);
        links.forEach(l -> snapshotStore.incrementFollowers(l.getAddress()));
        log.info("Restored {} wallet follow(s) for subscriber {}", links.size(), subscriberId);
    }

    /** Un-counts the subscriber on every linked wallet; links themselves stay active. */
    public void suspendFollowers(long subscriberId) {
        List<WalletLink> links = activeLinks(subscriberId);
        links.forEach(l -> snapshotStore.decrementFollowers(l.getAddress()));
        log.info("Suspended {} wallet follow(s) for subscriber {}", links.size(), subscriberId);
    }

    /**
     * Recomputes every refcount from scratch as (active subscriber, active link) pairs.
     * Used after bulk imports; normal operation is incremental.
     */
    public void rebuildFollowerCounts() {
        Set<Long> activeSubscribers = subscriberRepository.findByActiveTrue().stream()
                .map(Subscriber::getId)
                .collect(Collectors.toSet());
        Map<String, Integer> counts = new HashMap<>();
        for (String address : snapshotStore.findAllAddresses()) {
            counts.put(address, 0);
        }
        for (WalletLink link : walletLinkRepository.findByActiveTrue()) {
            if (activeSubscribers.contains(link.getSubscriberId())) {
                counts.merge(link.getAddress(), 1, Integer::sum);
            }
        }
        counts.forEach(snapshotStore::resetFollowers);
        log.info("Rebuilt follower counts for {} wallet(s)", counts.size());
    }

    private List<WalletLink> activeLinks(long subscriberId) {
        List<WalletLink> links = new ArrayList<>(
                walletLinkRepository.findBySubscriberIdAndActiveTrueOrderByAddedAtAsc(subscriberId));
        links.sort(OLDEST_FIRST);
        return links;
    }

    private void deactivate(WalletLink link, boolean counted) {
        link.setActive(false);
        walletLinkRepository.save(link);
        if (counted) {
            snapshotStore.decrementFollowers(link.getAddress());
        }
    }

    private boolean isSubscriberActive(long subscriberId) {
        return subscriberRepository.findById(subscriberId)
                .map(Subscriber::isActive)
                .orElse(false);
    }
}
