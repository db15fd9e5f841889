package com.perpradar.subscription;

import com.perpradar.domain.SubscribeOutcome;
import com.perpradar.registry.AddWalletResult;
import com.perpradar.registry.RegistryProperties;
import com.perpradar.registry.WalletRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Subscribe/unsubscribe use cases. Keeps wallet links across unsubscribe; follower refcounts are
 * suspended on unsubscribe and restored on re-subscribe through {@link WalletRegistry}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

    private final SubscriberStore subscriberStore;
    private final WalletRegistry walletRegistry;
    private final RegistryProperties registryProperties;

    public SubscribeResult subscribe(long subscriberId, String displayName) {
        SubscribeOutcome outcome = subscriberStore.subscribe(subscriberId, displayName);
        String defaultAdded = null;
        switch (outcome) {
            case NEWLY_SUBSCRIBED -> defaultAdded = linkDefaultWallet(subscriberId);
            case REACTIVATED -> walletRegistry.restoreFollowers(subscriberId);
            case ALREADY_ACTIVE -> { }
        }
        int walletCount = walletRegistry.listWallets(subscriberId).size();
        return new SubscribeResult(outcome, defaultAdded, walletCount);
    }

    /**
     * @return false if the subscriber was not active
     */
    public boolean unsubscribe(long subscriberId) {
        if (!subscriberStore.unsubscribe(subscriberId)) {
            return false;
        }
        walletRegistry.suspendFollowers(subscriberId);
        return true;
    }

    public boolean isSubscribed(long subscriberId) {
        return subscriberStore.isActive(subscriberId);
    }

    private String linkDefaultWallet(long subscriberId) {
        String defaultWallet = registryProperties.getDefaultWalletAddress();
        if (defaultWallet == null || defaultWallet.isBlank()) {
            return null;
        }
        if (!walletRegistry.listWallets(subscriberId).isEmpty()) {
            return null;
        }
        AddWalletResult result = walletRegistry.addWallet(subscriberId, defaultWallet);
        if (!result.added()) {
            log.warn("Default wallet {} not linked for subscriber {}: {}",
                    defaultWallet, subscriberId, result.rejection());
            return null;
        }
        return result.address();
    }
}
