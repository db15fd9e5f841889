package com.perpradar.registry;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of {@link WalletRegistry#addWallet}. On success {@code evicted} holds the addresses that were
 * dropped to stay within the cap (normally at most one).
 */
public record AddWalletResult(boolean added, String address, Rejection rejection, List<String> evicted) {

    public enum Rejection {
        INVALID_ADDRESS,
        ALREADY_LINKED
    }

    public AddWalletResult {
        evicted = evicted != null ? List.copyOf(evicted) : List.of();
    }

    static AddWalletResult added(String address, List<String> evicted) {
        return new AddWalletResult(true, address, null, evicted);
    }

    static AddWalletResult rejected(String address, Rejection rejection) {
        return new AddWalletResult(false, address, rejection, List.of());
    }

    public Optional<String> evictedAddress() {
        return evicted.isEmpty() ? Optional.empty() : Optional.of(evicted.get(0));
    }
}
