package com.perpradar.subscription;

import com.perpradar.domain.SubscribeOutcome;

/**
 * Subscribe outcome plus what the user should be told: the default wallet linked for a new
 * subscriber (null if none) and the current number of linked wallets.
 */
public record SubscribeResult(SubscribeOutcome outcome, String defaultWalletAdded, int walletCount) {
}
