package com.perpradar.registry;

import java.time.Instant;

/**
 * Active wallet of a subscriber as listed to the user; position 1 is the oldest.
 */
public record LinkedWallet(String address, Instant addedAt) {
}
