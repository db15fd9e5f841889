package com.perpradar.domain;

/**
 * Result of a subscribe command.
 */
public enum SubscribeOutcome {
    NEWLY_SUBSCRIBED,
    REACTIVATED,
    ALREADY_ACTIVE
}
