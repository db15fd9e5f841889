package com.perpradar.exchange;

import reactor.core.publisher.Mono;

/**
 * Hyperliquid Info API abstraction for testing. Retries are handled by {@link HyperliquidPositionFetcher}.
 */
public interface HyperliquidInfoClient {

    /** Raw JSON of {@code {"type":"clearinghouseState","user":address}}. */
    Mono<String> clearinghouseState(String address);
}
