package com.perpradar.exchange;

import com.perpradar.domain.Position;

import java.util.Map;

/**
 * Current open perp positions of one wallet, keyed by token symbol. Empty map when flat.
 */
public interface PositionFetcher {

    /**
     * @throws PositionFetchException when the upstream call fails after retries, or fails permanently
     */
    Map<String, Position> fetch(String address);
}
