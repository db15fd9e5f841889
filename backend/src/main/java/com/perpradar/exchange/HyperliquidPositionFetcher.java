package com.perpradar.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.perpradar.common.RetryPolicy;
import com.perpradar.domain.Position;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Fetches perp positions from Hyperliquid {@code clearinghouseState}. Retries rate-limit, server and
 * transport failures with exponential backoff up to the policy's attempt ceiling; other failures
 * propagate on the first attempt. Malformed position entries are skipped one by one.
 */
@Slf4j
public class HyperliquidPositionFetcher implements PositionFetcher {

    private final HyperliquidInfoClient client;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;

    public HyperliquidPositionFetcher(HyperliquidInfoClient client, ObjectMapper objectMapper, RetryPolicy retryPolicy) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    @Override
    public Map<String, Position> fetch(String address) {
        String json = callWithRetry(address);
        Map<String, Position> positions = parsePositions(json);
        log.info("Fetched {} positions for {}", positions.size(), address);
        return positions;
    }

    private String callWithRetry(String address) {
        PositionFetchException lastException = null;
        for (int attempt = 0; attempt < retryPolicy.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                long delay = retryPolicy.delayMs(attempt - 1);
                log.warn("Retrying positions for {} in {}ms (attempt {}/{}): {}",
                        address, delay, attempt + 1, retryPolicy.getMaxAttempts(), lastException.getMessage());
                sleepQuietly(delay);
            }
            try {
                String json = client.clearinghouseState(address).block();
                if (json == null || json.isBlank()) {
                    throw new PositionFetchException("Empty Hyperliquid response", 0, false);
                }
                return json;
            } catch (PositionFetchException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                lastException = e;
            }
        }
        throw new PositionFetchException(
                "Hyperliquid failed after " + retryPolicy.getMaxAttempts() + " attempts: " + lastException.getMessage(),
                lastException, lastException.getStatus(), true);
    }

    Map<String, Position> parsePositions(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new PositionFetchException("Unparseable Hyperliquid response", e, 0, false);
        }
        Map<String, Position> positions = new LinkedHashMap<>();
        JsonNode assetPositions = root.path("assetPositions");
        if (!assetPositions.isArray()) {
            return positions;
        }
        for (JsonNode asset : assetPositions) {
            try {
                JsonNode position = asset.get("position");
                String coin = position.get("coin").asText();
                if (coin.isBlank()) {
                    throw new IllegalArgumentException("blank coin");
                }
                BigDecimal size = new BigDecimal(position.get("szi").asText());
                JsonNode value = position.get("positionValue");
                BigDecimal notional = value == null || value.isNull() ? BigDecimal.ZERO : new BigDecimal(value.asText());
                positions.put(coin.toUpperCase(Locale.ROOT), new Position(size, notional));
            } catch (RuntimeException e) {
                log.warn("Skipping malformed position entry {}: {}", asset, e.toString());
            }
        }
        return positions;
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(Math.max(0L, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PositionFetchException("Interrupted during retry backoff", e, 0, false);
        }
    }
}
