package com.perpradar.exchange;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Hyperliquid Info API client settings. Documented in application.yml under perpradar.hyperliquid.
 */
@ConfigurationProperties(prefix = "perpradar.hyperliquid")
@NoArgsConstructor
@Getter
@Setter
public class HyperliquidProperties {

    private String infoUrl = "https://api.hyperliquid.xyz/info";

    /** Per-call timeout in ms. */
    private long timeoutMs = 30_000L;

    private Retry retry = new Retry();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {
        /** Delay before the second attempt; doubles each attempt. */
        private long baseDelayMs = 1000L;
        /** Jitter factor 0..1 (0.2 = ±20%). */
        private double jitterFactor = 0.0;
        /** Total attempts including the first call. */
        private int maxAttempts = 3;
    }
}
