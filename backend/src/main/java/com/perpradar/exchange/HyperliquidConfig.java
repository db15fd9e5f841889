package com.perpradar.exchange;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.perpradar.common.RetryPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the Hyperliquid client and the retrying position fetcher from perpradar.hyperliquid.
 */
@Configuration
@EnableConfigurationProperties(HyperliquidProperties.class)
public class HyperliquidConfig {

    @Bean
    public HyperliquidInfoClient hyperliquidInfoClient(WebClient.Builder webClientBuilder, HyperliquidProperties properties) {
        return new WebClientHyperliquidInfoClient(webClientBuilder, properties.getInfoUrl(),
                Duration.ofMillis(properties.getTimeoutMs()));
    }

    @Bean
    public PositionFetcher positionFetcher(HyperliquidInfoClient client, ObjectMapper objectMapper,
                                           HyperliquidProperties properties) {
        HyperliquidProperties.Retry retry = properties.getRetry();
        RetryPolicy retryPolicy = new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
        return new HyperliquidPositionFetcher(client, objectMapper, retryPolicy);
    }
}
