package com.perpradar.exchange;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Hyperliquid Info API client using WebClient. Maps HTTP, timeout and connection failures to
 * {@link PositionFetchException} with the retry classification.
 */
public class WebClientHyperliquidInfoClient implements HyperliquidInfoClient {

    private final WebClient webClient;
    private final String infoUrl;
    private final Duration timeout;

    public WebClientHyperliquidInfoClient(WebClient.Builder builder, String infoUrl, Duration timeout) {
        this.webClient = builder.build();
        this.infoUrl = infoUrl;
        this.timeout = timeout;
    }

    @Override
    public Mono<String> clearinghouseState(String address) {
        Map<String, Object> body = Map.of(
                "type", "clearinghouseState",
                "user", address,
                "dex", ""
        );
        return webClient.post()
                .uri(infoUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(WebClientResponseException.class, e -> new PositionFetchException(
                        "HTTP " + e.getStatusCode().value() + " from Hyperliquid", e,
                        e.getStatusCode().value(), PositionFetchException.isRetryableStatus(e.getStatusCode().value())))
                .onErrorMap(TimeoutException.class, e -> new PositionFetchException(
                        "Hyperliquid request timed out after " + timeout.toMillis() + "ms", e, 0, true))
                .onErrorMap(WebClientRequestException.class, e -> new PositionFetchException(
                        "Hyperliquid request failed: " + e.getMessage(), e, 0, true));
    }
}
