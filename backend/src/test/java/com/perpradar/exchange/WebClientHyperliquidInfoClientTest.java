package com.perpradar.exchange;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class WebClientHyperliquidInfoClientTest {

    private static final String URL = "https://api.hyperliquid.test/info";
    private static final String ADDRESS = "0xb317d2bc2d3d2df5fa441b5bae0ab9d8b07283ae";

    private static WebClientHyperliquidInfoClient clientReturning(HttpStatus status, String body,
                                                                  AtomicReference<ClientRequest> captured) {
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(req -> {
                    captured.set(req);
                    return Mono.just(ClientResponse.create(status)
                            .header("Content-Type", "application/json")
                            .body(body)
                            .build());
                });
        return new WebClientHyperliquidInfoClient(builder, URL, Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("POSTs clearinghouseState to the info URL and returns the body")
    void clearinghouseState_success() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        WebClientHyperliquidInfoClient client = clientReturning(HttpStatus.OK, "{\"assetPositions\":[]}", captured);

        StepVerifier.create(client.clearinghouseState(ADDRESS))
                .expectNext("{\"assetPositions\":[]}")
                .verifyComplete();

        assertThat(captured.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(captured.get().url().toString()).isEqualTo(URL);
    }

    @Test
    @DisplayName("429 maps to a retryable PositionFetchException")
    void clearinghouseState_rateLimited() {
        WebClientHyperliquidInfoClient client = clientReturning(HttpStatus.TOO_MANY_REQUESTS, "", new AtomicReference<>());

        StepVerifier.create(client.clearinghouseState(ADDRESS))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(PositionFetchException.class);
                    assertThat(((PositionFetchException) e).getStatus()).isEqualTo(429);
                    assertThat(((PositionFetchException) e).isRetryable()).isTrue();
                })
                .verify();
    }

    @Test
    @DisplayName("422 maps to a non-retryable PositionFetchException")
    void clearinghouseState_clientError() {
        WebClientHyperliquidInfoClient client = clientReturning(HttpStatus.UNPROCESSABLE_ENTITY, "bad user", new AtomicReference<>());

        StepVerifier.create(client.clearinghouseState(ADDRESS))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(PositionFetchException.class);
                    assertThat(((PositionFetchException) e).isRetryable()).isFalse();
                })
                .verify();
    }

    @Test
    @DisplayName("no response within the timeout is retryable")
    void clearinghouseState_timeout() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(req -> Mono.never());
        WebClientHyperliquidInfoClient client = new WebClientHyperliquidInfoClient(builder, URL, Duration.ofMillis(50));

        StepVerifier.create(client.clearinghouseState(ADDRESS))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(PositionFetchException.class);
                    assertThat(((PositionFetchException) e).isRetryable()).isTrue();
                })
                .verify(Duration.ofSeconds(5));
    }
}
