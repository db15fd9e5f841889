package com.perpradar.alert;

import com.perpradar.telegram.TelegramApiException;
import com.perpradar.telegram.TelegramBotClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TelegramAlertDispatcherTest {

    @Mock
    private TelegramBotClient telegramBotClient;

    private TelegramAlertDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        RateLimiter unlimited = RateLimiter.of("test", RateLimiterConfig.custom()
                .limitForPeriod(1000)
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(Duration.ZERO)
                .build());
        dispatcher = new TelegramAlertDispatcher(telegramBotClient, unlimited);
    }

    @Test
    @DisplayName("failure for one recipient does not stop delivery to the others")
    void dispatch_failureIsolated() {
        doThrow(new TelegramApiException("blocked by user")).when(telegramBotClient).sendMessage(2L, "alert");

        int delivered = dispatcher.dispatch(List.of(1L, 2L, 3L), "alert");

        assertThat(delivered).isEqualTo(2);
        verify(telegramBotClient).sendMessage(1L, "alert");
        verify(telegramBotClient).sendMessage(2L, "alert");
        verify(telegramBotClient).sendMessage(3L, "alert");
    }

    @Test
    @DisplayName("no recipients sends nothing")
    void dispatch_noRecipients() {
        assertThat(dispatcher.dispatch(List.of(), "alert")).isZero();
        verifyNoInteractions(telegramBotClient);
    }

    @Test
    @DisplayName("recipients beyond the rate limit are skipped when no permit frees up in time")
    void dispatch_rateLimited() {
        RateLimiter one = RateLimiter.of("one", RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(Duration.ofHours(1))
                .timeoutDuration(Duration.ZERO)
                .build());
        TelegramAlertDispatcher limited = new TelegramAlertDispatcher(telegramBotClient, one);

        assertThat(limited.dispatch(List.of(1L, 2L), "alert")).isEqualTo(1);
        verify(telegramBotClient).sendMessage(1L, "alert");
    }
}
