package com.perpradar.alert;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Alert module configuration: properties and the outbound message rate limiter.
 */
@Configuration
@EnableConfigurationProperties(AlertProperties.class)
public class AlertConfig {

    public static final String TELEGRAM_SEND_RATE_LIMITER = "telegramSendRateLimiter";

    @Bean(name = TELEGRAM_SEND_RATE_LIMITER)
    public RateLimiter telegramSendRateLimiter(AlertProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getMaxMessagesPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getPermitTimeoutMs())))
                .build();
        return RateLimiter.of("telegram-send", config);
    }
}
