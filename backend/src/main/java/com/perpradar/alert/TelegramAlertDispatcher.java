package com.perpradar.alert;

import com.perpradar.telegram.TelegramBotClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Sends alerts as Telegram messages, throttled by a shared rate limiter. One recipient's failure
 * does not stop delivery to the rest.
 */
@Component
@Slf4j
public class TelegramAlertDispatcher implements AlertDispatcher {

    private final TelegramBotClient telegramBotClient;
    private final RateLimiter rateLimiter;

    public TelegramAlertDispatcher(TelegramBotClient telegramBotClient,
                                   @Qualifier(AlertConfig.TELEGRAM_SEND_RATE_LIMITER) RateLimiter rateLimiter) {
        this.telegramBotClient = telegramBotClient;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public int dispatch(Collection<Long> recipients, String message) {
        int delivered = 0;
        for (Long chatId : recipients) {
            try {
                if (!rateLimiter.acquirePermission()) {
                    log.warn("Alert to {} dropped: send rate limit wait timed out", chatId);
                    continue;
                }
                telegramBotClient.sendMessage(chatId, message);
                delivered++;
            } catch (Exception e) {
                log.warn("Failed to send alert to {}: {}", chatId, e.getMessage());
            }
        }
        return delivered;
    }
}
