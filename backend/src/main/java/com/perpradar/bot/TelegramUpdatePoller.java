package com.perpradar.bot;

import com.perpradar.config.AsyncConfig;
import com.perpradar.telegram.TelegramBotClient;
import com.perpradar.telegram.TelegramProperties;
import com.perpradar.telegram.TelegramUpdate;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Long-polls Telegram for chat messages and answers them through {@link BotCommandHandler}.
 * Runs on its own thread, concurrently with the monitoring job.
 */
@Component
@Slf4j
public class TelegramUpdatePoller {

    private final TelegramBotClient telegramBotClient;
    private final BotCommandHandler commandHandler;
    private final TelegramProperties properties;
    private final Executor executor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private long offset;

    public TelegramUpdatePoller(TelegramBotClient telegramBotClient,
                                BotCommandHandler commandHandler,
                                TelegramProperties properties,
                                @Qualifier(AsyncConfig.TELEGRAM_POLLER_EXECUTOR) Executor executor) {
        this.telegramBotClient = telegramBotClient;
        this.commandHandler = commandHandler;
        this.properties = properties;
        this.executor = executor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isPollingEnabled()) {
            log.info("Telegram polling disabled");
            return;
        }
        if (running.compareAndSet(false, true)) {
            executor.execute(this::pollLoop);
            log.info("Telegram update polling started");
        }
    }

    @PreDestroy
    public void stop() {
        running.set(false);
    }

    private void pollLoop() {
        while (running.get()) {
            try {
                pollOnce();
            } catch (Exception e) {
                log.warn("Telegram getUpdates failed: {}", e.getMessage());
                if (!sleep(properties.getErrorBackoffMs())) {
                    return;
                }
            }
        }
    }

    /**
     * Fetches one batch of updates and answers each message.
     *
     * @return number of updates consumed
     */
    int pollOnce() {
        List<TelegramUpdate> updates = telegramBotClient.getUpdates(offset, properties.getLongPollTimeoutSeconds());
        for (TelegramUpdate update : updates) {
            offset = Math.max(offset, update.updateId() + 1);
            if (!update.hasText()) {
                continue;
            }
            try {
                String reply = commandHandler.handle(update.chatId(), update.displayName(), update.text());
                telegramBotClient.sendMessage(update.chatId(), reply);
            } catch (Exception e) {
                log.warn("Failed to handle message from {}: {}", update.chatId(), e.getMessage());
            }
        }
        return updates.size();
    }

    long getOffset() {
        return offset;
    }

    private static boolean sleep(long millis) {
        try {
            Thread.sleep(Math.max(0L, millis));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
