package com.perpradar.telegram;

import java.util.List;

/**
 * Telegram Bot API subset used by the bot: long-poll updates and plain-text messages.
 */
public interface TelegramBotClient {

    /**
     * Blocks for up to {@code timeoutSeconds} waiting for updates with id &gt;= offset.
     */
    List<TelegramUpdate> getUpdates(long offset, int timeoutSeconds);

    void sendMessage(long chatId, String text);
}
