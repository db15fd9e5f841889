package com.perpradar.telegram;

/**
 * Incoming text message. chatId doubles as the subscriber id (private chats).
 */
public record TelegramUpdate(long updateId, Long chatId, String displayName, String text) {

    public boolean hasText() {
        return chatId != null && text != null && !text.isBlank();
    }
}
