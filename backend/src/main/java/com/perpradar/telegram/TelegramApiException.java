package com.perpradar.telegram;

/**
 * Thrown when a Bot API call fails (HTTP error or {@code "ok": false}).
 */
public class TelegramApiException extends RuntimeException {

    public TelegramApiException(String message) {
        super(message);
    }

    public TelegramApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
