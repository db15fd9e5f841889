package com.perpradar.telegram;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Telegram bot settings. The token is required: the application does not start without it.
 */
@ConfigurationProperties(prefix = "perpradar.telegram")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class TelegramProperties {

    @NotBlank(message = "perpradar.telegram.bot-token must be set (TELEGRAM_BOT_TOKEN)")
    private String botToken;

    private String apiBaseUrl = "https://api.telegram.org";

    /** getUpdates long-poll timeout. */
    private int longPollTimeoutSeconds = 30;

    /** Pause after a failed getUpdates before polling again. */
    private long errorBackoffMs = 5000L;

    /** Disable to run monitoring without reading chat commands. */
    private boolean pollingEnabled = true;
}
