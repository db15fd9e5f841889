package com.perpradar.bot;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Chat command settings. Documented in application.yml under perpradar.bot.
 */
@ConfigurationProperties(prefix = "perpradar.bot")
@NoArgsConstructor
@Getter
@Setter
public class BotProperties {

    /** A chat waiting for an address or index falls back to idle after this many idle minutes. */
    private int sessionTtlMinutes = 10;

    /** Shown in /start; the poll interval the users should expect. */
    private int pollIntervalMinutes = 20;
}
