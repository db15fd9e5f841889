package com.perpradar.alert;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Alert formatting and delivery. Documented in application.yml under perpradar.alert.
 */
@ConfigurationProperties(prefix = "perpradar.alert")
@NoArgsConstructor
@Getter
@Setter
public class AlertProperties {

    /** Zone used for the timestamps shown in alerts. */
    private String timeZone = "Asia/Seoul";

    /** Header line of every alert. */
    private String title = "[Perp Radar]";

    /** Telegram allows roughly 30 messages per second per bot. */
    private int maxMessagesPerSecond = 25;

    /** How long one send may wait for a permit before it counts as failed. */
    private long permitTimeoutMs = 5000L;
}
