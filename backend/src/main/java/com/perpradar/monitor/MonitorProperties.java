package com.perpradar.monitor;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Monitoring job timing. Intervals are measured from the end of one cycle to the start of the next.
 */
@ConfigurationProperties(prefix = "perpradar.monitor")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class MonitorProperties {

    private boolean enabled = true;

    @Min(1)
    private long pollIntervalMs = 1_200_000L;

    /** Random extra delay added to every interval, uniformly in [0, maxJitterMs]. */
    @Min(0)
    private long maxJitterMs = 60_000L;

    /** Delay before the first cycle after startup. */
    @Min(0)
    private long initialDelayMs = 0L;

    /** Pause between two wallet fetches within a cycle. */
    @Min(0)
    private long perWalletDelayMs = 1_000L;
}
