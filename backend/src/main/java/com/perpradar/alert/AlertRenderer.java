package com.perpradar.alert;

import com.perpradar.common.EvmAddresses;
import com.perpradar.detection.PositionChange;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Formats one alert for one wallet. Deterministic: same inputs, same text.
 */
@Component
public class AlertRenderer {

    static final String FIRST_SNAPSHOT = "first snapshot";

    private final String title;
    private final DateTimeFormatter timestampFormat;

    @Autowired
    public AlertRenderer(AlertProperties properties) {
        this(properties.getTitle(), ZoneId.of(properties.getTimeZone()));
    }

    AlertRenderer(String title, ZoneId zone) {
        this.title = title;
        this.timestampFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm z", Locale.US).withZone(zone);
    }

    /**
     * @param previousTimestamp time of the previous stored snapshot, null if there was none
     */
    public String render(String address, List<PositionChange> changes, Instant previousTimestamp, Instant currentTimestamp) {
        StringBuilder sb = new StringBuilder();
        sb.append(title).append('\n');
        sb.append("Wallet: ").append(EvmAddresses.shortForm(address)).append('\n');
        sb.append("Since last change: ").append(elapsed(previousTimestamp, currentTimestamp)).append('\n');
        sb.append('\n');
        for (PositionChange c : changes) {
            sb.append(c.token()).append(": ")
                    .append(formatSize(c.previousSize())).append(" → ").append(formatSize(c.currentSize()))
                    .append(" (").append(formatPct(c.pctChange())).append(")\n");
            sb.append("  ").append(formatUsd(c.previousUsd())).append(" → ").append(formatUsd(c.currentUsd())).append('\n');
        }
        sb.append('\n');
        sb.append("Previous: ").append(previousTimestamp != null ? timestampFormat.format(previousTimestamp) : "-").append('\n');
        sb.append("Current: ").append(timestampFormat.format(currentTimestamp));
        return sb.toString();
    }

    static String elapsed(Instant previous, Instant current) {
        if (previous == null) {
            return FIRST_SNAPSHOT;
        }
        Duration d = Duration.between(previous, current);
        if (d.isNegative()) {
            d = Duration.ZERO;
        }
        long days = d.toDays();
        int hours = d.toHoursPart();
        int minutes = d.toMinutesPart();
        if (days > 0) {
            return days + "d " + hours + "h";
        }
        if (hours > 0) {
            return hours + "h " + minutes + "m";
        }
        return minutes + "m";
    }

    static String formatSize(BigDecimal size) {
        if (size == null || size.signum() == 0) {
            return "0";
        }
        return size.stripTrailingZeros().toPlainString();
    }

    static String formatPct(BigDecimal pct) {
        return String.format(Locale.US, "%+.1f%%", pct.setScale(1, RoundingMode.HALF_UP));
    }

    static String formatUsd(BigDecimal usd) {
        BigDecimal value = usd != null ? usd.abs().setScale(0, RoundingMode.HALF_UP) : BigDecimal.ZERO;
        return String.format(Locale.US, "$%,d", value.toBigInteger());
    }
}
