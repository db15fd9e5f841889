package com.perpradar.detection;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Change detection thresholds. Documented in application.yml under perpradar.detection.
 */
@ConfigurationProperties(prefix = "perpradar.detection")
@NoArgsConstructor
@Getter
@Setter
public class DetectionProperties {

    /** Alert when |size change| exceeds this percentage. */
    private BigDecimal thresholdPct = new BigDecimal("5.0");

    /** Compare |size| so a flip from long to short of equal size is not a change in magnitude. */
    private boolean compareAbsolute = true;

    /** Ignore a token when both previous and current notional USD are below this floor. */
    private BigDecimal minNotionalUsd = new BigDecimal("10000");
}
