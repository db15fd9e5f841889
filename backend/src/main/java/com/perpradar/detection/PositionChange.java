package com.perpradar.detection;

import java.math.BigDecimal;

/**
 * One token whose size moved past the threshold. pctChange is computed from sizes, not USD values.
 */
public record PositionChange(
        String token,
        BigDecimal previousSize,
        BigDecimal currentSize,
        BigDecimal previousUsd,
        BigDecimal currentUsd,
        BigDecimal pctChange
) {
}
