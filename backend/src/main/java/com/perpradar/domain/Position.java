package com.perpradar.domain;

import java.math.BigDecimal;

/**
 * One open perp position: signed size (negative = short) and notional USD value.
 */
public record Position(BigDecimal size, BigDecimal notionalUsd) {

    public static final Position FLAT = new Position(BigDecimal.ZERO, BigDecimal.ZERO);

    public Position {
        size = size != null ? size : BigDecimal.ZERO;
        notionalUsd = notionalUsd != null ? notionalUsd : BigDecimal.ZERO;
    }
}
