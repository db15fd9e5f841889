package com.perpradar.detection;

import com.perpradar.domain.Position;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Dual-threshold diff of two position maps: a token is reported when its size changed by more than
 * the percentage threshold AND at least one side is at or above the notional USD floor.
 * Pure: no I/O, no state.
 */
@Component
@RequiredArgsConstructor
public class ChangeDetector {

    static final BigDecimal HUNDRED = new BigDecimal("100");

    private final DetectionProperties properties;

    /** Diff with the configured thresholds. */
    public List<PositionChange> detect(Map<String, Position> previous, Map<String, Position> current) {
        return detect(previous, current,
                properties.getThresholdPct(), properties.isCompareAbsolute(), properties.getMinNotionalUsd());
    }

    /**
     * @return changes ordered by token
     */
    public static List<PositionChange> detect(Map<String, Position> previous,
                                              Map<String, Position> current,
                                              BigDecimal thresholdPct,
                                              boolean compareAbsolute,
                                              BigDecimal minNotionalUsd) {
        Map<String, Position> prev = previous != null ? previous : Map.of();
        Map<String, Position> curr = current != null ? current : Map.of();
        TreeSet<String> tokens = new TreeSet<>(prev.keySet());
        tokens.addAll(curr.keySet());

        List<PositionChange> changes = new ArrayList<>();
        for (String token : tokens) {
            Position before = prev.getOrDefault(token, Position.FLAT);
            Position after = curr.getOrDefault(token, Position.FLAT);

            if (before.size().compareTo(after.size()) == 0) {
                continue;
            }
            // Small on both sides: ignored. A large position shrinking below the floor, or a new one
            // growing above it, still passes.
            if (before.notionalUsd().abs().compareTo(minNotionalUsd) < 0
                    && after.notionalUsd().abs().compareTo(minNotionalUsd) < 0) {
                continue;
            }

            BigDecimal prevValue = compareAbsolute ? before.size().abs() : before.size();
            BigDecimal currValue = compareAbsolute ? after.size().abs() : after.size();

            BigDecimal pct;
            if (prevValue.signum() == 0) {
                if (currValue.signum() == 0) {
                    continue;
                }
                pct = HUNDRED;
            } else {
                pct = currValue.subtract(prevValue)
                        .divide(prevValue, MathContext.DECIMAL64)
                        .multiply(HUNDRED);
            }

            if (pct.abs().compareTo(thresholdPct) > 0) {
                changes.add(new PositionChange(token, before.size(), after.size(),
                        before.notionalUsd(), after.notionalUsd(), pct));
            }
        }
        return changes;
    }
}
