package com.perpradar.monitor;

import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;

import java.time.Clock;
import java.time.Instant;
import java.util.function.LongUnaryOperator;

/**
 * Fixed delay plus random jitter, measured from the completion of the previous run. Two runs never overlap.
 */
public class JitteredDelayTrigger implements Trigger {

    private final long initialDelayMs;
    private final long intervalMs;
    private final long maxJitterMs;
    /** Maps a bound to a value in [0, bound]. */
    private final LongUnaryOperator jitter;
    private final Clock clock;

    public JitteredDelayTrigger(long initialDelayMs, long intervalMs, long maxJitterMs,
                                LongUnaryOperator jitter, Clock clock) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive");
        }
        this.initialDelayMs = Math.max(0L, initialDelayMs);
        this.intervalMs = intervalMs;
        this.maxJitterMs = Math.max(0L, maxJitterMs);
        this.jitter = jitter;
        this.clock = clock;
    }

    @Override
    public Instant nextExecution(TriggerContext triggerContext) {
        Instant lastCompletion = triggerContext.lastCompletion();
        if (lastCompletion == null) {
            return Instant.now(clock).plusMillis(initialDelayMs);
        }
        long extra = Math.min(maxJitterMs, Math.max(0L, jitter.applyAsLong(maxJitterMs)));
        return lastCompletion.plusMillis(intervalMs + extra);
    }
}
