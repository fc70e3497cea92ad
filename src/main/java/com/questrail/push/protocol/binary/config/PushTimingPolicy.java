package com.questrail.push.protocol.binary.config;

import java.time.Duration;
import java.util.Objects;

/**
 * PushTimingPolicy
 * -----------------------------------------------------------------------------
 * Flush timing for a connection.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>idleFlushInterval</b>: Upper bound on how long a partially filled
 *       frame may sit in the buffer when no further submissions arrive. Armed
 *       after every timer-driven flush.</li>
 *   <li><b>coalesceWindow</b>: Re-armed after every submission. A burst of
 *       submissions closer together than this window is written as one frame.</li>
 * </ul>
 *
 * <p>Both are purely operational; neither changes what is written, only when.</p>
 */
public record PushTimingPolicy(
        Duration idleFlushInterval,
        Duration coalesceWindow
) {
    public PushTimingPolicy {
        Objects.requireNonNull(idleFlushInterval, "idleFlushInterval");
        Objects.requireNonNull(coalesceWindow, "coalesceWindow");

        if (idleFlushInterval.isNegative() || idleFlushInterval.isZero()) {
            throw new IllegalArgumentException("idleFlushInterval must be positive");
        }
        if (coalesceWindow.isNegative()) {
            throw new IllegalArgumentException("coalesceWindow must be non-negative");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>idleFlushInterval: 5 minutes</li>
     *   <li>coalesceWindow: 10ms</li>
     * </ul>
     */
    public static PushTimingPolicy defaults() {
        return new PushTimingPolicy(Duration.ofMinutes(5), Duration.ofMillis(10));
    }
}
