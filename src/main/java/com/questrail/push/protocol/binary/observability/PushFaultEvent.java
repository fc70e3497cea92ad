package com.questrail.push.protocol.binary.observability;

import java.time.Instant;

/**
 * Record representing a fault detected inside the connection.
 */
public record PushFaultEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
