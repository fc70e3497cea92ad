package com.questrail.push.protocol.binary.observability;

import com.questrail.push.protocol.binary.model.ConnectionState;

import java.time.Instant;

/**
 * Record representing a lifecycle transition of a connection.
 *
 * @param connectionName name of the connection (thread-name suffix)
 */
public record PushStateTransitionEvent(
    Instant timestamp,
    String connectionName,
    ConnectionState oldState,
    ConnectionState newState
) {
}
