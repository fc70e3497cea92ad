package com.questrail.push.protocol.binary.model;

/**
 * Lifecycle of a push connection.
 *
 * <pre>
 *   ACTIVE  → CLOSING → CLOSED
 * </pre>
 *
 * A connection is ACTIVE once its worker threads are running. The first
 * terminal {@link PushErrorEvent} moves it to CLOSING, and once the
 * {@link CloseResult} is built it moves to CLOSED, before the result is
 * delivered. There are no other transitions.
 */
public enum ConnectionState
{
    ACTIVE,
    CLOSING,
    CLOSED
}
