package com.questrail.push.protocol.binary;

/**
 * Thrown when a submission reaches a connection that is closing or closed.
 *
 * <p>A payload rejected with this exception was never assigned an id and will
 * not appear in the connection's {@code CloseResult}; the caller still owns it.</p>
 */
public class PushConnectionClosedException extends IllegalStateException
{
    public PushConnectionClosedException(String message) {
        super(message);
    }

    public PushConnectionClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
