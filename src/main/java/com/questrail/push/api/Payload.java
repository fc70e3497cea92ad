package com.questrail.push.api;

/**
 * Payload
 * -----------------------------------------------------------------------------
 * A single push notification as seen by the connection layer.
 *
 * <p>The connection never interprets notification content. It only needs the
 * addressing and delivery attributes below, plus an opaque byte rendering of
 * the notification body that is produced on demand by {@link #marshal(int)}.</p>
 *
 * <p>Implementations are owned by the caller. The same instance is handed back
 * in a {@code CloseResult} when the connection reports it as unsent or failed,
 * so callers can resubmit it unchanged on a new connection.</p>
 */
public interface Payload
{
    /**
     * Device token as a hexadecimal string (64 hex characters for a 32-byte token).
     */
    String token();

    /**
     * Delivery priority. The wire protocol only accepts 5 and 10; any other
     * value is sent as 5.
     */
    int priority();

    /**
     * Expiration as seconds since the epoch; 0 means "do not store".
     */
    long expiration();

    /**
     * Render the notification body.
     *
     * @param maxBytes upper bound on the size of the returned array
     * @return the marshaled body, never longer than {@code maxBytes}
     * @throws PayloadMarshalException if the body cannot be produced or would
     *                                 exceed {@code maxBytes}
     */
    byte[] marshal(int maxBytes) throws PayloadMarshalException;
}
