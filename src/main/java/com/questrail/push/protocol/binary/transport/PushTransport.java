package com.questrail.push.protocol.binary.transport;

import java.io.IOException;

/**
 * PushTransport
 * -----------------------------------------------------------------------------
 * Minimal port for an already-connected, already-secured duplex byte stream.
 *
 * <p>A connection uses the two directions from different threads:</p>
 * <ul>
 *   <li>{@link #write(byte[])} is called only from the batcher's flush path,
 *       which is serialized by the batcher's lock.</li>
 *   <li>{@link #readFully(byte[])} is called only from the error listener
 *       thread, once.</li>
 * </ul>
 *
 * <p>{@link #close()} may be called from any thread and must unblock a pending
 * {@link #readFully(byte[])} with an {@link IOException}.</p>
 */
public interface PushTransport
{
    /**
     * Block until {@code buffer} is completely filled.
     *
     * @throws IOException on end of stream, I/O failure, or if the transport
     *                     was closed
     */
    void readFully(byte[] buffer) throws IOException;

    /**
     * Write all of {@code bytes} and flush them to the peer.
     */
    void write(byte[] bytes) throws IOException;

    /**
     * Close both directions. Idempotent; never throws.
     */
    void close();
}
