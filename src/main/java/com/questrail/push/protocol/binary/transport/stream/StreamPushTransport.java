package com.questrail.push.protocol.binary.transport.stream;

import com.questrail.push.protocol.binary.transport.PushTransport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * StreamPushTransport
 * =============================================================================
 * {@link PushTransport} over a blocking input/output stream pair.
 *
 * <h2>Usage</h2>
 * <pre>
 *   SSLSocket socket = ...;            // connected and handshaken by the caller
 *   PushTransport transport = StreamPushTransport.of(socket);
 * </pre>
 *
 * <p>Closing releases the streams and the optional underlying resource (the
 * socket), which makes a blocked {@link #readFully(byte[])} fail.</p>
 */
public final class StreamPushTransport implements PushTransport
{
    private static final Logger log = LoggerFactory.getLogger(StreamPushTransport.class);

    private final DataInputStream in;
    private final OutputStream out;
    private final Closeable resource;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param in       inbound direction
     * @param out      outbound direction
     * @param resource closed after both streams; may be {@code null}
     */
    public StreamPushTransport(InputStream in, OutputStream out, Closeable resource)
    {
        this.in = new DataInputStream(Objects.requireNonNull(in, "in"));
        this.out = Objects.requireNonNull(out, "out");
        this.resource = resource;
    }

    /**
     * Adapt a connected socket.
     */
    public static StreamPushTransport of(Socket socket) throws IOException
    {
        Objects.requireNonNull(socket, "socket");
        if (!socket.isConnected()) {
            throw new IOException("Socket is not connected");
        }
        return new StreamPushTransport(socket.getInputStream(), socket.getOutputStream(), socket);
    }

    @Override
    public void readFully(byte[] buffer) throws IOException
    {
        if (closed.get()) {
            throw new IOException("Transport closed");
        }
        in.readFully(buffer);
    }

    @Override
    public void write(byte[] bytes) throws IOException
    {
        if (closed.get()) {
            throw new IOException("Transport closed");
        }
        out.write(bytes);
        out.flush();
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        closeQuietly(out, "output stream");
        closeQuietly(in, "input stream");
        if (resource != null) {
            closeQuietly(resource, "transport resource");
        }
    }

    public boolean isClosed()
    {
        return closed.get();
    }

    private static void closeQuietly(Closeable closeable, String what)
    {
        try {
            closeable.close();
        } catch (IOException e) {
            log.debug("Ignoring failure closing {}: {}", what, e.getMessage());
        }
    }
}
