package com.questrail.push.protocol.binary.transport;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * FakePushTransport
 * -----------------------------------------------------------------------------
 * Test-only {@link PushTransport} implementation.
 *
 * <p>It contains no protocol semantics; it only stores outbound writes and lets
 * tests inject what the single inbound read returns: an error response, a read
 * failure, or (through {@link #close()}) a local close.</p>
 */
public final class FakePushTransport implements PushTransport {

    private static final Object CLOSED = new Object();

    private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
    private final List<byte[]> writes = new ArrayList<>();
    private volatile boolean closed;
    private volatile IOException writeFailure;
    private int closeCount;

    @Override
    public void readFully(byte[] buffer) throws IOException {
        if (closed) {
            throw new IOException("Transport closed");
        }
        Object next;
        try {
            next = inbound.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while reading", e);
        }
        if (next == CLOSED) {
            throw new IOException("Transport closed");
        }
        if (next instanceof IOException) {
            throw (IOException) next;
        }
        byte[] bytes = (byte[]) next;
        if (bytes.length < buffer.length) {
            throw new IOException("End of stream after " + bytes.length + " bytes");
        }
        System.arraycopy(bytes, 0, buffer, 0, buffer.length);
    }

    @Override
    public void write(byte[] bytes) throws IOException {
        Objects.requireNonNull(bytes, "bytes");
        IOException failure = writeFailure;
        if (failure != null) {
            throw failure;
        }
        if (closed) {
            throw new IOException("Transport closed");
        }
        synchronized (writes) {
            writes.add(bytes.clone());
            writes.notifyAll();
        }
    }

    @Override
    public synchronized void close() {
        closeCount++;
        if (!closed) {
            closed = true;
            inbound.add(CLOSED);
        }
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void injectResponse(byte[] response) {
        inbound.add(response.clone());
    }

    public void injectReadFailure(IOException failure) {
        inbound.add(failure);
    }

    public void failWritesWith(IOException failure) {
        this.writeFailure = failure;
    }

    public List<byte[]> writes() {
        synchronized (writes) {
            return new ArrayList<>(writes);
        }
    }

    /**
     * Block until at least {@code count} writes happened or the timeout passes.
     */
    public boolean awaitWrites(int count, long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        synchronized (writes) {
            while (writes.size() < count) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(writes, remaining);
            }
            return true;
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public synchronized int closeCount() {
        return closeCount;
    }
}
