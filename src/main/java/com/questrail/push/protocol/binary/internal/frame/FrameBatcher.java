package com.questrail.push.protocol.binary.internal.frame;

import com.questrail.push.protocol.binary.codec.PushEncodeException;
import com.questrail.push.protocol.binary.codec.PushWireFormat;
import com.questrail.push.protocol.binary.internal.time.WallClock;
import com.questrail.push.protocol.binary.model.PushErrorCode;
import com.questrail.push.protocol.binary.observability.FrameFlushedEvent;
import com.questrail.push.protocol.binary.observability.PushFaultEvent;
import com.questrail.push.protocol.binary.observability.PushObservabilitySink;
import com.questrail.push.protocol.binary.transport.PushTransport;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FrameBatcher
 * =============================================================================
 * Owns the single in-progress outbound frame of a connection and is the only
 * component that writes to the transport.
 *
 * <h2>Frame assembly</h2>
 * <ul>
 *   <li>When the buffer is empty, a frame header is written and the local item
 *       id counter is reset, so the first item of every frame has local id 0.</li>
 *   <li>Each further item in the same frame gets the next local id (one byte,
 *       wrapping).</li>
 *   <li>If appending an item would push the frame past {@code maxFrameSize},
 *       the current frame is flushed first and the item starts a new one.</li>
 * </ul>
 *
 * <h2>Flushing</h2>
 * A flush patches the frame length, writes the frame in a single transport
 * write, and empties the buffer. A buffer holding no items is left alone. When
 * the write fails the transport is closed at once and the frame is discarded;
 * there is no retry. Closing the transport makes the error listener's pending
 * read fail, which is how a write failure becomes the connection's terminal
 * event.
 *
 * <h2>Thread Safety</h2>
 * All buffer state is guarded by one {@link ReentrantLock}. {@link #append(byte[])}
 * and {@link #flush()} take the lock themselves. {@link #flushHeld()} is for
 * callers already holding it and refuses to run otherwise.
 */
public final class FrameBatcher
{
    private static final int INITIAL_CAPACITY = 4096;

    private final PushTransport transport;
    private final int maxFrameSize;
    private final PushObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock.
    private final ByteBuf buffer;
    private int localId;
    private int itemCount;
    private boolean released;

    public FrameBatcher(PushTransport transport,
                        int maxFrameSize,
                        PushObservabilitySink observabilitySink,
                        WallClock wallClock)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        if (maxFrameSize <= PushWireFormat.FRAME_HEADER_LENGTH + PushWireFormat.ITEM_PREFIX_LENGTH) {
            throw new IllegalArgumentException("maxFrameSize too small: " + maxFrameSize);
        }
        this.maxFrameSize = maxFrameSize;
        this.buffer = Unpooled.buffer(Math.min(INITIAL_CAPACITY, maxFrameSize), maxFrameSize);
    }

    /**
     * Append one encoded item, flushing the current frame first if the item
     * would not fit.
     *
     * @param item bytes produced by the item encoder; its first byte is
     *             overwritten with the local id
     * @return the local id assigned to the item
     * @throws PushEncodeException if the item could not fit even into an empty frame
     */
    public int append(byte[] item)
    {
        Objects.requireNonNull(item, "item");
        if (item.length < PushWireFormat.ITEM_PREFIX_LENGTH) {
            throw new IllegalArgumentException("Item shorter than its prefix: " + item.length);
        }
        if (PushWireFormat.FRAME_HEADER_LENGTH + item.length > maxFrameSize) {
            throw new PushEncodeException(PushErrorCode.INVALID_PAYLOAD_SIZE,
                    "Item of " + item.length + " bytes cannot fit in a frame of " + maxFrameSize);
        }

        lock.lock();
        try {
            if (released) {
                throw new IllegalStateException("Frame batcher has been released");
            }

            if (buffer.isReadable() && buffer.readableBytes() + item.length > maxFrameSize) {
                flushHeld();
            }

            if (!buffer.isReadable()) {
                buffer.writeByte(PushWireFormat.FRAME_TYPE);
                buffer.writeInt(0); // patched on flush
                localId = 0;
            } else {
                localId = (localId + 1) & 0xFF;
            }

            int start = buffer.writerIndex();
            buffer.writeBytes(item);
            buffer.setByte(start, localId);
            itemCount++;
            return localId;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Acquire the frame lock and flush.
     *
     * @return {@code true} if a frame was written successfully
     */
    public boolean flush()
    {
        lock.lock();
        try {
            return flushHeld();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Flush while the caller already holds the frame lock.
     *
     * @return {@code true} if a frame was written successfully
     * @throws IllegalMonitorStateException if the current thread does not hold the lock
     */
    boolean flushHeld()
    {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalMonitorStateException("flushHeld() requires the frame lock");
        }
        if (released || buffer.readableBytes() <= PushWireFormat.FRAME_HEADER_LENGTH) {
            return false;
        }

        buffer.setInt(PushWireFormat.FRAME_LENGTH_OFFSET,
                buffer.readableBytes() - PushWireFormat.FRAME_HEADER_LENGTH);
        byte[] frame = ByteBufUtil.getBytes(buffer);
        int items = itemCount;

        buffer.clear();
        itemCount = 0;

        try {
            transport.write(frame);
        } catch (IOException e) {
            observabilitySink.onFault(new PushFaultEvent(wallClock.now(),
                    "Frame write failed, closing transport (" + items + " items discarded)", e));
            transport.close();
            return false;
        }

        observabilitySink.onFrameFlushed(new FrameFlushedEvent(wallClock.now(), frame.length, items));
        return true;
    }

    /**
     * Number of bytes currently buffered, header included.
     */
    public int bufferedBytes()
    {
        lock.lock();
        try {
            return released ? 0 : buffer.readableBytes();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of items in the current, unflushed frame.
     */
    public int bufferedItems()
    {
        lock.lock();
        try {
            return itemCount;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discard any unflushed bytes and release the buffer. Later flushes are
     * no-ops and later appends fail.
     */
    public void release()
    {
        lock.lock();
        try {
            if (!released) {
                released = true;
                itemCount = 0;
                buffer.release();
            }
        } finally {
            lock.unlock();
        }
    }
}
