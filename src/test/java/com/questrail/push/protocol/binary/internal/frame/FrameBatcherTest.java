package com.questrail.push.protocol.binary.internal.frame;

import com.questrail.push.api.TestPayload;
import com.questrail.push.protocol.binary.codec.DecodedItem;
import com.questrail.push.protocol.binary.codec.PushEncodeException;
import com.questrail.push.protocol.binary.codec.impl.DefaultPushFrameDecoder;
import com.questrail.push.protocol.binary.codec.impl.DefaultPushItemEncoder;
import com.questrail.push.protocol.binary.internal.time.SystemWallClock;
import com.questrail.push.protocol.binary.model.IdentifiedPayload;
import com.questrail.push.protocol.binary.model.PushErrorCode;
import com.questrail.push.protocol.binary.observability.FrameFlushedEvent;
import com.questrail.push.protocol.binary.observability.PushFaultEvent;
import com.questrail.push.protocol.binary.observability.RecordingObservabilitySink;
import com.questrail.push.protocol.binary.transport.FakePushTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FrameBatcherTest
 * -----------------------------------------------------------------------------
 * Frame assembly, local id assignment and flush behavior.
 */
class FrameBatcherTest {

    private static final int ONE_BYTE_ITEM = 3 + 32 + 1 + 9;

    private final DefaultPushItemEncoder encoder = new DefaultPushItemEncoder();
    private final DefaultPushFrameDecoder decoder = new DefaultPushFrameDecoder();

    private FakePushTransport transport;
    private RecordingObservabilitySink sink;

    @BeforeEach
    void setUp() {
        transport = new FakePushTransport();
        sink = new RecordingObservabilitySink();
    }

    @Test
    void flushWritesOneFrameWithPatchedLength() {
        FrameBatcher batcher = batcher(65535);
        batcher.append(item(1));
        batcher.append(item(2));

        assertTrue(batcher.flush());

        List<byte[]> writes = transport.writes();
        assertEquals(1, writes.size());
        byte[] frame = writes.get(0);
        assertEquals(2, frame[0]);
        assertEquals(frame.length - 5, ByteBuffer.wrap(frame, 1, 4).getInt());
        assertEquals(5 + 2 * ONE_BYTE_ITEM, frame.length);
    }

    @Test
    void itemsInAFrameGetConsecutiveLocalIdsFromZero() {
        FrameBatcher batcher = batcher(65535);

        assertEquals(0, batcher.append(item(1)));
        assertEquals(1, batcher.append(item(2)));
        assertEquals(2, batcher.append(item(3)));
        batcher.flush();

        List<DecodedItem> items = decoder.decode(transport.writes().get(0));
        assertEquals(3, items.size());
        for (int i = 0; i < 3; i++) {
            assertEquals(i, items.get(i).localId());
            assertEquals(i + 1, items.get(i).notificationId());
        }
    }

    @Test
    void localIdRestartsAfterFlush() {
        FrameBatcher batcher = batcher(65535);
        batcher.append(item(1));
        batcher.append(item(2));
        batcher.flush();

        assertEquals(0, batcher.append(item(3)));
    }

    @Test
    void localIdWrapsAsOneByte() {
        FrameBatcher batcher = batcher(65535);

        int last = -1;
        for (int i = 1; i <= 257; i++) {
            last = batcher.append(item(i));
        }

        assertEquals(0, last);
        assertEquals(257, batcher.bufferedItems());
    }

    @Test
    void itemThatWouldOverflowFrameFlushesCurrentFrameFirst() {
        FrameBatcher batcher = batcher(5 + 2 * ONE_BYTE_ITEM);
        batcher.append(item(1));
        batcher.append(item(2));
        assertTrue(transport.writes().isEmpty());

        int localId = batcher.append(item(3));

        assertEquals(0, localId);
        assertEquals(1, transport.writes().size());
        assertEquals(2, decoder.decode(transport.writes().get(0)).size());
        assertEquals(1, batcher.bufferedItems());
        assertEquals(5 + ONE_BYTE_ITEM, batcher.bufferedBytes());
    }

    @Test
    void exactFitDoesNotFlush() {
        FrameBatcher batcher = batcher(5 + 2 * ONE_BYTE_ITEM);
        batcher.append(item(1));
        batcher.append(item(2));

        assertEquals(5 + 2 * ONE_BYTE_ITEM, batcher.bufferedBytes());
        assertTrue(transport.writes().isEmpty());
    }

    @Test
    void itemLargerThanAnyFrameIsRejected() {
        FrameBatcher batcher = batcher(5 + ONE_BYTE_ITEM - 1);

        PushEncodeException e = assertThrows(PushEncodeException.class, () -> batcher.append(item(1)));

        assertEquals(PushErrorCode.INVALID_PAYLOAD_SIZE, e.reason());
        assertEquals(0, batcher.bufferedBytes());
    }

    @Test
    void flushOfEmptyBufferIsNoop() {
        FrameBatcher batcher = batcher(65535);

        assertFalse(batcher.flush());
        assertTrue(transport.writes().isEmpty());
        assertFalse(sink.hasEventOfType(FrameFlushedEvent.class));
    }

    @Test
    void flushReportsFrameToSink() {
        FrameBatcher batcher = batcher(65535);
        batcher.append(item(1));
        batcher.append(item(2));
        batcher.flush();

        List<FrameFlushedEvent> flushed = sink.eventsOfType(FrameFlushedEvent.class);
        assertEquals(1, flushed.size());
        assertEquals(2, flushed.get(0).itemCount());
        assertEquals(5 + 2 * ONE_BYTE_ITEM, flushed.get(0).frameBytes());
    }

    @Test
    void writeFailureClosesTransportAndDiscardsFrame() {
        FrameBatcher batcher = batcher(65535);
        batcher.append(item(1));
        transport.failWritesWith(new IOException("broken pipe"));

        assertFalse(batcher.flush());

        assertTrue(transport.isClosed());
        assertEquals(0, batcher.bufferedBytes());
        assertEquals(0, batcher.bufferedItems());
        assertTrue(sink.hasEventOfType(PushFaultEvent.class));
    }

    @Test
    void flushHeldRequiresTheLock() {
        FrameBatcher batcher = batcher(65535);

        assertThrows(IllegalMonitorStateException.class, batcher::flushHeld);
    }

    @Test
    void releasedBatcherRefusesAppendsAndIgnoresFlush() {
        FrameBatcher batcher = batcher(65535);
        batcher.append(item(1));

        batcher.release();
        batcher.release();

        assertFalse(batcher.flush());
        assertThrows(IllegalStateException.class, () -> batcher.append(item(2)));
        assertTrue(transport.writes().isEmpty());
    }

    private FrameBatcher batcher(int maxFrameSize) {
        return new FrameBatcher(transport, maxFrameSize, sink, SystemWallClock.INSTANCE);
    }

    private byte[] item(int id) {
        return encoder.encode(new IdentifiedPayload(TestPayload.of(TestPayload.token(id), "x"), id));
    }
}
