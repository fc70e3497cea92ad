package com.questrail.push.protocol.binary;

import com.questrail.push.api.Payload;
import com.questrail.push.api.TestPayload;
import com.questrail.push.protocol.binary.codec.DecodedItem;
import com.questrail.push.protocol.binary.codec.impl.DefaultPushFrameDecoder;
import com.questrail.push.protocol.binary.config.PushConnectionConfig;
import com.questrail.push.protocol.binary.model.CloseResult;
import com.questrail.push.protocol.binary.model.ConnectionState;
import com.questrail.push.protocol.binary.model.PushErrorCode;
import com.questrail.push.protocol.binary.observability.PushStateTransitionEvent;
import com.questrail.push.protocol.binary.observability.RecordingObservabilitySink;
import com.questrail.push.protocol.binary.time.DeterministicScheduler;
import com.questrail.push.protocol.binary.time.ManualMonotonicClock;
import com.questrail.push.protocol.binary.transport.FakePushTransport;
import com.questrail.push.protocol.binary.transport.stream.StreamPushTransport;
import org.junit.jupiter.api.Test;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PushConnectionTest
 * -----------------------------------------------------------------------------
 * End-to-end behavior through the public entry point.
 */
class PushConnectionTest {

    private static final long TIMEOUT_SECONDS = 5;

    @Test
    void openedConnectionWritesSubmissionsWithDefaultTimers() throws Exception {
        FakePushTransport transport = new FakePushTransport();
        PushConnection connection = PushConnection.open(transport, 10);
        try {
            Payload payload = TestPayload.of(TestPayload.TOKEN_A, "hello");
            assertEquals(1, connection.submit(payload));

            assertTrue(transport.awaitWrites(1, TIMEOUT_SECONDS, TimeUnit.SECONDS));
            DecodedItem item = new DefaultPushFrameDecoder().decode(transport.writes().get(0)).get(0);
            assertEquals(TestPayload.TOKEN_A, item.token());
            assertEquals(1, item.notificationId());
            assertEquals(10, connection.config().replayBufferCapacity());
        } finally {
            connection.disconnect();
        }

        CloseResult result = connection.closeNotification().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertEquals(PushErrorCode.SHUTDOWN, result.error().code());
        assertTrue(connection.awaitTermination(Duration.ofSeconds(TIMEOUT_SECONDS)));
        assertEquals(ConnectionState.CLOSED, connection.state());
    }

    @Test
    void peerRejectionIdentifiesFailedAndUnsentPayloads() throws Exception {
        FakePushTransport transport = new FakePushTransport();
        ManualMonotonicClock clock = new ManualMonotonicClock();
        DeterministicScheduler scheduler = new DeterministicScheduler(clock);
        PushConnection connection = PushConnection.builder(transport)
                .withScheduler(scheduler, clock)
                .build();

        Payload t1 = TestPayload.of(TestPayload.token(1), "one");
        Payload t2 = TestPayload.of(TestPayload.token(2), "two");
        Payload t3 = TestPayload.of(TestPayload.token(3), "three");
        connection.submit(t1);
        connection.submit(t2);
        connection.submit(t3);
        clock.advanceMillis(10);
        scheduler.runDueTasks();
        assertTrue(transport.awaitWrites(1, TIMEOUT_SECONDS, TimeUnit.SECONDS));

        transport.injectResponse(new byte[] { 8, 8, 0, 0, 0, 2 });
        CloseResult result = connection.closeNotification().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        assertEquals(PushErrorCode.INVALID_TOKEN, result.error().code());
        assertSame(t2, result.errorPayload().orElseThrow());
        assertEquals(List.of(t3), result.unsentPayloads());
        assertFalse(result.unsentPayloadBufferOverflow());
        connection.disconnect();
    }

    @Test
    void lostTransportReportsEverythingRetained() throws Exception {
        FakePushTransport transport = new FakePushTransport();
        PushConnection connection = PushConnection.open(transport, 10);

        Payload t1 = TestPayload.of(TestPayload.token(1), "one");
        Payload t2 = TestPayload.of(TestPayload.token(2), "two");
        connection.submit(t1);
        connection.submit(t2);
        transport.injectReadFailure(new IOException("connection reset by peer"));

        CloseResult result = connection.closeNotification().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        assertEquals(PushErrorCode.SHUTDOWN, result.error().code());
        assertTrue(result.errorPayload().isEmpty());
        assertEquals(List.of(t1, t2), result.unsentPayloads());
        assertFalse(result.unsentPayloadBufferOverflow());
        assertTrue(connection.awaitTermination(Duration.ofSeconds(TIMEOUT_SECONDS)));
    }

    @Test
    void closedConnectionRejectsSubmissions() throws Exception {
        FakePushTransport transport = new FakePushTransport();
        PushConnection connection = PushConnection.open(transport, 10);

        connection.disconnect();
        connection.closeNotification().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        assertThrows(PushConnectionClosedException.class,
                () -> connection.submit(TestPayload.of(TestPayload.TOKEN_A, "late")));
    }

    @Test
    void builderNameAppearsInObservabilityEvents() throws Exception {
        FakePushTransport transport = new FakePushTransport();
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        PushConnection connection = PushConnection.builder(transport)
                .withName("gateway-1")
                .withObservabilitySink(sink)
                .withConfig(PushConnectionConfig.builder().withReplayBufferCapacity(4).build())
                .build();

        assertEquals("gateway-1", connection.name());
        connection.disconnect();
        connection.closeNotification().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertTrue(connection.awaitTermination(Duration.ofSeconds(TIMEOUT_SECONDS)));

        List<PushStateTransitionEvent> transitions = sink.getStateTransitions();
        assertFalse(transitions.isEmpty());
        transitions.forEach(t -> assertEquals("gateway-1", t.connectionName()));
    }

    @Test
    void socketPeerRejectionRoundTrip() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            CompletableFuture<byte[]> received = CompletableFuture.supplyAsync(() -> {
                try (Socket peer = server.accept()) {
                    DataInputStream in = new DataInputStream(peer.getInputStream());
                    byte[] header = new byte[5];
                    in.readFully(header);
                    int length = ByteBuffer.wrap(header, 1, 4).getInt();
                    byte[] frame = new byte[5 + length];
                    System.arraycopy(header, 0, frame, 0, 5);
                    in.readFully(frame, 5, length);

                    OutputStream out = peer.getOutputStream();
                    out.write(new byte[] { 8, 8, 0, 0, 0, 1 });
                    out.flush();
                    return frame;
                } catch (IOException e) {
                    throw new IllegalStateException(e);
                }
            });

            Socket client = new Socket(server.getInetAddress(), server.getLocalPort());
            PushConnection connection = PushConnection.open(StreamPushTransport.of(client), 100);

            Payload rejected = TestPayload.of(TestPayload.TOKEN_A, "{\"aps\":{}}");
            connection.submit(rejected);

            byte[] frame = received.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            assertEquals(1, new DefaultPushFrameDecoder().decode(frame).size());

            CloseResult result = connection.closeNotification().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            assertEquals(PushErrorCode.INVALID_TOKEN, result.error().code());
            assertSame(rejected, result.errorPayload().orElseThrow());
            assertTrue(result.unsentPayloads().isEmpty());

            connection.disconnect();
            assertTrue(connection.awaitTermination(Duration.ofSeconds(TIMEOUT_SECONDS)));
            assertTrue(client.isClosed());
        }
    }
}
