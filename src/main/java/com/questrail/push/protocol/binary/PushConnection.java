package com.questrail.push.protocol.binary;

import com.questrail.push.api.Payload;
import com.questrail.push.protocol.binary.codec.ErrorResponseDecoder;
import com.questrail.push.protocol.binary.codec.PushItemEncoder;
import com.questrail.push.protocol.binary.codec.impl.DefaultErrorResponseDecoder;
import com.questrail.push.protocol.binary.codec.impl.DefaultPushItemEncoder;
import com.questrail.push.protocol.binary.config.PushConnectionConfig;
import com.questrail.push.protocol.binary.internal.exec.PushConnectionDriver;
import com.questrail.push.protocol.binary.internal.frame.FrameBatcher;
import com.questrail.push.protocol.binary.internal.replay.ReplayTracker;
import com.questrail.push.protocol.binary.internal.time.MonotonicClock;
import com.questrail.push.protocol.binary.internal.time.MonotonicScheduler;
import com.questrail.push.protocol.binary.internal.time.ScheduledExecutorScheduler;
import com.questrail.push.protocol.binary.internal.time.SystemMonotonicClock;
import com.questrail.push.protocol.binary.internal.time.SystemWallClock;
import com.questrail.push.protocol.binary.internal.time.WallClock;
import com.questrail.push.protocol.binary.model.CloseResult;
import com.questrail.push.protocol.binary.model.ConnectionState;
import com.questrail.push.protocol.binary.observability.NullObservabilitySink;
import com.questrail.push.protocol.binary.observability.PushObservabilitySink;
import com.questrail.push.protocol.binary.transport.PushTransport;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * PushConnection
 * =============================================================================
 * Client side of one legacy binary push connection.
 *
 * <h2>Usage</h2>
 * <pre>
 *   PushConnection connection = PushConnection.open(transport, 10_000);
 *   connection.submit(payload);                      // blocks until accepted
 *   ...
 *   CloseResult result = connection.closeNotification().join();
 *   // resubmit result.unsentPayloads() on a new connection
 * </pre>
 *
 * <h2>What this class is</h2>
 * <ul>
 *   <li>The composition root for encoder, batcher, replay tracker, error
 *       listener and driver</li>
 *   <li>The only public entry point for submitting notifications</li>
 * </ul>
 *
 * <h2>What this class is <em>not</em></h2>
 * <ul>
 *   <li>It does not open sockets or perform TLS handshakes</li>
 *   <li>It does not reconnect or resubmit; {@link CloseResult} tells the caller
 *       what to resubmit</li>
 * </ul>
 *
 * <h2>Close notification</h2>
 * {@link #closeNotification()} completes exactly once, with the report built
 * from the first terminal event. An explicit {@link #disconnect()} does not
 * short-circuit this: it closes the transport, the pending read fails, and the
 * report arrives with a SHUTDOWN event like any other transport loss.
 */
public final class PushConnection
{
    private static final AtomicInteger CONNECTION_SEQUENCE = new AtomicInteger();

    private final PushConnectionDriver driver;
    private final PushConnectionConfig config;

    private PushConnection(PushConnectionDriver driver, PushConnectionConfig config)
    {
        this.driver = driver;
        this.config = config;
    }

    /**
     * Start a connection over {@code transport} with default settings and the
     * given history capacity.
     */
    public static PushConnection open(PushTransport transport, int replayBufferCapacity)
    {
        return builder(transport)
                .withConfig(PushConnectionConfig.builder()
                        .withReplayBufferCapacity(replayBufferCapacity)
                        .build())
                .build();
    }

    public static Builder builder(PushTransport transport)
    {
        return new Builder(transport);
    }

    /**
     * Submit a notification. Blocks until the connection has taken it and
     * assigned its id.
     *
     * @return the notification id assigned to {@code payload}
     * @throws PushConnectionClosedException if the connection is closing or closed
     * @throws InterruptedException          if interrupted while waiting
     */
    public int submit(Payload payload) throws InterruptedException
    {
        Objects.requireNonNull(payload, "payload");
        return driver.submit(payload);
    }

    /**
     * Completes once, with the terminal report.
     */
    public CompletableFuture<CloseResult> closeNotification()
    {
        return driver.closeNotification();
    }

    /**
     * Flush buffered notifications and close the transport. Idempotent.
     */
    public void disconnect()
    {
        driver.disconnect();
    }

    public ConnectionState state()
    {
        return driver.state();
    }

    public String name()
    {
        return driver.name();
    }

    public PushConnectionConfig config()
    {
        return config;
    }

    /**
     * Wait for the connection's worker threads to exit.
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException
    {
        return driver.awaitTermination(timeout);
    }

    public static final class Builder
    {
        private final PushTransport transport;
        private PushConnectionConfig config = PushConnectionConfig.defaults();
        private PushObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private PushItemEncoder encoder;
        private ErrorResponseDecoder responseDecoder = new DefaultErrorResponseDecoder();
        private String name;

        private Builder(PushTransport transport)
        {
            this.transport = Objects.requireNonNull(transport, "transport");
        }

        public Builder withConfig(PushConnectionConfig config)
        {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder withObservabilitySink(PushObservabilitySink sink)
        {
            this.observabilitySink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        /**
         * Use an external scheduler and clock for flush timers. The caller keeps
         * ownership of any executor behind the scheduler.
         */
        public Builder withScheduler(MonotonicScheduler scheduler, MonotonicClock clock)
        {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder withWallClock(WallClock wallClock)
        {
            this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
            return this;
        }

        public Builder withEncoder(PushItemEncoder encoder)
        {
            this.encoder = Objects.requireNonNull(encoder, "encoder");
            return this;
        }

        public Builder withResponseDecoder(ErrorResponseDecoder decoder)
        {
            this.responseDecoder = Objects.requireNonNull(decoder, "decoder");
            return this;
        }

        /**
         * Name used in worker thread names and observability events.
         */
        public Builder withName(String name)
        {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        /**
         * Assemble and start the connection.
         */
        public PushConnection build()
        {
            String connectionName = name != null
                    ? name
                    : Integer.toString(CONNECTION_SEQUENCE.incrementAndGet());

            // 1. Timers: borrow the caller's scheduler, or own a single-thread one
            MonotonicScheduler effectiveScheduler = scheduler;
            Runnable closedHook = () -> {};
            if (effectiveScheduler == null) {
                ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "push-flush-timer-" + connectionName);
                    t.setDaemon(true);
                    return t;
                });
                effectiveScheduler = new ScheduledExecutorScheduler(executor, clock);
                closedHook = executor::shutdownNow;
            }

            // 2. Wire codec, framing and history
            PushItemEncoder effectiveEncoder = encoder != null
                    ? encoder
                    : new DefaultPushItemEncoder(config.maxPayloadSize());
            FrameBatcher batcher = new FrameBatcher(transport, config.maxFrameSize(), observabilitySink, wallClock);
            ReplayTracker tracker = new ReplayTracker(config.replayBufferCapacity());

            // 3. Driver owns both worker threads
            PushConnectionDriver driver = new PushConnectionDriver(
                    connectionName,
                    transport,
                    effectiveEncoder,
                    responseDecoder,
                    batcher,
                    tracker,
                    clock,
                    effectiveScheduler,
                    wallClock,
                    config.timingPolicy(),
                    observabilitySink,
                    closedHook
            );
            driver.start();

            return new PushConnection(driver, config);
        }
    }
}
