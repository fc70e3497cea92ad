package com.questrail.push.protocol.binary.internal.exec;

import com.questrail.push.api.Payload;
import com.questrail.push.protocol.binary.PushConnectionClosedException;
import com.questrail.push.protocol.binary.codec.ErrorResponseDecoder;
import com.questrail.push.protocol.binary.codec.PushEncodeException;
import com.questrail.push.protocol.binary.codec.PushItemEncoder;
import com.questrail.push.protocol.binary.config.PushTimingPolicy;
import com.questrail.push.protocol.binary.internal.frame.FrameBatcher;
import com.questrail.push.protocol.binary.internal.replay.ReplayTracker;
import com.questrail.push.protocol.binary.internal.time.Cancellable;
import com.questrail.push.protocol.binary.internal.time.MonotonicClock;
import com.questrail.push.protocol.binary.internal.time.MonotonicScheduler;
import com.questrail.push.protocol.binary.internal.time.WallClock;
import com.questrail.push.protocol.binary.model.CloseResult;
import com.questrail.push.protocol.binary.model.ConnectionState;
import com.questrail.push.protocol.binary.model.IdentifiedPayload;
import com.questrail.push.protocol.binary.model.PushErrorEvent;
import com.questrail.push.protocol.binary.observability.PushFaultEvent;
import com.questrail.push.protocol.binary.observability.PushObservabilitySink;
import com.questrail.push.protocol.binary.observability.PushStateTransitionEvent;
import com.questrail.push.protocol.binary.transport.PushTransport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * PushConnectionDriver
 * =============================================================================
 * Serialized event loop of one push connection.
 *
 * <h2>Event sources</h2>
 * <ul>
 *   <li><b>Submissions</b> from callers: assign an id, retain, encode, append to
 *       the current frame, re-arm the coalesce timer.</li>
 *   <li><b>Flush timer expiries</b>: flush the current frame, re-arm the idle
 *       timer. Expiries of timers that were re-armed since are ignored.</li>
 *   <li><b>The terminal event</b>: claimed through a single slot by whichever
 *       source sees a failure first (the error listener, or the driver itself
 *       when a payload cannot be encoded). Later claims are dropped.</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * Two threads per connection:
 * <pre>
 *   push-connection-driver-N   this event loop; sole owner of the replay history
 *   push-error-listener-N      {@link ErrorResponseListener}, blocked on a read
 * </pre>
 * Frame buffer access is serialized by {@link FrameBatcher}'s lock, which is
 * the only state shared with {@link #disconnect()}.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   start()      → ACTIVE, both threads running, idle timer armed
 *   terminal     → CLOSING: timer cancelled, history resolved, queued submissions rejected
 *   resolved     → CLOSED: state published, then close notification completed
 * </pre>
 */
public final class PushConnectionDriver {

    private final String name;
    private final PushTransport transport;
    private final PushItemEncoder encoder;
    private final ErrorResponseDecoder responseDecoder;
    private final FrameBatcher batcher;
    private final ReplayTracker tracker;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final PushTimingPolicy timingPolicy;
    private final PushObservabilitySink observabilitySink;
    private final Runnable closedHook;

    private final BlockingQueue<DriverEvent> events = new LinkedBlockingQueue<>();
    private final AtomicReference<PushErrorEvent> terminal = new AtomicReference<>();
    private final CompletableFuture<CloseResult> closeNotification = new CompletableFuture<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean disconnected = new AtomicBoolean(false);

    private final Object stateLock = new Object();
    private boolean accepting = true; // guarded by stateLock
    private volatile ConnectionState state = ConnectionState.ACTIVE;

    private volatile Thread driverThread;
    private volatile Thread listenerThread;

    // Driver thread only.
    private Cancellable armedTimer;
    private long armedSequence;

    /**
     * @param closedHook run on the driver thread after the connection reaches
     *                   CLOSED; used to release resources the connection owns
     */
    public PushConnectionDriver(String name,
                                PushTransport transport,
                                PushItemEncoder encoder,
                                ErrorResponseDecoder responseDecoder,
                                FrameBatcher batcher,
                                ReplayTracker tracker,
                                MonotonicClock clock,
                                MonotonicScheduler scheduler,
                                WallClock wallClock,
                                PushTimingPolicy timingPolicy,
                                PushObservabilitySink observabilitySink,
                                Runnable closedHook)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.responseDecoder = Objects.requireNonNull(responseDecoder, "responseDecoder");
        this.batcher = Objects.requireNonNull(batcher, "batcher");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.closedHook = Objects.requireNonNull(closedHook, "closedHook");
    }

    /**
     * Start the driver and error listener threads. Only the first call has an effect.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        ErrorResponseListener listener = new ErrorResponseListener(transport, responseDecoder, this::offerTerminal);

        driverThread = new Thread(this::runEventLoop, "push-connection-driver-" + name);
        listenerThread = new Thread(listener, "push-error-listener-" + name);
        driverThread.start();
        listenerThread.start();
    }

    /**
     * Hand {@code payload} to the driver and wait until it has been assigned an id.
     *
     * <p>If the calling thread is interrupted while waiting, the payload may
     * still be processed; it will then appear in the close result like any
     * other submission.</p>
     *
     * @return the notification id assigned to the payload
     * @throws PushConnectionClosedException if the connection stopped accepting
     *                                       submissions before taking this one
     */
    public int submit(Payload payload) throws InterruptedException {
        DriverEvent.Submission submission = new DriverEvent.Submission(payload);
        synchronized (stateLock) {
            if (!accepting) {
                throw new PushConnectionClosedException("Connection " + name + " is " + state);
            }
            events.add(submission);
        }

        try {
            return submission.accepted().get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw new PushConnectionClosedException(cause.getMessage(), cause);
        }
    }

    /**
     * Claim the terminal slot. Only the first claim per connection wins; later
     * ones return without effect.
     *
     * @return {@code true} if {@code event} became the terminal event
     */
    public boolean offerTerminal(PushErrorEvent event) {
        Objects.requireNonNull(event, "event");
        if (terminal.compareAndSet(null, event)) {
            events.add(new DriverEvent.TerminalSignal());
            return true;
        }
        return false;
    }

    /**
     * Flush whatever is buffered, then close the transport. Does not produce a
     * close result by itself: the error listener's read fails as a consequence
     * and that failure drives the normal terminal path.
     */
    public void disconnect() {
        if (disconnected.compareAndSet(false, true)) {
            batcher.flush();
            transport.close();
        }
    }

    public CompletableFuture<CloseResult> closeNotification() {
        return closeNotification;
    }

    public ConnectionState state() {
        return state;
    }

    public String name() {
        return name;
    }

    /**
     * Wait for both worker threads to exit.
     *
     * @return {@code true} if both exited within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (Thread t : new Thread[] { driverThread, listenerThread }) {
            if (t == null) {
                continue;
            }
            long remainingMillis = Math.max(1L, (deadline - System.nanoTime()) / 1_000_000L);
            t.join(remainingMillis);
            if (t.isAlive()) {
                return false;
            }
        }
        return true;
    }

    // -------------------------------------------------------------------------
    // Event loop
    // -------------------------------------------------------------------------

    private void runEventLoop() {
        PushErrorEvent error;
        try {
            error = processUntilTerminal();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error = claimTerminal(PushErrorEvent.transportFailure(e));
            transport.close();
        } catch (RuntimeException e) {
            observabilitySink.onFault(new PushFaultEvent(wallClock.now(), "Connection driver failed", e));
            error = claimTerminal(PushErrorEvent.transportFailure(e));
            transport.close();
        }
        finish(error);
    }

    private PushErrorEvent processUntilTerminal() throws InterruptedException {
        armTimer(timingPolicy.idleFlushInterval());

        while (true) {
            PushErrorEvent claimed = terminal.get();
            if (claimed != null) {
                return claimed;
            }

            DriverEvent event = events.take();
            if (event instanceof DriverEvent.Submission) {
                handleSubmission((DriverEvent.Submission) event);
            } else if (event instanceof DriverEvent.FlushTimerExpired) {
                handleTimerExpired((DriverEvent.FlushTimerExpired) event);
            }
            // TerminalSignal only wakes the loop; the slot is read above.
        }
    }

    private void handleSubmission(DriverEvent.Submission submission) {
        IdentifiedPayload item = tracker.track(submission.payload());
        try {
            byte[] bytes = encoder.encode(item);
            batcher.append(bytes);
            armTimer(timingPolicy.coalesceWindow());
        } catch (PushEncodeException e) {
            observabilitySink.onFault(new PushFaultEvent(wallClock.now(),
                    "Notification " + Integer.toUnsignedString(item.id()) + " could not be encoded", e));
            offerTerminal(PushErrorEvent.encodingFailure(e.reason(), e.getMessage(), item.id()));
            disconnect();
        } finally {
            submission.accept(item.id());
        }
    }

    private void handleTimerExpired(DriverEvent.FlushTimerExpired expired) {
        if (expired.sequence() != armedSequence) {
            return;
        }
        batcher.flush();
        armTimer(timingPolicy.idleFlushInterval());
    }

    private void armTimer(Duration delay) {
        cancelTimer();
        long sequence = ++armedSequence;
        armedTimer = scheduler.scheduleAfter(delay, clock,
                () -> events.add(new DriverEvent.FlushTimerExpired(sequence)));
    }

    private void cancelTimer() {
        Cancellable prior = armedTimer;
        if (prior != null) {
            prior.cancel();
            armedTimer = null;
        }
    }

    private PushErrorEvent claimTerminal(PushErrorEvent fallback) {
        terminal.compareAndSet(null, fallback);
        return terminal.get();
    }

    private void finish(PushErrorEvent error) {
        synchronized (stateLock) {
            accepting = false;
        }
        transition(ConnectionState.CLOSING);

        cancelTimer();
        CloseResult result = tracker.resolve(error);
        rejectQueuedSubmissions();
        batcher.release();

        observabilitySink.onClosed(result);
        transition(ConnectionState.CLOSED);
        closeNotification.complete(result);

        closedHook.run();
    }

    private void rejectQueuedSubmissions() {
        List<DriverEvent> remaining = new ArrayList<>();
        events.drainTo(remaining);
        for (DriverEvent event : remaining) {
            if (event instanceof DriverEvent.Submission) {
                ((DriverEvent.Submission) event).reject("Connection " + name + " closed before accepting the payload");
            }
        }
    }

    private void transition(ConnectionState next) {
        ConnectionState previous = state;
        state = next;
        observabilitySink.onStateTransition(new PushStateTransitionEvent(wallClock.now(), name, previous, next));
    }
}
