package com.questrail.push.protocol.binary.internal.exec;

import com.questrail.push.api.Payload;
import com.questrail.push.protocol.binary.PushConnectionClosedException;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * DriverEvent
 * -----------------------------------------------------------------------------
 * Everything the connection driver reacts to arrives as one of these, through
 * a single queue, and is handled on the driver thread.
 */
sealed interface DriverEvent
        permits DriverEvent.Submission, DriverEvent.FlushTimerExpired, DriverEvent.TerminalSignal
{
    /**
     * A caller handing over a payload. The caller blocks on {@link #accepted()}
     * until the driver has assigned an id or rejected the payload.
     */
    final class Submission implements DriverEvent {
        private final Payload payload;
        private final CompletableFuture<Integer> accepted = new CompletableFuture<>();

        Submission(Payload payload) {
            this.payload = Objects.requireNonNull(payload, "payload");
        }

        Payload payload() {
            return payload;
        }

        CompletableFuture<Integer> accepted() {
            return accepted;
        }

        void accept(int id) {
            accepted.complete(id);
        }

        void reject(String reason) {
            accepted.completeExceptionally(new PushConnectionClosedException(reason));
        }
    }

    /**
     * A flush timer fired. Only the expiry matching the most recently armed
     * timer is acted on.
     */
    record FlushTimerExpired(long sequence) implements DriverEvent {}

    /**
     * Wake-up after the terminal slot was claimed. The event itself is read
     * from the slot, not from this signal.
     */
    record TerminalSignal() implements DriverEvent {}
}
