package com.questrail.push.protocol.binary.observability;

import com.questrail.push.protocol.binary.model.CloseResult;

/**
 * Receives observability events from a push connection.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive on the connection's worker threads and must not block.</p>
 */
public interface PushObservabilitySink {
    /**
     * Called when the connection lifecycle state changes.
     * @param event the transition details
     */
    void onStateTransition(PushStateTransitionEvent event);

    /**
     * Called after a frame has been written to the transport.
     * @param event the flushed frame details
     */
    void onFrameFlushed(FrameFlushedEvent event);

    /**
     * Called when a fault is detected (encoding failure, write failure, read failure).
     * @param event the fault details
     */
    void onFault(PushFaultEvent event);

    /**
     * Called once, with the same result delivered to the caller.
     * @param result the terminal report
     */
    void onClosed(CloseResult result);
}
