package com.questrail.push.protocol.binary.observability;

import com.questrail.push.protocol.binary.model.CloseResult;

/**
 * No-op implementation of PushObservabilitySink.
 */
public final class NullObservabilitySink implements PushObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(PushStateTransitionEvent event) {}

    @Override
    public void onFrameFlushed(FrameFlushedEvent event) {}

    @Override
    public void onFault(PushFaultEvent event) {}

    @Override
    public void onClosed(CloseResult result) {}
}
