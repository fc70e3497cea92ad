package com.questrail.push.protocol.binary.observability;

import com.questrail.push.protocol.binary.model.CloseResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of PushObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jPushObservabilitySink implements PushObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jPushObservabilitySink.class);

    @Override
    public void onStateTransition(PushStateTransitionEvent event) {
        log.info("Push connection {}: {} -> {}",
            event.connectionName(),
            event.oldState(),
            event.newState());
    }

    @Override
    public void onFrameFlushed(FrameFlushedEvent event) {
        log.debug("Flushed frame: {} bytes, {} items", event.frameBytes(), event.itemCount());
    }

    @Override
    public void onFault(PushFaultEvent event) {
        log.error("Push connection fault: {}", event.message(), event.cause());
    }

    @Override
    public void onClosed(CloseResult result) {
        if (result.unsentPayloadBufferOverflow()) {
            log.warn("Push connection closed by {}: {} unsent, history overflowed, further loss possible",
                result.error(),
                result.unsentPayloads().size());
        } else {
            log.info("Push connection closed by {}: {} unsent, error payload {}",
                result.error(),
                result.unsentPayloads().size(),
                result.errorPayload().isPresent() ? "identified" : "absent");
        }
    }
}
