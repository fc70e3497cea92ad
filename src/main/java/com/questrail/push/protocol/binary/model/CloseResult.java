package com.questrail.push.protocol.binary.model;

import com.questrail.push.api.Payload;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * CloseResult
 * -----------------------------------------------------------------------------
 * Terminal report delivered once per connection.
 *
 * <p>Interpretation for callers deciding what to resend:</p>
 * <ul>
 *   <li>{@link #unsentPayloads()} were never attempted by the peer and are safe
 *       to resubmit, in the given (oldest-first) order.</li>
 *   <li>{@link #errorPayload()} is the payload the peer rejected, if it was
 *       still retained. It should not be resent unchanged.</li>
 *   <li>{@link #unsentPayloadBufferOverflow()} means history was evicted before
 *       the failure point could be located. More payloads than those listed
 *       may have been lost; the loss is unconfirmed.</li>
 * </ul>
 *
 * @param error                       the terminal event
 * @param unsentPayloads              definitely unsent payloads, oldest first
 * @param errorPayload                payload correlated with the error id
 * @param unsentPayloadBufferOverflow whether retained history may be incomplete
 */
public record CloseResult(
        PushErrorEvent error,
        List<Payload> unsentPayloads,
        Optional<Payload> errorPayload,
        boolean unsentPayloadBufferOverflow
) {
    public CloseResult {
        Objects.requireNonNull(error, "error");
        Objects.requireNonNull(errorPayload, "errorPayload");
        unsentPayloads = List.copyOf(Objects.requireNonNull(unsentPayloads, "unsentPayloads"));
    }
}
