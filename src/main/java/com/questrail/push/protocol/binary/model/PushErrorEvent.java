package com.questrail.push.protocol.binary.model;

import java.util.Objects;

/**
 * PushErrorEvent
 * -----------------------------------------------------------------------------
 * The single terminal event of a connection.
 *
 * <p>Exactly one of these is consumed per connection. It may originate from the
 * peer (a decoded error response), from the transport (a failed read, which is
 * also what a failed write or an explicit disconnect turns into), or from the
 * encoder (a payload that could not be put on the wire).</p>
 *
 * @param code           normalized status code
 * @param description    human readable description
 * @param notificationId correlated notification id, 0 when none applies
 * @param rawCode        status byte as received; equals {@code code.code()} for
 *                       locally generated events
 * @param source         where the event was detected
 */
public record PushErrorEvent(
        PushErrorCode code,
        String description,
        int notificationId,
        int rawCode,
        Source source
) {
    /** Origin of a terminal event. */
    public enum Source
    {
        /** Error response read from the peer. */
        PEER,
        /** The transport failed or was closed locally. */
        TRANSPORT,
        /** A submitted payload could not be encoded. */
        ENCODER
    }

    public PushErrorEvent {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(source, "source");
    }

    /**
     * Event for an error response read from the peer.
     */
    public static PushErrorEvent fromPeer(int rawCode, int notificationId) {
        PushErrorCode code = PushErrorCode.fromCode(rawCode);
        String description = code == PushErrorCode.UNKNOWN && (rawCode & 0xFF) != PushErrorCode.UNKNOWN.code()
                ? "UNKNOWN (" + (rawCode & 0xFF) + ")"
                : code.name();
        return new PushErrorEvent(code, description, notificationId, rawCode & 0xFF, Source.PEER);
    }

    /**
     * Synthetic {@link PushErrorCode#SHUTDOWN} event for a failed read.
     */
    public static PushErrorEvent transportFailure(Throwable cause) {
        String description = cause == null || cause.getMessage() == null
                ? "transport closed"
                : cause.getMessage();
        return new PushErrorEvent(PushErrorCode.SHUTDOWN, description, 0,
                PushErrorCode.SHUTDOWN.code(), Source.TRANSPORT);
    }

    /**
     * Event for a payload that failed to encode, correlated to its id.
     */
    public static PushErrorEvent encodingFailure(PushErrorCode code, String description, int notificationId) {
        return new PushErrorEvent(code, description, notificationId, code.code(), Source.ENCODER);
    }

    /**
     * Whether this event names a specific notification.
     */
    public boolean hasNotificationId() {
        return notificationId != 0;
    }

    @Override
    public String toString() {
        return "PushErrorEvent[" + code + " '" + description + "' id="
                + Integer.toUnsignedString(notificationId) + " source=" + source + "]";
    }
}
