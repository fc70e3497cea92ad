package com.questrail.push.protocol.binary.codec;

import com.questrail.push.protocol.binary.model.PushErrorCode;

import java.util.Objects;

/**
 * Indicates that a notification could not be turned into wire bytes.
 *
 * <p>The {@link #reason()} uses the protocol's own status vocabulary so that an
 * encoding failure can be reported to callers the same way a peer rejection
 * would be:</p>
 * <ul>
 *   <li>{@link PushErrorCode#INVALID_TOKEN} for a token that is not valid hex</li>
 *   <li>{@link PushErrorCode#INVALID_TOKEN_SIZE} for a token of the wrong length</li>
 *   <li>{@link PushErrorCode#INVALID_PAYLOAD_SIZE} for a body that failed to
 *       marshal or does not fit</li>
 *   <li>{@link PushErrorCode#MISSING_DEVICE_TOKEN} and
 *       {@link PushErrorCode#MISSING_PAYLOAD} for absent fields</li>
 *   <li>{@link PushErrorCode#PROCESSING_ERROR} for an expiration the wire
 *       field cannot hold</li>
 * </ul>
 */
public final class PushEncodeException extends RuntimeException
{
    private final PushErrorCode reason;

    public PushEncodeException(PushErrorCode reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public PushEncodeException(PushErrorCode reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public PushErrorCode reason() {
        return reason;
    }
}
