package com.questrail.push.protocol.binary.model;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * PushErrorCode
 * -----------------------------------------------------------------------------
 * Status codes carried in the second byte of an error response.
 *
 * <p>The table is closed. Any code the peer sends that is not listed here is
 * normalized to {@link #UNKNOWN} by {@link #fromCode(int)}; the raw value is
 * preserved separately on {@link PushErrorEvent#rawCode()}.</p>
 *
 * <p>{@link #SHUTDOWN} doubles as the code for locally detected transport
 * failures, which carry no correlated notification id.</p>
 */
public enum PushErrorCode
{
    NO_ERRORS(0),
    PROCESSING_ERROR(1),
    MISSING_DEVICE_TOKEN(2),
    MISSING_TOPIC(3),
    MISSING_PAYLOAD(4),
    INVALID_TOKEN_SIZE(5),
    INVALID_TOPIC_SIZE(6),
    INVALID_PAYLOAD_SIZE(7),
    INVALID_TOKEN(8),
    SHUTDOWN(10),
    UNKNOWN(255);

    private static final Map<Integer, PushErrorCode> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(PushErrorCode::code, Function.identity()));

    private final int code;

    PushErrorCode(int code) {
        this.code = code;
    }

    /**
     * Wire value of this status (0-255).
     */
    public int code() {
        return code;
    }

    /**
     * Resolve a wire value. Only the low eight bits are considered.
     *
     * @return the matching constant, or {@link #UNKNOWN} for unlisted codes
     */
    public static PushErrorCode fromCode(int code) {
        return BY_CODE.getOrDefault(code & 0xFF, UNKNOWN);
    }
}
