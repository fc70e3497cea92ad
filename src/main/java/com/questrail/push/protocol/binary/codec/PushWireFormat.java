package com.questrail.push.protocol.binary.codec;

/**
 * PushWireFormat
 * -----------------------------------------------------------------------------
 * Constants of the binary push wire format. All multi-byte fields are
 * big-endian.
 *
 * <pre>
 *   frame          : type(1)=0x02 | frameLength(4) | item...
 *   item           : localId(1) | itemLength(2) | token(32) | payload(n)
 *                    | notificationId(4) | expiration(4) | priority(1)
 *   error response : command(1) | status(1) | notificationId(4)
 * </pre>
 *
 * <p>{@code frameLength} counts the bytes following the 5-byte frame header.
 * {@code itemLength} counts the bytes following the 3-byte item prefix, i.e.
 * {@code 32 + n + 4 + 4 + 1}.</p>
 */
public final class PushWireFormat
{
    /** Frame type byte of the batched notification frame. */
    public static final int FRAME_TYPE = 0x02;

    /** type(1) + frameLength(4). */
    public static final int FRAME_HEADER_LENGTH = 5;

    /** Offset of the frameLength field inside the frame header. */
    public static final int FRAME_LENGTH_OFFSET = 1;

    /** localId(1) + itemLength(2). */
    public static final int ITEM_PREFIX_LENGTH = 3;

    /** Decoded device token length. */
    public static final int TOKEN_LENGTH = 32;

    /** notificationId(4) + expiration(4) + priority(1). */
    public static final int ITEM_TRAILER_LENGTH = 9;

    /** Default upper bound of a whole frame, header included. */
    public static final int DEFAULT_MAX_FRAME_SIZE = 65535;

    /** Default upper bound of a marshaled notification body. */
    public static final int DEFAULT_MAX_PAYLOAD_SIZE = 256;

    /** Size of an error response. */
    public static final int ERROR_RESPONSE_LENGTH = 6;

    /** Command byte the peer uses for error responses. */
    public static final int ERROR_RESPONSE_COMMAND = 0x08;

    public static final int PRIORITY_IMMEDIATE = 10;
    public static final int PRIORITY_CONSERVE_POWER = 5;

    private PushWireFormat() {}

    /**
     * Value of the itemLength field for a body of {@code payloadLength} bytes.
     */
    public static int itemLength(int payloadLength) {
        return TOKEN_LENGTH + payloadLength + ITEM_TRAILER_LENGTH;
    }

    /**
     * Priority as written on the wire: 10 stays 10, everything else becomes 5.
     */
    public static int normalizePriority(int priority) {
        return priority == PRIORITY_IMMEDIATE ? PRIORITY_IMMEDIATE : PRIORITY_CONSERVE_POWER;
    }
}
