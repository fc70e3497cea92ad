package com.questrail.push.protocol.binary.codec;

/**
 * Indicates that received or captured bytes do not form a valid frame or
 * error response.
 */
public final class PushDecodeException extends RuntimeException
{
    public PushDecodeException(String message) {
        super(message);
    }

    public PushDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
