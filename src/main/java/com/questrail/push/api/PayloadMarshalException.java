package com.questrail.push.api;

/**
 * Raised by {@link Payload#marshal(int)} when a notification body cannot be
 * rendered, including when it would exceed the allowed size.
 */
public class PayloadMarshalException extends Exception
{
    public PayloadMarshalException(String message) {
        super(message);
    }

    public PayloadMarshalException(String message, Throwable cause) {
        super(message, cause);
    }
}
