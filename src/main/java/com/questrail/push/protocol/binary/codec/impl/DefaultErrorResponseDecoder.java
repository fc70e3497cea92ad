package com.questrail.push.protocol.binary.codec.impl;

import com.questrail.push.protocol.binary.codec.ErrorResponseDecoder;
import com.questrail.push.protocol.binary.codec.PushDecodeException;
import com.questrail.push.protocol.binary.codec.PushWireFormat;
import com.questrail.push.protocol.binary.model.PushErrorEvent;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

/**
 * DefaultErrorResponseDecoder
 * -----------------------------------------------------------------------------
 * Reads {@code command(1) | status(1) | notificationId(4)}.
 *
 * <p>The command byte is not validated. A peer only ever writes one response
 * before closing, so whatever arrives in that slot is treated as the terminal
 * report.</p>
 */
public final class DefaultErrorResponseDecoder implements ErrorResponseDecoder
{
    @Override
    public PushErrorEvent decode(byte[] response)
    {
        if (response == null || response.length != PushWireFormat.ERROR_RESPONSE_LENGTH) {
            throw new PushDecodeException("Error response must be "
                    + PushWireFormat.ERROR_RESPONSE_LENGTH + " bytes, was "
                    + (response == null ? "null" : response.length));
        }

        ByteBuf buf = Unpooled.wrappedBuffer(response);
        buf.skipBytes(1); // command
        int status = buf.readUnsignedByte();
        int notificationId = buf.readInt();
        return PushErrorEvent.fromPeer(status, notificationId);
    }
}
