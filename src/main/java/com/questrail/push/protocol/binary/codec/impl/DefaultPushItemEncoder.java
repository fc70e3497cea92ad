package com.questrail.push.protocol.binary.codec.impl;

import com.questrail.push.api.Payload;
import com.questrail.push.api.PayloadMarshalException;
import com.questrail.push.protocol.binary.codec.PushEncodeException;
import com.questrail.push.protocol.binary.codec.PushItemEncoder;
import com.questrail.push.protocol.binary.codec.PushWireFormat;
import com.questrail.push.protocol.binary.model.IdentifiedPayload;
import com.questrail.push.protocol.binary.model.PushErrorCode;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.util.Objects;

/**
 * DefaultPushItemEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link PushItemEncoder}.
 *
 * <p>Produces a single item:</p>
 * <pre>
 *   [ localId=0 ][ itemLength ][ token(32) ][ body ][ id ][ expiration ][ priority ]
 * </pre>
 *
 * <p>Token hex decoding and big-endian field writes are delegated to Netty's
 * buffer utilities. The payload object is never mutated; priority
 * normalization only affects the bytes written.</p>
 */
public final class DefaultPushItemEncoder implements PushItemEncoder
{
    private static final long MAX_EXPIRATION = 0xFFFF_FFFFL;

    private final int maxPayloadSize;

    public DefaultPushItemEncoder()
    {
        this(PushWireFormat.DEFAULT_MAX_PAYLOAD_SIZE);
    }

    public DefaultPushItemEncoder(int maxPayloadSize)
    {
        if (maxPayloadSize <= 0) {
            throw new IllegalArgumentException("maxPayloadSize must be positive");
        }
        this.maxPayloadSize = maxPayloadSize;
    }

    @Override
    public byte[] encode(IdentifiedPayload item)
    {
        Objects.requireNonNull(item, "item");
        final Payload payload = item.payload();

        final byte[] token = decodeToken(payload.token());
        final byte[] body = marshalBody(payload);
        final long expiration = payload.expiration();
        if (expiration < 0 || expiration > MAX_EXPIRATION) {
            throw new PushEncodeException(PushErrorCode.PROCESSING_ERROR,
                    "Expiration out of range: " + expiration);
        }

        final int itemLength = PushWireFormat.itemLength(body.length);
        ByteBuf buf = Unpooled.buffer(PushWireFormat.ITEM_PREFIX_LENGTH + itemLength);
        try {
            buf.writeByte(0); // local id, assigned by the batcher
            buf.writeShort(itemLength);
            buf.writeBytes(token);
            buf.writeBytes(body);
            buf.writeInt(item.id());
            buf.writeInt((int) expiration);
            buf.writeByte(PushWireFormat.normalizePriority(payload.priority()));
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    private static byte[] decodeToken(String hex)
    {
        if (hex == null) {
            throw new PushEncodeException(PushErrorCode.MISSING_DEVICE_TOKEN, "Device token is missing");
        }

        final byte[] token;
        try {
            token = ByteBufUtil.decodeHexDump(hex);
        } catch (IllegalArgumentException e) {
            throw new PushEncodeException(PushErrorCode.INVALID_TOKEN,
                    "Device token is not valid hex: " + e.getMessage(), e);
        }

        if (token.length != PushWireFormat.TOKEN_LENGTH) {
            throw new PushEncodeException(PushErrorCode.INVALID_TOKEN_SIZE,
                    "Device token must be " + PushWireFormat.TOKEN_LENGTH + " bytes, was " + token.length);
        }
        return token;
    }

    private byte[] marshalBody(Payload payload)
    {
        final byte[] body;
        try {
            body = payload.marshal(maxPayloadSize);
        } catch (PayloadMarshalException e) {
            throw new PushEncodeException(PushErrorCode.INVALID_PAYLOAD_SIZE,
                    "Failed to marshal payload: " + e.getMessage(), e);
        }

        if (body == null) {
            throw new PushEncodeException(PushErrorCode.MISSING_PAYLOAD, "Payload marshaled to null");
        }
        if (body.length > maxPayloadSize) {
            throw new PushEncodeException(PushErrorCode.INVALID_PAYLOAD_SIZE,
                    "Payload is " + body.length + " bytes, limit is " + maxPayloadSize);
        }
        return body;
    }
}
