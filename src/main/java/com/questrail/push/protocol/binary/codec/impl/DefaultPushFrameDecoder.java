package com.questrail.push.protocol.binary.codec.impl;

import com.questrail.push.protocol.binary.codec.DecodedItem;
import com.questrail.push.protocol.binary.codec.PushDecodeException;
import com.questrail.push.protocol.binary.codec.PushFrameDecoder;
import com.questrail.push.protocol.binary.codec.PushWireFormat;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * DefaultPushFrameDecoder
 * -----------------------------------------------------------------------------
 * Mechanical inverse of {@link DefaultPushItemEncoder} plus the frame envelope
 * written by the batcher.
 *
 * <p>Strict: the declared frame length must match the bytes supplied exactly,
 * and every item must be complete.</p>
 */
public final class DefaultPushFrameDecoder implements PushFrameDecoder
{
    private static final int MIN_ITEM_LENGTH = PushWireFormat.itemLength(0);

    @Override
    public List<DecodedItem> decode(byte[] frame)
    {
        if (frame == null || frame.length < PushWireFormat.FRAME_HEADER_LENGTH) {
            throw new PushDecodeException("Frame too short for header");
        }

        ByteBuf buf = Unpooled.wrappedBuffer(frame);

        int type = buf.readUnsignedByte();
        if (type != PushWireFormat.FRAME_TYPE) {
            throw new PushDecodeException(String.format("Unexpected frame type 0x%02X", type));
        }

        long declared = buf.readUnsignedInt();
        if (declared != buf.readableBytes()) {
            throw new PushDecodeException("Frame length " + declared + " does not match "
                    + buf.readableBytes() + " remaining bytes");
        }

        List<DecodedItem> items = new ArrayList<>();
        while (buf.isReadable()) {
            items.add(readItem(buf));
        }
        return Collections.unmodifiableList(items);
    }

    private static DecodedItem readItem(ByteBuf buf)
    {
        if (buf.readableBytes() < PushWireFormat.ITEM_PREFIX_LENGTH) {
            throw new PushDecodeException("Truncated item prefix");
        }

        int localId = buf.readUnsignedByte();
        int itemLength = buf.readUnsignedShort();
        if (itemLength < MIN_ITEM_LENGTH) {
            throw new PushDecodeException("Item length " + itemLength + " below minimum " + MIN_ITEM_LENGTH);
        }
        if (buf.readableBytes() < itemLength) {
            throw new PushDecodeException("Item length " + itemLength + " exceeds remaining "
                    + buf.readableBytes() + " bytes");
        }

        String token = ByteBufUtil.hexDump(buf, buf.readerIndex(), PushWireFormat.TOKEN_LENGTH);
        buf.skipBytes(PushWireFormat.TOKEN_LENGTH);

        byte[] payload = new byte[itemLength - MIN_ITEM_LENGTH];
        buf.readBytes(payload);

        int notificationId = buf.readInt();
        long expiration = buf.readUnsignedInt();
        int priority = buf.readUnsignedByte();

        return new DecodedItem(localId, token, payload, notificationId, expiration, priority);
    }
}
