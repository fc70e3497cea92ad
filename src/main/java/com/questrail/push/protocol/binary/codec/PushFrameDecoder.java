package com.questrail.push.protocol.binary.codec;

import java.util.List;

/**
 * PushFrameDecoder
 * -----------------------------------------------------------------------------
 * Inverse of the outbound path: parses one complete frame back into its items.
 *
 * <p>The client never receives frames, so this decoder has no place in the
 * connection itself. It exists for peers written against this library (test
 * servers, capture tools) that need to read what a connection put on the
 * wire.</p>
 */
public interface PushFrameDecoder
{
    /**
     * Decode a complete frame, header included.
     *
     * @throws PushDecodeException if the bytes are not exactly one well-formed frame
     */
    List<DecodedItem> decode(byte[] frame);
}
