package com.questrail.push.protocol.binary.codec;

import com.questrail.push.protocol.binary.model.PushErrorEvent;

/**
 * Decodes the fixed-size error response a peer sends before closing.
 */
public interface ErrorResponseDecoder
{
    /**
     * @param response exactly {@link PushWireFormat#ERROR_RESPONSE_LENGTH} bytes
     * @return a {@link PushErrorEvent.Source#PEER} event
     * @throws PushDecodeException if {@code response} has the wrong length
     */
    PushErrorEvent decode(byte[] response);
}
