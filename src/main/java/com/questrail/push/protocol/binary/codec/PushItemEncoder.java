package com.questrail.push.protocol.binary.codec;

import com.questrail.push.protocol.binary.model.IdentifiedPayload;

/**
 * PushItemEncoder
 * -----------------------------------------------------------------------------
 * Encodes one identified notification into the bytes of a single frame item.
 *
 * <p>This is a pure transform. It does not know about frames, batching, or
 * local item ids: the returned item carries 0 in its localId byte and the
 * batcher overwrites it when the item is placed into a frame.</p>
 */
public interface PushItemEncoder
{
    /**
     * Encode {@code item} into wire bytes, prefix included.
     *
     * @throws PushEncodeException if the token or the notification body cannot
     *                             be encoded
     */
    byte[] encode(IdentifiedPayload item);
}
