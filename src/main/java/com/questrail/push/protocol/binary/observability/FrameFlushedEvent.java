package com.questrail.push.protocol.binary.observability;

import java.time.Instant;

/**
 * Record representing one frame written to the transport.
 *
 * @param frameBytes total bytes written, header included
 * @param itemCount  number of items in the frame
 */
public record FrameFlushedEvent(
    Instant timestamp,
    int frameBytes,
    int itemCount
) {
}
