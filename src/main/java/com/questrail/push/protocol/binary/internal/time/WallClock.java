package com.questrail.push.protocol.binary.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for observability timestamps only.
 */
public interface WallClock
{
    Instant now();
}
