package com.questrail.push.protocol.binary.internal.replay;

/**
 * Assigns connection-scoped notification ids.
 *
 * <p>Ids are unsigned 32-bit values starting at 1. After 0xFFFFFFFF the
 * sequence wraps to 1; 0 is never returned.</p>
 *
 * <p>Not thread-safe. Confined to the connection driver thread.</p>
 */
public final class NotificationIdSequence
{
    private int last;

    public NotificationIdSequence()
    {
        this(0);
    }

    /**
     * Start after {@code last}; the next id is {@code last + 1} (skipping 0).
     */
    NotificationIdSequence(int last)
    {
        this.last = last;
    }

    public int next()
    {
        last++;
        if (last == 0) {
            last = 1;
        }
        return last;
    }
}
