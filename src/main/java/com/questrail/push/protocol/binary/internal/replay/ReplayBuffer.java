package com.questrail.push.protocol.binary.internal.replay;

import com.questrail.push.protocol.binary.model.IdentifiedPayload;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;

/**
 * ReplayBuffer
 * -----------------------------------------------------------------------------
 * Bounded history of submitted notifications, newest first.
 *
 * <p>Once the buffer holds {@code capacity} entries, each new entry evicts the
 * oldest one. Evicted entries are gone for good; {@link #evictedCount()}
 * records that it happened so that loss reconstruction can flag incomplete
 * history.</p>
 *
 * <p>Not thread-safe. Confined to the connection driver thread.</p>
 */
public final class ReplayBuffer
{
    private final int capacity;
    private final Deque<IdentifiedPayload> entries;
    private long evictedCount;

    public ReplayBuffer(int capacity)
    {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Insert {@code entry} as the newest entry.
     *
     * @return the evicted oldest entry, or {@code null} if nothing was evicted
     */
    public IdentifiedPayload record(IdentifiedPayload entry)
    {
        Objects.requireNonNull(entry, "entry");
        entries.addFirst(entry);
        if (entries.size() > capacity) {
            evictedCount++;
            return entries.removeLast();
        }
        return null;
    }

    /**
     * Iterates from the newest entry to the oldest.
     */
    public Iterator<IdentifiedPayload> newestFirst()
    {
        return entries.iterator();
    }

    public int size()
    {
        return entries.size();
    }

    public int capacity()
    {
        return capacity;
    }

    /**
     * Number of entries dropped because the buffer was full.
     */
    public long evictedCount()
    {
        return evictedCount;
    }

    public boolean hasEvicted()
    {
        return evictedCount > 0;
    }
}
