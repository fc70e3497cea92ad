package com.questrail.push.protocol.binary.internal.replay;

import com.questrail.push.api.Payload;
import com.questrail.push.protocol.binary.model.CloseResult;
import com.questrail.push.protocol.binary.model.IdentifiedPayload;
import com.questrail.push.protocol.binary.model.PushErrorEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ReplayTracker
 * =============================================================================
 * Id assignment plus retained history, and the reconstruction of what was
 * never processed once the connection ends.
 *
 * <h2>Resolution</h2>
 * The peer processes notifications in submission order and stops at the first
 * one it rejects. Walking the history from newest to oldest therefore splits it
 * at the rejected id:
 * <pre>
 *   newest ... [ unsent ... ] [ error payload ] [ processed ... ] oldest
 * </pre>
 * <ul>
 *   <li>Entries newer than the rejected one are unsent.</li>
 *   <li>The entry with the rejected id is the error payload.</li>
 *   <li>Older entries were processed and are not reported.</li>
 * </ul>
 *
 * <p>If the event carries no id (transport failure) or an id that is no longer
 * retained, every retained entry is reported as unsent. The overflow flag is
 * then raised only if the buffer had evicted entries, because only then can
 * the failure point lie outside the retained history. A non-zero id that
 * matches nothing although nothing was evicted (a peer reporting an id this
 * connection never sent) also reports everything as unsent, with the flag
 * clear.</p>
 *
 * <p>A locally raised encoding failure names the payload that could not be
 * encoded, but confirms nothing about older entries: they may still have been
 * buffered, or written without the peer ever processing them. The offending
 * entry becomes the error payload and every other retained entry is unsent;
 * the flag follows eviction.</p>
 *
 * <p>Not thread-safe. Confined to the connection driver thread.</p>
 */
public final class ReplayTracker
{
    private final NotificationIdSequence ids;
    private final ReplayBuffer history;

    public ReplayTracker(int capacity)
    {
        this(new NotificationIdSequence(), new ReplayBuffer(capacity));
    }

    ReplayTracker(NotificationIdSequence ids, ReplayBuffer history)
    {
        this.ids = Objects.requireNonNull(ids, "ids");
        this.history = Objects.requireNonNull(history, "history");
    }

    /**
     * Assign the next id to {@code payload} and retain it.
     */
    public IdentifiedPayload track(Payload payload)
    {
        IdentifiedPayload identified = new IdentifiedPayload(payload, ids.next());
        history.record(identified);
        return identified;
    }

    /**
     * Partition the retained history against the terminal {@code error}.
     */
    public CloseResult resolve(PushErrorEvent error)
    {
        Objects.requireNonNull(error, "error");

        // Only the peer confirms that entries older than the rejected one were processed.
        boolean confirmsOlder = error.source() == PushErrorEvent.Source.PEER;

        List<Payload> unsentNewestFirst = new ArrayList<>();
        Payload errorPayload = null;

        Iterator<IdentifiedPayload> it = history.newestFirst();
        while (it.hasNext()) {
            IdentifiedPayload entry = it.next();
            if (errorPayload == null && error.hasNotificationId() && entry.id() == error.notificationId()) {
                errorPayload = entry.payload();
                if (confirmsOlder) {
                    break;
                }
                continue;
            }
            unsentNewestFirst.add(entry.payload());
        }

        Collections.reverse(unsentNewestFirst);
        boolean overflow = (errorPayload == null || !confirmsOlder) && history.hasEvicted();

        return new CloseResult(error, unsentNewestFirst, Optional.ofNullable(errorPayload), overflow);
    }

    public int retained()
    {
        return history.size();
    }

    public long evicted()
    {
        return history.evictedCount();
    }
}
