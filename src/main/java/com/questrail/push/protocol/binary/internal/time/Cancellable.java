package com.questrail.push.protocol.binary.internal.time;

/**
 * Handle for a scheduled flush timer.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if the task will not run; {@code false} if it already
     *         ran or was cancelled before.
     */
    boolean cancel();
}
