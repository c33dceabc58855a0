package com.questrail.chat.api;

/**
 * Something that can tell listeners when message continuity has been lost.
 */
public interface EmitsDiscontinuities
{
    /**
     * Registers a listener for discontinuity events.
     *
     * @param listener called once per detected discontinuity
     * @return a subscription whose {@code off()} deregisters the listener
     */
    StatusSubscription onDiscontinuity(DiscontinuityListener listener);
}
