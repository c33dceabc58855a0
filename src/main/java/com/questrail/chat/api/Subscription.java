package com.questrail.chat.api;

/**
 * Handle returned when subscribing to feature events (messages, typing,
 * message window snapshots).
 * <p>
 * {@link #unsubscribe()} is idempotent.
 */
@FunctionalInterface
public interface Subscription
{
    void unsubscribe();
}
