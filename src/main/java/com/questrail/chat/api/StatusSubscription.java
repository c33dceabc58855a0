package com.questrail.chat.api;

/**
 * Handle returned when registering a status or discontinuity listener.
 * <p>
 * {@link #off()} is idempotent.
 */
@FunctionalInterface
public interface StatusSubscription
{
    void off();
}
