package com.questrail.chat.channel;

/**
 * Callback for {@link ChannelHandle} state changes and updates.
 * <p>
 * Implementations of {@link ChannelHandle} may invoke this from any thread,
 * but must deliver notifications for one channel in order.
 */
@FunctionalInterface
public interface ChannelStateListener
{
    void onStateChange(ChannelStateChange change);
}
