package com.questrail.chat.channel;

/**
 * Callback for messages received on a {@link ChannelHandle}.
 */
@FunctionalInterface
public interface InboundMessageListener
{
    void onMessage(InboundMessage message);
}
