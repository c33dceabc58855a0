package com.questrail.chat.channel;

/**
 * The realtime client's channel registry: hands out channels by name and takes
 * them back when a room is done with them.
 */
public interface ChannelProvider
{
    /**
     * Returns the channel with the given name, creating it with the supplied
     * options if it does not exist.
     */
    ChannelHandle get(String name, ChannelOptions options);

    /**
     * Releases the named channel and all resources the client holds for it.
     */
    void release(String name);
}
