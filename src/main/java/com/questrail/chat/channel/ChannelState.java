package com.questrail.chat.channel;

/**
 * States of a realtime channel, as reported by the realtime collaborator.
 */
public enum ChannelState
{
    INITIALIZED,
    ATTACHING,
    ATTACHED,
    DETACHING,
    DETACHED,
    SUSPENDED,
    FAILED
}
