package com.questrail.chat.message;

/**
 * Callback for message creations, updates and deletions.
 */
@FunctionalInterface
public interface MessageListener
{
    void onMessage(MessageEvent event);
}
