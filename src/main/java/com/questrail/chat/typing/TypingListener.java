package com.questrail.chat.typing;

/**
 * Callback for changes to the set of typing clients.
 */
@FunctionalInterface
public interface TypingListener
{
    void onTypingChanged(TypingSetEvent event);
}
