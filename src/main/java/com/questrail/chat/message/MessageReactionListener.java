package com.questrail.chat.message;

/**
 * Callback for reaction summary changes.
 */
@FunctionalInterface
public interface MessageReactionListener
{
    void onSummary(MessageReactionSummaryEvent event);
}
