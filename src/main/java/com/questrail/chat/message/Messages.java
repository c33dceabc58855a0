package com.questrail.chat.message;

import com.questrail.chat.api.Subscription;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Messages of one room.
 * <p>
 * The room must be attached to receive events.
 */
public interface Messages
{
    Subscription subscribe(MessageListener listener);

    Subscription subscribeReactionSummaries(MessageReactionListener listener);

    /**
     * Publishes a new message.
     *
     * @param metadata free-form metadata, may be empty
     * @param headers  headers, may be empty
     */
    CompletableFuture<Void> send(String text, Map<String, Object> metadata, Map<String, Object> headers);

    default CompletableFuture<Void> send(String text) {
        return send(text, Map.of(), Map.of());
    }

    /**
     * @return the live window fed by this feature's events
     */
    MessageWindow window();
}
