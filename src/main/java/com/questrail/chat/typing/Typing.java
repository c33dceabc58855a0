package com.questrail.chat.typing;

import com.questrail.chat.api.Subscription;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Typing indicators of one room.
 *
 * <p>{@link #keystroke()} and {@link #stop()} may be called in rapid
 * succession; only the most recent intent reaches the channel. A call that is
 * overtaken while waiting for an earlier one completes normally without
 * publishing anything.</p>
 */
public interface Typing
{
    /**
     * Signals that this client is typing. Repeated calls within the heartbeat
     * throttle publish nothing.
     */
    CompletableFuture<Void> keystroke();

    /**
     * Signals that this client stopped typing. A no-op if it was not typing.
     */
    CompletableFuture<Void> stop();

    /**
     * @return the clients currently typing
     */
    Set<String> current();

    Subscription subscribe(TypingListener listener);
}
