package com.questrail.chat.channel;

import java.util.concurrent.CompletionStage;

/**
 * ChannelHandle
 * -----------------------------------------------------------------------------
 * Port for one named realtime channel owned by the external realtime client.
 *
 * <p>This interface is intentionally small. Higher layers are responsible for:</p>
 * <ul>
 *   <li>deciding when to attach and detach</li>
 *   <li>translating state changes into room status</li>
 *   <li>detecting loss of message continuity</li>
 * </ul>
 *
 * <h2>Failures</h2>
 * {@link #attach()}, {@link #detach()} and {@link #publish(OutboundMessage)}
 * complete exceptionally on failure. Implementations should fail with a
 * {@link com.questrail.chat.api.ChatException} so the transport's error code
 * and status code are preserved.
 *
 * <h2>Notification ordering</h2>
 * State-change notifications for a channel must be delivered in the order the
 * channel went through them. When an attach or detach causes a transition, the
 * notification must be delivered before the returned stage completes.
 */
public interface ChannelHandle
{
    /**
     * @return the channel name
     */
    String name();

    /**
     * @return the current channel state (synchronous read)
     */
    ChannelState state();

    CompletionStage<Void> attach();

    CompletionStage<Void> detach();

    CompletionStage<Void> publish(OutboundMessage message);

    /**
     * Registers a listener for all state changes and updates.
     */
    void on(ChannelStateListener listener);

    /**
     * Removes a previously registered state listener. Unknown listeners are ignored.
     */
    void off(ChannelStateListener listener);

    /**
     * Subscribes to inbound messages with the given name.
     */
    void subscribe(String name, InboundMessageListener listener);

    /**
     * Removes an inbound message listener from every name it was subscribed to.
     */
    void unsubscribe(InboundMessageListener listener);
}
