package com.questrail.chat.api;

import com.questrail.chat.config.RoomOptions;
import com.questrail.chat.message.Messages;
import com.questrail.chat.typing.Typing;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Room
 * -----------------------------------------------------------------------------
 * A named chat room backed by one realtime channel.
 *
 * <h2>Lifecycle</h2>
 * A room starts {@link RoomStatus#INITIALIZED}. {@link #attach()} and
 * {@link #detach()} move it between attached and detached; the realtime
 * client may move it on its own (suspended, failed, re-attached). Releasing a
 * room is done through the runtime's room registry and is final.
 *
 * <h2>Discontinuities</h2>
 * When the room re-attaches without being able to guarantee that no messages
 * were missed, {@link #onDiscontinuity(DiscontinuityListener)} listeners are
 * told so they can re-fetch what they need.
 */
public interface Room extends EmitsDiscontinuities
{
    String name();

    RoomOptions options();

    RoomStatus status();

    /**
     * @return the error that put the room into its current status; present
     *         only while {@link RoomStatus#SUSPENDED} or {@link RoomStatus#FAILED}
     */
    Optional<ErrorInfo> error();

    StatusSubscription onStatusChange(RoomStatusListener listener);

    CompletableFuture<Void> attach();

    CompletableFuture<Void> detach();

    Messages messages();

    Typing typing();
}
