package com.questrail.chat.api;

import java.util.Optional;

/**
 * Read-only view of a room's lifecycle status.
 * <p>
 * This is the view handed to feature and UI code. Only the lifecycle manager
 * writes the status.
 */
public interface RoomLifecycle
{
    /**
     * @return the current status
     */
    RoomStatus status();

    /**
     * @return the error that caused the current status; present only while the
     *         room is {@link RoomStatus#SUSPENDED} or {@link RoomStatus#FAILED}
     */
    Optional<ErrorInfo> error();

    /**
     * Registers a listener called on every status change.
     */
    StatusSubscription onChange(RoomStatusListener listener);
}
