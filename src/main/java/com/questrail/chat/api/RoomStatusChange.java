package com.questrail.chat.api;

import java.util.Objects;
import java.util.Optional;

/**
 * A change in the status of a room.
 *
 * @param current  the new status
 * @param previous the status before the change
 * @param error    the reason the room entered {@code current}, if any
 */
public record RoomStatusChange(RoomStatus current, RoomStatus previous, ErrorInfo error)
{
    public RoomStatusChange {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(previous, "previous");
    }

    public Optional<ErrorInfo> errorInfo() {
        return Optional.ofNullable(error);
    }
}
