package com.questrail.chat.observability;

import com.questrail.chat.api.RoomStatusChange;

import java.time.Instant;

/**
 * Record representing a room status transition.
 */
public record RoomStatusTransitionEvent(
    Instant timestamp,
    String roomName,
    RoomStatusChange change
) {
    /**
     * Checks if the status actually changed (an in-place update may re-report
     * the same status).
     */
    public boolean isStatusChange() {
        return change.current() != change.previous();
    }
}
