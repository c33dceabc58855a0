package com.questrail.chat.observability;

import com.questrail.chat.api.ErrorInfo;

import java.time.Instant;

/**
 * Record representing a detected loss of message continuity.
 */
public record RoomDiscontinuityEvent(
    Instant timestamp,
    String roomName,
    ErrorInfo error
) {
}
