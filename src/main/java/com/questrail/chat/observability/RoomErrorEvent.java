package com.questrail.chat.observability;

import com.questrail.chat.api.ErrorInfo;

import java.time.Instant;

/**
 * Record representing an error or anomaly in a room.
 *
 * @param error the error as reported to callers, if there is one
 * @param cause the underlying throwable, if there is one
 */
public record RoomErrorEvent(
    Instant timestamp,
    String roomName,
    String message,
    ErrorInfo error,
    Throwable cause
) {
}
