package com.questrail.chat.observability;

import java.time.Instant;

/**
 * Operational events that are neither status transitions nor errors.
 */
public sealed interface RoomOperationEvent
        permits RoomOperationEvent.NotificationIgnored, RoomOperationEvent.DiscontinuityMasked,
                RoomOperationEvent.ReleaseRetryScheduled
{
    Instant timestamp();

    String roomName();

    /** A channel notification arrived while an operation was in flight. */
    record NotificationIgnored(Instant timestamp, String roomName, String operation, String channelState)
            implements RoomOperationEvent {}

    /** A non-resumed attach followed an explicit detach and was not reported. */
    record DiscontinuityMasked(Instant timestamp, String roomName) implements RoomOperationEvent {}

    /** A release detach attempt failed and another one has been scheduled. */
    record ReleaseRetryScheduled(Instant timestamp, String roomName, int failedAttempt, long delayMillis)
            implements RoomOperationEvent {}
}
