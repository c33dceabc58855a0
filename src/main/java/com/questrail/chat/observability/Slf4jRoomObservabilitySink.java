package com.questrail.chat.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RoomObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jRoomObservabilitySink implements RoomObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRoomObservabilitySink.class);

    @Override
    public void onStatusTransition(RoomStatusTransitionEvent event) {
        if (event.isStatusChange()) {
            log.info("Room {}: status {} -> {}{}",
                event.roomName(),
                event.change().previous(),
                event.change().current(),
                event.change().error() != null ? " (" + event.change().error() + ")" : "");
        } else {
            log.debug("Room {}: status {} re-reported", event.roomName(), event.change().current());
        }
    }

    @Override
    public void onDiscontinuity(RoomDiscontinuityEvent event) {
        log.warn("Room {}: discontinuity detected: {}", event.roomName(), event.error());
    }

    @Override
    public void onOperationEvent(RoomOperationEvent event) {
        if (event instanceof RoomOperationEvent.ReleaseRetryScheduled retry) {
            log.warn("Room {}: release detach attempt {} failed, retrying in {}ms",
                retry.roomName(), retry.failedAttempt(), retry.delayMillis());
        } else {
            log.debug("Room event: {}", event);
        }
    }

    @Override
    public void onError(RoomErrorEvent event) {
        log.error("Room {}: {} {}", event.roomName(), event.message(),
            event.error() != null ? event.error() : "", event.cause());
    }
}
