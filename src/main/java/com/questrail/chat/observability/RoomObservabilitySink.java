package com.questrail.chat.observability;

/**
 * Main interface for receiving room observability events.
 * Implementations can provide logging, metrics, or tracing.
 * <p>
 * Callbacks run on the room's event loop and must not block.
 */
public interface RoomObservabilitySink {
    /**
     * Called when the room status changes.
     * @param event the transition details
     */
    void onStatusTransition(RoomStatusTransitionEvent event);

    /**
     * Called when a discontinuity is detected and about to be delivered to listeners.
     * @param event the discontinuity details
     */
    void onDiscontinuity(RoomDiscontinuityEvent event);

    /**
     * Called for operational events such as ignored notifications or scheduled retries.
     * @param event the operational event
     */
    void onOperationEvent(RoomOperationEvent event);

    /**
     * Called when an error or anomaly occurs.
     * @param event the error event
     */
    void onError(RoomErrorEvent event);
}
