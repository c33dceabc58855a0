package com.questrail.chat.observability;

/**
 * No-op implementation of RoomObservabilitySink.
 */
public final class NullObservabilitySink implements RoomObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStatusTransition(RoomStatusTransitionEvent event) {}

    @Override
    public void onDiscontinuity(RoomDiscontinuityEvent event) {}

    @Override
    public void onOperationEvent(RoomOperationEvent event) {}

    @Override
    public void onError(RoomErrorEvent event) {}
}
