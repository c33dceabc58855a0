package com.questrail.chat.api;

/**
 * Receives discontinuity notifications.
 * <p>
 * The supplied error has code {@link ErrorCode#ROOM_DISCONTINUITY}; its cause,
 * if present, is the reason reported by the channel.
 */
@FunctionalInterface
public interface DiscontinuityListener
{
    void onDiscontinuity(ErrorInfo reason);
}
