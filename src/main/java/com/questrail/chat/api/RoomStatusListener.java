package com.questrail.chat.api;

/**
 * Receives room status changes.
 */
@FunctionalInterface
public interface RoomStatusListener
{
    void onStatusChange(RoomStatusChange change);
}
