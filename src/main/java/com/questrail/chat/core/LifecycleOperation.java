package com.questrail.chat.core;

/**
 * The lifecycle operation currently running on a room.
 * <p>
 * While anything other than {@link #NONE} runs, unsolicited channel
 * notifications do not change the room status: the operation's own completion
 * decides it.
 */
public enum LifecycleOperation
{
    NONE,
    ATTACHING,
    DETACHING,
    RELEASING;

    public boolean inFlight() {
        return this != NONE;
    }
}
