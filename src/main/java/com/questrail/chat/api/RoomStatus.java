package com.questrail.chat.api;

/**
 * RoomStatus
 * -----------------------------------------------------------------------------
 * {@code RoomStatus} is the externally observable lifecycle phase of a
 * {@link Room}.
 *
 * <h2>Purpose</h2>
 * Seven of the nine values mirror the states of the underlying realtime
 * channel one-to-one. The remaining two ({@link #RELEASING} and
 * {@link #RELEASED}) exist only at the room level: they describe the room
 * handing its channel back to the owning client.
 *
 * <h2>Errors</h2>
 * A room only carries an error while it is {@link #SUSPENDED} or
 * {@link #FAILED}. See {@link #carriesError()}.
 *
 * <h2>Terminal state</h2>
 * {@link #RELEASED} is terminal. No transition out of it is permitted.
 */
public enum RoomStatus
{
    /**
     * The room object has been created but no attach has been attempted.
     */
    INITIALIZED,

    /**
     * The room is attempting to attach to its channel.
     */
    ATTACHING,

    /**
     * The room is attached and receiving events.
     */
    ATTACHED,

    /**
     * The room is detaching from its channel.
     */
    DETACHING,

    /**
     * The room is detached and will not receive events.
     */
    DETACHED,

    /**
     * The room is in an extended period of detachment, but will attempt to
     * re-attach when able.
     */
    SUSPENDED,

    /**
     * The room is detached and will not re-attach on its own. User
     * intervention is required.
     */
    FAILED,

    /**
     * The room is handing its channel back. Operations other than
     * {@code release()} are rejected.
     */
    RELEASING,

    /**
     * The room has been released and is no longer usable.
     */
    RELEASED;

    /**
     * @return {@code true} if a room in this status must carry an error
     */
    public boolean carriesError() {
        return this == SUSPENDED || this == FAILED;
    }

    /**
     * @return {@code true} if no further transitions are permitted
     */
    public boolean isTerminal() {
        return this == RELEASED;
    }
}
