package com.questrail.chat.api;

/**
 * Error codes raised by the chat room library.
 * <p>
 * Codes below 100000 are shared with the realtime service; the 102xxx range
 * belongs to rooms and their features.
 */
public enum ErrorCode
{
    /** The request was invalid. */
    BAD_REQUEST(40000),

    /** An argument was malformed (for example an unparseable serial). */
    INVALID_ARGUMENT(40003),

    /** The client is not connected to the realtime service. */
    DISCONNECTED(80003),

    MESSAGES_ATTACHMENT_FAILED(102001),
    PRESENCE_ATTACHMENT_FAILED(102002),
    REACTIONS_ATTACHMENT_FAILED(102003),
    OCCUPANCY_ATTACHMENT_FAILED(102004),
    TYPING_ATTACHMENT_FAILED(102005),

    MESSAGES_DETACHMENT_FAILED(102050),
    PRESENCE_DETACHMENT_FAILED(102051),
    REACTIONS_DETACHMENT_FAILED(102052),
    OCCUPANCY_DETACHMENT_FAILED(102053),
    TYPING_DETACHMENT_FAILED(102054),

    /** The room has experienced a discontinuity. */
    ROOM_DISCONTINUITY(102100),

    /** Cannot perform the operation, the room is failed. */
    ROOM_IN_FAILED_STATE(102101),

    /** Cannot perform the operation, the room is releasing. */
    ROOM_IS_RELEASING(102102),

    /** Cannot perform the operation, the room is released. */
    ROOM_IS_RELEASED(102103),

    /** The room was released before an attach or detach completed. */
    ROOM_RELEASED_BEFORE_OPERATION_COMPLETED(102106),

    /** Channel options were changed after the channel was requested. */
    CHANNEL_OPTIONS_CANNOT_BE_MODIFIED(102111),

    /** Sequential execution of an operation could not be enforced. */
    OPERATION_SERIALIZATION_FAILED(102113);

    private final int code;

    ErrorCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
