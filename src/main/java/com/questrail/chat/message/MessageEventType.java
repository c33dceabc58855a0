package com.questrail.chat.message;

/**
 * Kinds of {@link MessageEvent}.
 */
public enum MessageEventType
{
    CREATED,
    UPDATED,
    DELETED;

    public static MessageEventType forAction(MessageAction action) {
        switch (action) {
            case CREATED:
                return CREATED;
            case UPDATED:
                return UPDATED;
            case DELETED:
            default:
                return DELETED;
        }
    }
}
