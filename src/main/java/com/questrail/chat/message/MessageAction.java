package com.questrail.chat.message;

import java.util.Optional;

/**
 * What happened to a message most recently.
 */
public enum MessageAction
{
    CREATED("message.create"),
    UPDATED("message.update"),
    DELETED("message.delete");

    private final String wireName;

    MessageAction(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return the action name used on the channel
     */
    public String wireName() {
        return wireName;
    }

    public static Optional<MessageAction> fromWire(String name) {
        for (MessageAction action : values()) {
            if (action.wireName.equals(name)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
