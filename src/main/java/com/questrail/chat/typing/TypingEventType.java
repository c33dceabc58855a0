package com.questrail.chat.typing;

import java.util.Optional;

/**
 * Typing signals exchanged on the room channel.
 */
public enum TypingEventType
{
    STARTED("typing.started"),
    STOPPED("typing.stopped");

    private final String wireName;

    TypingEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<TypingEventType> fromWire(String name) {
        for (TypingEventType type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
