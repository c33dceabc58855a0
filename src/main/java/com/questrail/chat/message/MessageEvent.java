package com.questrail.chat.message;

import java.util.Objects;

/**
 * A message was created, updated or deleted.
 *
 * @param type    what happened
 * @param message the message as of this event
 */
public record MessageEvent(MessageEventType type, Message message)
{
    public MessageEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(message, "message");
    }

    public static MessageEvent of(Message message) {
        return new MessageEvent(MessageEventType.forAction(message.action()), message);
    }
}
