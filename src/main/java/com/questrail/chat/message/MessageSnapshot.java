package com.questrail.chat.message;

import java.util.List;

/**
 * An immutable view of the message window at one point in time, oldest
 * message first.
 * <p>
 * The window publishes a new snapshot instance on every effective change, so
 * consumers may compare snapshots by reference.
 */
public record MessageSnapshot(List<Message> messages)
{
    public MessageSnapshot {
        messages = List.copyOf(messages);
    }

    public static MessageSnapshot empty() {
        return new MessageSnapshot(List.of());
    }

    public int size() {
        return messages.size();
    }
}
