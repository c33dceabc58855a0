package com.questrail.chat.typing;

import java.util.Objects;
import java.util.Set;

/**
 * The set of clients currently typing changed.
 *
 * @param currentlyTyping every client typing after the change
 * @param change          the client whose state changed, and how
 */
public record TypingSetEvent(Set<String> currentlyTyping, Change change)
{
    public TypingSetEvent {
        currentlyTyping = Set.copyOf(currentlyTyping);
        Objects.requireNonNull(change, "change");
    }

    public record Change(String clientId, TypingEventType type) {
        public Change {
            Objects.requireNonNull(clientId, "clientId");
            Objects.requireNonNull(type, "type");
        }
    }
}
