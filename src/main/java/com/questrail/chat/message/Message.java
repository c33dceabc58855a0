package com.questrail.chat.message;

import com.questrail.chat.api.ChatException;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Message
 * -----------------------------------------------------------------------------
 * Immutable chat message. Identity is the creation {@code serial}; every
 * mutation produces a new instance with a higher {@link Version}.
 *
 * <h2>Applying events</h2>
 * {@link #with(MessageEvent)} and {@link #with(MessageReactionSummaryEvent)}
 * return {@code this} (the same reference) when the event changes nothing, so
 * callers can detect change with {@code !=}. Applying is idempotent under
 * replay and converges under out-of-order delivery: whatever the arrival
 * order, the highest version wins.
 *
 * <h2>Comparisons</h2>
 * <ul>
 *   <li>{@link #isSameAs(Message)}: same logical message, any version</li>
 *   <li>{@link #before(Message)} / {@link #after(Message)}: global order by
 *       serial, defined for any two messages</li>
 *   <li>{@link #isOlderVersionOf(Message)} and friends: {@code false} when the
 *       messages are different messages</li>
 * </ul>
 * Ordering comparisons fail with
 * {@link com.questrail.chat.api.ErrorCode#INVALID_ARGUMENT} when a serial is
 * malformed.
 *
 * @param serial    creation serial, the message identity
 * @param clientId  who sent the message
 * @param text      message text
 * @param createdAt when the message was created
 * @param metadata  free-form metadata from the sender, never {@code null}
 * @param headers   headers from the sender, never {@code null}
 * @param action    the latest action applied
 * @param version   the latest version
 * @param reactions reaction aggregates, never {@code null}
 */
public record Message(
        String serial,
        String clientId,
        String text,
        Instant createdAt,
        Map<String, Object> metadata,
        Map<String, Object> headers,
        MessageAction action,
        Version version,
        MessageReactions reactions
) {
    public Message {
        Objects.requireNonNull(serial, "serial");
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(version, "version");
        metadata = copyOf(metadata);
        headers = copyOf(headers);
        reactions = reactions == null ? MessageReactions.empty() : reactions;
    }

    // ---------------------------------------------------------------------
    // Derived state
    // ---------------------------------------------------------------------

    public boolean isUpdated() {
        return action == MessageAction.UPDATED;
    }

    public boolean isDeleted() {
        return action == MessageAction.DELETED;
    }

    public Optional<String> updatedBy() {
        return isUpdated() ? Optional.ofNullable(version.clientId()) : Optional.empty();
    }

    public Optional<String> deletedBy() {
        return isDeleted() ? Optional.ofNullable(version.clientId()) : Optional.empty();
    }

    public Optional<Instant> updatedAt() {
        return isUpdated() ? Optional.ofNullable(version.timestamp()) : Optional.empty();
    }

    public Optional<Instant> deletedAt() {
        return isDeleted() ? Optional.ofNullable(version.timestamp()) : Optional.empty();
    }

    // ---------------------------------------------------------------------
    // Identity and order
    // ---------------------------------------------------------------------

    public boolean isSameAs(Message other) {
        return serial.equals(other.serial);
    }

    public boolean before(Message other) {
        return Serial.parse(serial).before(Serial.parse(other.serial));
    }

    public boolean after(Message other) {
        return Serial.parse(serial).after(Serial.parse(other.serial));
    }

    public boolean isOlderVersionOf(Message other) {
        return isSameAs(other) && version.compareTo(other.version) < 0;
    }

    public boolean isNewerVersionOf(Message other) {
        return isSameAs(other) && version.compareTo(other.version) > 0;
    }

    public boolean isSameVersionAs(Message other) {
        return isSameAs(other) && version.compareTo(other.version) == 0;
    }

    // ---------------------------------------------------------------------
    // Applying events
    // ---------------------------------------------------------------------

    /**
     * Returns this message with an update or delete applied.
     *
     * @return {@code this} if the event's version is not newer, otherwise the
     *         event's message carrying this message's reactions over
     * @throws ChatException with {@code INVALID_ARGUMENT} for a creation event
     *         or an event for a different message
     */
    public Message with(MessageEvent event) {
        Objects.requireNonNull(event, "event");
        if (event.type() == MessageEventType.CREATED) {
            throw ChatException.invalidArgument("cannot apply a created event to a message");
        }
        Message incoming = event.message();
        if (!isSameAs(incoming)) {
            throw ChatException.invalidArgument("cannot apply event for a different message");
        }
        if (version.compareTo(incoming.version) >= 0) {
            return this;
        }
        if (incoming.reactions.isEmpty() && !reactions.isEmpty()) {
            return incoming.withReactions(reactions);
        }
        return incoming;
    }

    /**
     * Returns this message with new reaction aggregates.
     *
     * @return {@code this} if the aggregates are unchanged
     * @throws ChatException with {@code INVALID_ARGUMENT} for a summary of a different message
     */
    public Message with(MessageReactionSummaryEvent event) {
        Objects.requireNonNull(event, "event");
        if (!serial.equals(event.refSerial())) {
            throw ChatException.invalidArgument("cannot apply reactions for a different message");
        }
        if (reactions.equals(event.reactions())) {
            return this;
        }
        return withReactions(event.reactions());
    }

    private Message withReactions(MessageReactions newReactions) {
        return new Message(serial, clientId, text, createdAt, metadata, headers, action, version, newReactions);
    }

    // Keeps null values, which inbound JSON may carry.
    private static Map<String, Object> copyOf(Map<String, Object> map) {
        if (map == null || map.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
