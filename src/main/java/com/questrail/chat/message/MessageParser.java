package com.questrail.chat.message;

import com.questrail.chat.api.ChatException;
import com.questrail.chat.api.ErrorInfo;
import com.questrail.chat.channel.InboundMessage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns decoded channel messages into {@link Message} values and reaction
 * summaries.
 *
 * <p>Expected layout of a chat message:</p>
 * <pre>
 *   data   = { text: string, metadata?: map }
 *   extras = { headers?: map, operation?: { clientId?, description?, metadata? } }
 * </pre>
 * The creation time is the timestamp encoded in the message serial.
 *
 * <p>A reaction summary arrives with action {@value #SUMMARY_ACTION}; its data
 * holds one map per counting rule ({@code unique}, {@code distinct},
 * {@code multiple}) from reaction to {@code {total, clientIds, clipped}}.</p>
 */
public final class MessageParser
{
    public static final String MESSAGE_NAME = "chat.message";
    public static final String SUMMARY_ACTION = "message.summary";

    private static final int PARSE_ERROR_CODE = 50000;
    private static final int PARSE_ERROR_STATUS = 500;

    private MessageParser() {}

    public static boolean isSummary(InboundMessage inbound) {
        return SUMMARY_ACTION.equals(inbound.action());
    }

    /**
     * @throws ChatException if a required field is missing or malformed
     */
    public static Message parse(InboundMessage inbound) {
        if (inbound.clientId() == null) {
            throw parseError("received incoming message without clientId");
        }
        Object text = inbound.data().get("text");
        if (!(text instanceof String)) {
            throw parseError("received incoming message without text");
        }
        if (inbound.serial() == null) {
            throw parseError("received incoming message without serial");
        }
        if (inbound.version() == null) {
            throw parseError("received incoming message without version");
        }
        if (inbound.timestamp() == null) {
            throw parseError("received incoming message without timestamp");
        }
        MessageAction action = MessageAction.fromWire(inbound.action())
                .orElseThrow(() -> parseError("received incoming message with unhandled action; " + inbound.action()));

        Serial serial = Serial.parse(inbound.serial());
        Serial.parse(inbound.version());

        Map<String, Object> operation = mapOf(inbound.extras().get("operation"));
        Version version = new Version(
                inbound.version(),
                stringOf(operation.get("clientId")).orElse(null),
                stringOf(operation.get("description")).orElse(null),
                stringMapOf(operation.get("metadata")),
                inbound.timestamp());

        return new Message(
                inbound.serial(),
                inbound.clientId(),
                (String) text,
                Instant.ofEpochMilli(serial.timestamp()),
                mapOf(inbound.data().get("metadata")),
                mapOf(inbound.extras().get("headers")),
                action,
                version,
                MessageReactions.empty());
    }

    /**
     * @throws ChatException if the summary has no serial or a malformed tally
     */
    public static MessageReactionSummaryEvent parseSummary(InboundMessage inbound) {
        if (inbound.serial() == null) {
            throw parseError("received reaction summary without serial");
        }
        MessageReactions reactions = new MessageReactions(
                tallies(inbound.data().get("unique")),
                tallies(inbound.data().get("distinct")),
                tallies(inbound.data().get("multiple")));
        return new MessageReactionSummaryEvent(inbound.serial(), inbound.timestamp(), reactions);
    }

    private static Map<String, ReactionTally> tallies(Object raw) {
        Map<String, Object> byReaction = mapOf(raw);
        Map<String, ReactionTally> result = new HashMap<>();
        for (Map.Entry<String, Object> entry : byReaction.entrySet()) {
            Map<String, Object> tally = mapOf(entry.getValue());
            Object total = tally.get("total");
            if (!(total instanceof Number)) {
                throw parseError("reaction summary for '" + entry.getKey() + "' has no total");
            }
            List<String> clientIds = new ArrayList<>();
            if (tally.get("clientIds") instanceof List<?> ids) {
                for (Object id : ids) {
                    clientIds.add(String.valueOf(id));
                }
            }
            boolean clipped = Boolean.TRUE.equals(tally.get("clipped"));
            result.put(entry.getKey(), new ReactionTally(((Number) total).intValue(), clientIds, clipped));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> mapOf(Object raw) {
        if (raw instanceof Map<?, ?>) {
            return (Map<String, Object>) raw;
        }
        return Map.of();
    }

    private static Map<String, String> stringMapOf(Object raw) {
        Map<String, String> result = new HashMap<>();
        mapOf(raw).forEach((k, v) -> result.put(k, String.valueOf(v)));
        return result;
    }

    private static Optional<String> stringOf(Object raw) {
        return raw instanceof String s ? Optional.of(s) : Optional.empty();
    }

    private static ChatException parseError(String message) {
        return new ChatException(new ErrorInfo(message, PARSE_ERROR_CODE, PARSE_ERROR_STATUS));
    }
}
