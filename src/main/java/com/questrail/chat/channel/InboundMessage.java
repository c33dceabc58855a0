package com.questrail.chat.channel;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A message delivered by the realtime collaborator.
 * <p>
 * The collaborator has already decoded the wire representation; this record
 * carries the decoded fields the chat features read. Optional string fields
 * are {@code null} when absent.
 *
 * @param name      the message name (for example {@code chat.message})
 * @param clientId  the publishing client, if known
 * @param serial    the message serial, for chat messages
 * @param action    the message action, for chat messages
 * @param version   the version serial, for chat messages
 * @param timestamp when this version was produced
 * @param data      the decoded payload
 * @param extras    the decoded extras (headers, operation details)
 */
public record InboundMessage(
        String name,
        String clientId,
        String serial,
        String action,
        String version,
        Instant timestamp,
        Map<String, Object> data,
        Map<String, Object> extras
) {
    public InboundMessage {
        Objects.requireNonNull(name, "name");
        data = copyOf(data);
        extras = copyOf(extras);
    }

    /**
     * Builds an ephemeral message such as a typing signal: name and sender only.
     */
    public static InboundMessage ephemeral(String name, String clientId) {
        return new InboundMessage(name, clientId, null, null, null, null, Map.of(), Map.of());
    }

    // Decoded JSON may hold null values.
    private static Map<String, Object> copyOf(Map<String, Object> map) {
        if (map == null || map.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
