package com.questrail.chat.channel;

import java.util.Map;
import java.util.Objects;

/**
 * A message to publish on a {@link ChannelHandle}.
 *
 * @param name      the message name
 * @param data      payload
 * @param extras    transport extras such as headers
 * @param ephemeral whether the service should skip persistence for this message
 */
public record OutboundMessage(String name, Map<String, Object> data, Map<String, Object> extras, boolean ephemeral)
{
    public OutboundMessage {
        Objects.requireNonNull(name, "name");
        data = data == null ? Map.of() : Map.copyOf(data);
        extras = extras == null ? Map.of() : Map.copyOf(extras);
    }

    public static OutboundMessage ephemeral(String name) {
        return new OutboundMessage(name, Map.of(), Map.of(), true);
    }
}
