package com.questrail.chat.channel;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Options used when the room requests its channel from the
 * {@link ChannelProvider}.
 *
 * @param params            channel parameters passed to the service
 * @param modes             requested channel modes
 * @param attachOnSubscribe whether subscribing implicitly attaches the channel;
 *                          always {@code false} for rooms, which attach explicitly
 */
public record ChannelOptions(Map<String, String> params, Set<ChannelMode> modes, boolean attachOnSubscribe)
{
    public enum ChannelMode {
        PUBLISH,
        SUBSCRIBE,
        PRESENCE,
        PRESENCE_SUBSCRIBE,
        ANNOTATION_PUBLISH,
        ANNOTATION_SUBSCRIBE
    }

    public ChannelOptions {
        params = Map.copyOf(Objects.requireNonNull(params, "params"));
        Objects.requireNonNull(modes, "modes");
        modes = modes.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(modes));
    }

    /**
     * Defaults for a chat room channel: publish and subscribe, no implicit attach.
     */
    public static ChannelOptions defaults() {
        return new ChannelOptions(Map.of(), EnumSet.of(ChannelMode.PUBLISH, ChannelMode.SUBSCRIBE), false);
    }

    public ChannelOptions withParam(String key, String value) {
        Map<String, String> merged = new HashMap<>(params);
        merged.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
        return new ChannelOptions(merged, modes, attachOnSubscribe);
    }

    public ChannelOptions withMode(ChannelMode mode) {
        EnumSet<ChannelMode> merged = modes.isEmpty() ? EnumSet.noneOf(ChannelMode.class) : EnumSet.copyOf(modes);
        merged.add(Objects.requireNonNull(mode, "mode"));
        return new ChannelOptions(params, merged, attachOnSubscribe);
    }
}
