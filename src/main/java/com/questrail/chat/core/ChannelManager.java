package com.questrail.chat.core;

import com.questrail.chat.api.ChatException;
import com.questrail.chat.api.ErrorCode;
import com.questrail.chat.channel.ChannelHandle;
import com.questrail.chat.channel.ChannelOptions;
import com.questrail.chat.channel.ChannelProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Owns the room's relationship with its single channel.
 *
 * <ul>
 *   <li>Features merge their channel options in before the channel is first
 *       requested; afterwards the options are frozen.</li>
 *   <li>{@link #get()} requests the channel once and memoises it.</li>
 *   <li>{@link #release()} hands the channel back to the provider.</li>
 * </ul>
 */
public final class ChannelManager
{
    private static final Logger log = LoggerFactory.getLogger(ChannelManager.class);

    static final String CHANNEL_SUFFIX = "::$chat";

    private final String channelName;
    private final ChannelProvider provider;

    private ChannelOptions options = ChannelOptions.defaults();
    private ChannelHandle channel;
    private boolean released;

    public ChannelManager(String roomName, ChannelProvider provider) {
        this.channelName = Objects.requireNonNull(roomName, "roomName") + CHANNEL_SUFFIX;
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    public static String channelNameFor(String roomName) {
        return roomName + CHANNEL_SUFFIX;
    }

    public String channelName() {
        return channelName;
    }

    public synchronized void mergeOptions(UnaryOperator<ChannelOptions> merger) {
        Objects.requireNonNull(merger, "merger");
        if (channel != null) {
            throw ChatException.of(ErrorCode.CHANNEL_OPTIONS_CANNOT_BE_MODIFIED, 400,
                    "channel options cannot be modified after the channel has been requested");
        }
        options = Objects.requireNonNull(merger.apply(options), "merged options");
    }

    public synchronized ChannelOptions options() {
        return options;
    }

    public synchronized ChannelHandle get() {
        if (channel == null) {
            log.trace("Requesting channel {} with {}", channelName, options);
            channel = provider.get(channelName, options);
        }
        return channel;
    }

    /**
     * Returns the channel to the provider. Subsequent calls are no-ops.
     */
    public synchronized void release() {
        if (released) {
            return;
        }
        log.trace("Releasing channel {}", channelName);
        provider.release(channelName);
        released = true;
    }
}
