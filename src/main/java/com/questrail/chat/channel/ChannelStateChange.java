package com.questrail.chat.channel;

import com.questrail.chat.api.ErrorInfo;

import java.util.Objects;
import java.util.Optional;

/**
 * ChannelStateChange
 * -----------------------------------------------------------------------------
 * Transient notification emitted by a {@link ChannelHandle} when its state
 * changes, or when continuity is affected while the state stays the same.
 *
 * <h2>Base transitions vs updates</h2>
 * A base transition moves the channel from {@code previous} to a different
 * {@code current}. An <em>update</em> ({@code update == true}) leaves the state
 * unchanged but reports something about it, typically that the channel was
 * re-attached in place and messages may have been lost.
 *
 * <h2>Resumption</h2>
 * {@code resumed == false} on an attached transition or update means the
 * channel could not guarantee message continuity across the gap.
 *
 * @param previous the state before the change
 * @param current  the state after the change
 * @param resumed  whether message continuity was preserved
 * @param reason   the reason for the change, if any
 * @param update   whether this is an in-place update rather than a transition
 */
public record ChannelStateChange(
        ChannelState previous,
        ChannelState current,
        boolean resumed,
        ErrorInfo reason,
        boolean update
) {
    public ChannelStateChange {
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(current, "current");
    }

    public static ChannelStateChange transition(ChannelState previous, ChannelState current,
                                                boolean resumed, ErrorInfo reason) {
        return new ChannelStateChange(previous, current, resumed, reason, false);
    }

    public static ChannelStateChange update(ChannelState state, boolean resumed, ErrorInfo reason) {
        return new ChannelStateChange(state, state, resumed, reason, true);
    }

    public Optional<ErrorInfo> reasonInfo() {
        return Optional.ofNullable(reason);
    }
}
