package com.questrail.chat.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Typing indicator timing.
 *
 * @param heartbeatThrottle minimum spacing between repeated "started typing"
 *                          publishes from this client
 * @param inactivityTimeout grace period added to the throttle before another
 *                          client is considered to have stopped typing
 */
public record TypingOptions(Duration heartbeatThrottle, Duration inactivityTimeout)
{
    public TypingOptions {
        Objects.requireNonNull(heartbeatThrottle, "heartbeatThrottle");
        Objects.requireNonNull(inactivityTimeout, "inactivityTimeout");

        if (heartbeatThrottle.isNegative() || heartbeatThrottle.isZero()) {
            throw new IllegalArgumentException("heartbeatThrottle must be positive");
        }
        if (inactivityTimeout.isNegative()) {
            throw new IllegalArgumentException("inactivityTimeout must be non-negative");
        }
    }

    public static TypingOptions defaults() {
        return new TypingOptions(Duration.ofSeconds(10), Duration.ofSeconds(2));
    }

    /**
     * How long a remote client stays in the typing set without a heartbeat.
     */
    public Duration remoteTypingTimeout() {
        return heartbeatThrottle.plus(inactivityTimeout);
    }
}
